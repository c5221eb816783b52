package com.example.ticker.service;

import com.example.ticker.domain.TimeTicker;

import java.util.List;

/**
 * 批次完成回调：父 ticker 的所有子 ticker 均进入终态后调用，每个批次只调用一次。
 * "批次完成"在业务上意味着什么由实现方决定。
 */
public interface BatchCompletionListener {

    void onBatchCompleted(TimeTicker parent, List<TimeTicker> children);
}
