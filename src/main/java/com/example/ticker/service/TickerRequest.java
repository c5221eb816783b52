package com.example.ticker.service;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.sql.Timestamp;

/**
 * 创建 ticker 的参数。retries / retryIntervals 为空时取 ticker.retry.* 默认值。
 */
@Getter
@Builder
@ToString
public class TickerRequest {
    private final String function;
    private final String description;
    private final String request;
    private final Timestamp executionTime;
    private final Long batchParentId;
    private final Integer retries;
    private final String retryIntervals;
}
