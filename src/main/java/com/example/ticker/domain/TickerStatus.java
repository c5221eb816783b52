package com.example.ticker.domain;

import java.util.EnumSet;
import java.util.Set;

public enum TickerStatus {
    PENDING,     // 待执行（可领取）
    CLAIMED,     // 已被某个 worker 领取，尚未开始执行
    RUNNING,     // 执行中
    SUCCEEDED,   // 成功
    FAILED,      // 失败且重试次数已耗尽
    CANCELLED;   // 已取消（仅 PENDING 可取消）

    private static final Set<TickerStatus> TERMINAL = EnumSet.of(SUCCEEDED, FAILED, CANCELLED);
    private static final Set<TickerStatus> LOCKED = EnumSet.of(CLAIMED, RUNNING);

    public boolean isTerminal() {
        return TERMINAL.contains(this);
    }

    /**
     * lockHolder 只在这些状态下非空
     */
    public boolean isLocked() {
        return LOCKED.contains(this);
    }

    public static Set<TickerStatus> terminal() {
        return EnumSet.copyOf(TERMINAL);
    }

    public static Set<TickerStatus> locked() {
        return EnumSet.copyOf(LOCKED);
    }
}
