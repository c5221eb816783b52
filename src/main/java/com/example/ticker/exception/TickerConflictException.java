package com.example.ticker.exception;

/**
 * 条件更新未命中：行在读取之后已被其他 worker 修改，或当前状态不允许该迁移。
 * 属于并发轮询下的正常结果，不作为故障记录。
 */
public class TickerConflictException extends TickerException {

    private final Long tickerId;

    public TickerConflictException(Long tickerId, String message, Object... args) {
        super("CONFLICT", false, message, args);
        this.tickerId = tickerId;
    }

    public Long getTickerId() {
        return tickerId;
    }
}
