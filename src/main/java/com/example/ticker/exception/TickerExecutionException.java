package com.example.ticker.exception;

/**
 * TickerFunction 执行失败
 */
public class TickerExecutionException extends TickerException {

    public TickerExecutionException(String message, Object... args) {
        super("EXECUTION_FAILED", true, message, args);
    }

    public TickerExecutionException(Throwable cause, String message, Object... args) {
        super("EXECUTION_FAILED", true, cause, message, args);
    }
}
