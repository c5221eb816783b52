package com.example.ticker.exception;

/**
 * Ticker 异常基类
 * 带 type 与 retryable 标记，方便调用方区分冲突、引用错误与存储故障
 */
public class TickerException extends RuntimeException {

    private final String type;
    private final boolean retryable;

    protected TickerException(String type, boolean retryable, String message, Object... args) {
        this(type, retryable, null, message, args);
    }

    protected TickerException(String type, boolean retryable, Throwable cause, String message, Object... args) {
        super(format(message, args), cause);
        this.type = type;
        this.retryable = retryable;
    }

    public String getType() {
        return type;
    }

    public boolean isRetryable() {
        return retryable;
    }

    private static String format(String message, Object... args) {
        if (message == null) {
            return "";
        }
        if (args == null || args.length == 0) {
            return message;
        }
        return String.format(message, args);
    }
}
