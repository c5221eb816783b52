package com.example.ticker.exception;

/**
 * 存储不可用（连接失败、事务无法开启等）。本轮轮询终止，由调用方退避后重试。
 */
public class TickerStoreUnavailableException extends TickerException {

    public TickerStoreUnavailableException(Throwable cause, String message, Object... args) {
        super("STORE_UNAVAILABLE", true, cause, message, args);
    }
}
