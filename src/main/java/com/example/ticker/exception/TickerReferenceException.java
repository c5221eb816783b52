package com.example.ticker.exception;

public class TickerReferenceException extends TickerException {

    public TickerReferenceException(String message, Object... args) {
        super("REFERENCE_NOT_FOUND", false, message, args);
    }
}
