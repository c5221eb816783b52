package com.example.ticker.exception;

public class TickerNotFoundException extends TickerException {

    public TickerNotFoundException(Long id) {
        super("NOT_FOUND", false, "Ticker not found: id=%s", id);
    }
}
