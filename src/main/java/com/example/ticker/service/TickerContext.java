package com.example.ticker.service;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@RequiredArgsConstructor
public class TickerContext {
    private final Long tickerId;
    private final String function;
    private final String lockHolder;
    private final int retryCount;
    private final Long batchParentId;
}
