package com.example.ticker.service;

import com.example.ticker.config.TickerProperties;
import com.example.ticker.repo.TickerStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(MockitoExtension.class)
class TickerTxServiceTest {

    private static final Timestamp NOW = Timestamp.from(Instant.parse("2026-01-01T00:00:00Z"));

    @Mock
    private TickerStore store;

    private TickerTxService tx;

    @BeforeEach
    void setUp() {
        TickerProperties props = new TickerProperties();
        props.getRetry().setDefaultIntervalSeconds(30);
        tx = new TickerTxService(store, props, Optional.empty());
    }

    @Test
    void retryIntervalIsPickedByAttemptAndLastOneRepeats() {
        assertThat(tx.nextExecutionTime("10, 60,300", 0, NOW)).isEqualTo(plus(10));
        assertThat(tx.nextExecutionTime("10, 60,300", 1, NOW)).isEqualTo(plus(60));
        assertThat(tx.nextExecutionTime("10, 60,300", 7, NOW)).isEqualTo(plus(300));
    }

    @Test
    void missingOrBrokenIntervalsFallBackToDefault() {
        assertThat(tx.nextExecutionTime(null, 0, NOW)).isEqualTo(plus(30));
        assertThat(tx.nextExecutionTime("  ", 2, NOW)).isEqualTo(plus(30));
        assertThat(tx.nextExecutionTime("abc", 0, NOW)).isEqualTo(plus(30));
    }

    @Test
    void nullParentNeverPropagates() {
        assertThat(tx.propagateBatchTx(null)).isFalse();
    }

    private static Timestamp plus(long seconds) {
        return Timestamp.from(NOW.toInstant().plusSeconds(seconds));
    }
}
