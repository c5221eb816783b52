package com.example.ticker.service;

import com.example.ticker.config.TickerProperties;
import com.example.ticker.exception.TickerException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "ticker.poll", name = "enabled", havingValue = "true", matchIfMissing = true)
public class TickerPollScheduler {
    private final TickerEngine engine;
    private final TickerProperties props;

    private int consecutiveFailures;
    private long resumeAt;

    @Scheduled(fixedDelayString = "${ticker.poll.delay-ms:2000}", initialDelay = 3000L)
    public void tick() {
        tick(System.currentTimeMillis());
    }

    /**
     * 可重试的故障（存储不可用）按 delay * 2^n 退避，上限 backoff-max-ms，恢复后清零。
     * 不可重试的异常直接抛出，不进入退避。
     */
    boolean tick(long nowMs) {
        if (nowMs < resumeAt) return false;
        try {
            engine.pollAndRunOnce();
            if (consecutiveFailures > 0) {
                log.info("Ticker store reachable again after {} failed polls", consecutiveFailures);
            }
            consecutiveFailures = 0;
            resumeAt = 0;
            return true;
        } catch (TickerException e) {
            if (!e.isRetryable()) throw e;
            consecutiveFailures++;
            long backoff = backoffMs(consecutiveFailures);
            resumeAt = nowMs + backoff;
            log.warn("Poll pass aborted [{}] ({} in a row), next attempt in {}ms: {}",
                    e.getType(), consecutiveFailures, backoff, e.getMessage());
            return false;
        }
    }

    long backoffMs(int failures) {
        TickerProperties.Poll poll = props.getPoll();
        long base = Math.max(1, poll.getDelayMs());
        long backoff = base << Math.min(failures, 20);
        return Math.min(backoff, poll.getBackoffMaxMs());
    }

    int getConsecutiveFailures() {
        return consecutiveFailures;
    }
}
