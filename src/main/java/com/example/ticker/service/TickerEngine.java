package com.example.ticker.service;

import com.example.ticker.config.TickerProperties;
import com.example.ticker.domain.TickerStatus;
import com.example.ticker.domain.TimeTicker;
import com.example.ticker.exception.TickerConflictException;
import com.example.ticker.exception.TickerExecutionException;
import com.example.ticker.repo.StoreFailures;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.stereotype.Service;

import javax.annotation.PostConstruct;
import java.lang.management.ManagementFactory;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.Future;

@Slf4j
@Service
@RequiredArgsConstructor
public class TickerEngine {

    private final TickerTxService tx;                   // 短事务交给 TickerTxService
    private final TickerFunctionRegistry functions;
    private final ObjectMapper mapper;
    private final ThreadPoolTaskExecutor tickerExec;
    private final TickerProperties props;

    private String workerId;

    @PostConstruct
    public void init() {
        String configured = props.getWorkerId();
        workerId = (configured == null || configured.trim().isEmpty()) ? defaultWorkerId() : configured.trim();
        log.info("TickerEngine started: workerId={}, lease={}, functions={}",
                workerId, props.getLease(), functions.availableNames());
    }

    /**
     * 一轮轮询：扫描候选 → 逐行条件领取 → 提交线程池执行。
     * 领取冲突跳到下一行；存储不可用时抛出 TickerStoreUnavailableException 结束本轮，已提交的执行不受影响。
     *
     * @return 本轮已提交的执行
     */
    public List<Future<?>> pollAndRunOnce() {
        List<TimeTicker> candidates;
        try {
            candidates = tx.findCandidatesTx(tsNow(), props.getPoll().getBatchSize());
        } catch (RuntimeException e) {
            throw StoreFailures.translate(e, "scan");
        }
        if (candidates.isEmpty()) return Collections.emptyList();

        List<Future<?>> submitted = new ArrayList<>();
        for (TimeTicker candidate : candidates) {
            TimeTicker claimed;
            try {
                claimed = tx.claimTx(candidate, workerId);
            } catch (TickerConflictException e) {
                log.debug("Claim lost, skip ticker id={}: {}", e.getTickerId(), e.getMessage());
                continue;
            } catch (RuntimeException e) {
                throw StoreFailures.translate(e, "claim");
            }

            if (candidate.getLockHolder() != null) {
                log.info("Reclaimed stale ticker id={} from holder={} (lockedAt={})",
                        candidate.getId(), candidate.getLockHolder(), candidate.getLockedAt());
            }
            log.info("Submit ticker to pool: id={}, function={}", claimed.getId(), claimed.getFunction());
            submitted.add(tickerExec.submit(() -> executeAndComplete(claimed)));
        }
        return submitted;
    }

    /**
     * 真正执行体（线程池中运行）
     */
    void executeAndComplete(TimeTicker ticker) {
        final Long id = ticker.getId();
        final String function = ticker.getFunction();

        try {
            tx.markRunningTx(id, workerId);
        } catch (TickerConflictException e) {
            log.warn("Lease lost before start, ticker id={} left to its new holder", id);
            return;
        } catch (RuntimeException e) {
            log.error("Failed to mark ticker running id={}", id, StoreFailures.translate(e, "markRunning"));
            return;
        }

        boolean succeed = false;
        String errMsg = null;
        long start = System.currentTimeMillis();
        try {
            log.info("Start execute ticker: id={}, function={}, retryCount={}", id, function, ticker.getRetryCount());

            TickerFunction f = functions.get(function);
            if (f == null) {
                throw new TickerExecutionException("No ticker function registered for name=%s", function);
            }
            TickerContext ctx = new TickerContext(id, function, workerId,
                    ticker.getRetryCount() == null ? 0 : ticker.getRetryCount(), ticker.getBatchParentId());
            f.execute(ctx, mapper.readTree(safeRequest(ticker.getRequest())));
            succeed = true;

        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            log.warn("Ticker interrupted id={}", id, ie);
            errMsg = "Interrupted during execution";

        } catch (TickerExecutionException e) {
            log.error("Ticker failed id={}: {}", id, e.getMessage());
            errMsg = trimErr(e.getMessage());

        } catch (Exception e) {
            TickerExecutionException ex = new TickerExecutionException(e,
                    "Ticker function %s failed: %s", function, e.toString());
            log.error("Ticker failed id={}", id, ex);
            errMsg = trimErr(ex.getMessage());

        } finally {
            complete(ticker, succeed, errMsg, System.currentTimeMillis() - start);
        }
    }

    private void complete(TimeTicker ticker, boolean succeed, String errMsg, long elapsedMs) {
        Long id = ticker.getId();
        TickerStatus finalStatus;
        try {
            finalStatus = tx.completeTx(id, workerId, succeed, errMsg, elapsedMs);
        } catch (TickerConflictException e) {
            // 租约已被其他 worker 抢占，结果以新持有者为准
            log.warn("Lease lost before completion, ticker id={}: {}", id, e.getMessage());
            return;
        } catch (RuntimeException e) {
            // 锁保持不变，租约过期后由其他 worker 回收
            log.error("Failed to record completion for ticker id={}", id, StoreFailures.translate(e, "complete"));
            return;
        }
        log.info("Ticker finished id={}, status={}, elapsed={}ms", id, finalStatus, elapsedMs);

        if (finalStatus.isTerminal() && ticker.getBatchParentId() != null) {
            propagateBatch(ticker.getBatchParentId());
        }
    }

    void propagateBatch(Long parentId) {
        try {
            tx.propagateBatchTx(parentId);
        } catch (RuntimeException e) {
            log.error("Batch completion check failed for parent={}", parentId, StoreFailures.translate(e, "propagateBatch"));
        }
    }

    private static String defaultWorkerId() {
        String jvm = ManagementFactory.getRuntimeMXBean().getName();
        String pid = (jvm != null && jvm.contains("@")) ? jvm.substring(0, jvm.indexOf('@')) : "na";
        String host;
        try {
            host = InetAddress.getLocalHost().getHostName();
        } catch (UnknownHostException e) {
            host = "local";
        }
        return host + "#" + pid + "#" + UUID.randomUUID().toString().substring(0, 8);
    }

    private static Timestamp tsNow() {
        return Timestamp.from(Instant.now());
    }

    private static String safeRequest(String request) {
        return (request == null || request.trim().isEmpty()) ? "{}" : request;
    }

    private static String trimErr(String m) {
        if (m == null) return null;
        m = m.replaceAll("\\s+", " ").trim();
        return m.length() > 1900 ? m.substring(0, 1900) : m;
    }
}
