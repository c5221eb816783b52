package com.example.ticker.service;

import com.example.ticker.config.TickerProperties;
import com.example.ticker.domain.TickerStatus;
import com.example.ticker.domain.TimeTicker;
import com.example.ticker.exception.TickerConflictException;
import com.example.ticker.exception.TickerNotFoundException;
import com.example.ticker.repo.TickerStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.*;

/**
 * 领取、状态迁移与批次完成的短事务。
 * 每个方法都是独立的新事务，调用方不能在同一事务里串联多个步骤：
 * 批次完成检查必须在子 ticker 终态提交之后才能看到正确的兄弟状态。
 */
@Slf4j
@Service
public class TickerTxService {

    private static final Comparator<TimeTicker> CANDIDATE_ORDER =
            Comparator.comparing(TimeTicker::getExecutionTime).thenComparing(TimeTicker::getId);

    private final TickerStore store;
    private final TickerProperties props;
    private final List<BatchCompletionListener> listeners;

    @Autowired
    public TickerTxService(TickerStore store, TickerProperties props,
                           Optional<List<BatchCompletionListener>> listeners) {
        this.store = store;
        this.props = props;
        this.listeners = listeners.orElseGet(Collections::emptyList);
    }

    /**
     * A. 候选行：到期的 PENDING 与租约过期的 CLAIMED/RUNNING 视为同一队列，
     * 统一按 (execution_time, id) 排序后取前 limit 条
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW, readOnly = true)
    public List<TimeTicker> findCandidatesTx(Timestamp now, int limit) {
        List<TimeTicker> candidates = new ArrayList<>(store.findDue(now, limit));
        candidates.addAll(store.findStale(leaseExpiry(now), limit));
        candidates.sort(CANDIDATE_ORDER);
        return candidates.size() > limit ? new ArrayList<>(candidates.subList(0, limit)) : candidates;
    }

    /**
     * B. 条件更新领取。失败时抛 TickerConflictException，行状态不变。
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public TimeTicker claimTx(TimeTicker candidate, String owner) {
        Long id = candidate.getId();
        Timestamp now = tsNow();
        store.claim(candidate, owner, now, leaseExpiry(now));
        return store.findById(id)
                .orElseThrow(() -> new TickerConflictException(id, "Ticker %s vanished after claim", id));
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void markRunningTx(Long id, String owner) {
        store.markRunning(id, owner, tsNow());
    }

    /**
     * C. 完成回写：成功 → SUCCEEDED；失败且仍有重试额度 → PENDING（顺延执行时间）；否则 → FAILED。
     * 三种情况都在同一条条件更新里清空 lock_holder。
     *
     * @return 写入后的状态
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public TickerStatus completeTx(Long id, String owner, boolean succeed, String message, long elapsedMs) {
        TimeTicker t = store.findById(id).orElseThrow(() -> new TickerNotFoundException(id));
        Timestamp now = tsNow();

        if (succeed) {
            store.finish(id, owner, TickerStatus.SUCCEEDED, elapsedMs, null, now);
            return TickerStatus.SUCCEEDED;
        }

        int retryCount = t.getRetryCount() == null ? 0 : t.getRetryCount();
        int retries = t.getRetries() == null ? 0 : t.getRetries();
        if (retryCount < retries) {
            Timestamp next = nextExecutionTime(t.getRetryIntervals(), retryCount, now);
            store.reschedule(id, owner, next, elapsedMs, message, now);
            log.info("Ticker rescheduled id={}, retry {}/{}, next={}", id, retryCount + 1, retries, next);
            return TickerStatus.PENDING;
        }

        store.finish(id, owner, TickerStatus.FAILED, elapsedMs, message, now);
        log.warn("Ticker failed permanently id={}, retries={}, err={}", id, retries, message);
        return TickerStatus.FAILED;
    }

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Long cancelTx(Long id) {
        TimeTicker t = store.findById(id).orElseThrow(() -> new TickerNotFoundException(id));
        store.cancel(id, tsNow());
        log.info("Ticker cancelled id={}", id);
        return t.getBatchParentId();
    }

    /**
     * 删除 ticker：先把子 ticker 的 batch_parent 置空，再删本行。执行中的行不允许删除。
     *
     * @return 被删行原来的 batch_parent
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Long deleteTx(Long id) {
        TimeTicker t = store.findById(id).orElseThrow(() -> new TickerNotFoundException(id));
        if (t.getStatus().isLocked()) {
            throw new TickerConflictException(id, "Ticker %s is %s, cannot delete", id, t.getStatus());
        }
        int detached = store.detachChildren(id, tsNow());
        store.delete(id);
        log.info("Ticker deleted id={}, detachedChildren={}", id, detached);
        return t.getBatchParentId();
    }

    /**
     * D. 批次完成检查：重新查询兄弟状态，全部终态时以 batch_completed_at IS NULL 为条件标记父行。
     * 只有标记成功的调用会在提交后通知 BatchCompletionListener。
     *
     * @return true 表示本次调用完成了该批次
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean propagateBatchTx(Long parentId) {
        if (parentId == null) return false;

        long unfinished = store.countUnfinishedChildren(parentId);
        if (unfinished > 0) {
            log.debug("Batch parent={} still has {} unfinished children", parentId, unfinished);
            return false;
        }
        List<TimeTicker> children = store.findChildren(parentId);
        if (children.isEmpty() || !store.exists(parentId)) {
            return false;
        }
        if (!store.markBatchCompleted(parentId, tsNow())) {
            log.debug("Batch parent={} already completed", parentId);
            return false;
        }

        TimeTicker parent = store.findById(parentId)
                .orElseThrow(() -> new TickerNotFoundException(parentId));
        log.info("Batch completed parent={}, children={}", parentId, children.size());
        afterCommit(() -> notifyListeners(parent, children));
        return true;
    }

    private void notifyListeners(TimeTicker parent, List<TimeTicker> children) {
        for (BatchCompletionListener l : listeners) {
            try {
                l.onBatchCompleted(parent, Collections.unmodifiableList(children));
            } catch (RuntimeException ex) {
                log.error("BatchCompletionListener {} failed for parent={}", l.getClass().getName(), parent.getId(), ex);
            }
        }
    }

    Timestamp nextExecutionTime(String retryIntervals, int retryCount, Timestamp now) {
        long seconds = props.getRetry().getDefaultIntervalSeconds();
        if (retryIntervals != null && !retryIntervals.trim().isEmpty()) {
            String[] parts = retryIntervals.split(",");
            String picked = parts[Math.min(retryCount, parts.length - 1)].trim();
            try {
                seconds = Long.parseLong(picked);
            } catch (NumberFormatException e) {
                log.warn("Bad retry interval '{}' in '{}', using default {}s", picked, retryIntervals, seconds);
            }
        }
        return Timestamp.from(now.toInstant().plusSeconds(Math.max(0, seconds)));
    }

    private Timestamp leaseExpiry(Timestamp now) {
        return Timestamp.from(now.toInstant().minus(props.getLease()));
    }

    private static void afterCommit(Runnable r) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            r.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                r.run();
            }
        });
    }

    private static Timestamp tsNow() {
        return Timestamp.from(Instant.now());
    }
}
