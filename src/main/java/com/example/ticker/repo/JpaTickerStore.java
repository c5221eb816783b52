package com.example.ticker.repo;

import com.example.ticker.domain.TickerStatus;
import com.example.ticker.domain.TimeTicker;
import com.example.ticker.exception.TickerConflictException;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

@Repository
@RequiredArgsConstructor
public class JpaTickerStore implements TickerStore {

    private final TickerRepo repo;

    @Override
    public TimeTicker insert(TimeTicker ticker) {
        return call("insert", () -> repo.saveAndFlush(ticker));
    }

    @Override
    public Optional<TimeTicker> findById(Long id) {
        return call("findById", () -> repo.findById(id));
    }

    @Override
    public boolean exists(Long id) {
        return id != null && call("exists", () -> repo.existsById(id));
    }

    @Override
    public List<TimeTicker> findDue(Timestamp now, int limit) {
        return call("findDue", () -> repo.findDue(TickerStatus.PENDING, now, PageRequest.of(0, limit)));
    }

    @Override
    public List<TimeTicker> findStale(Timestamp lockedBefore, int limit) {
        return call("findStale", () -> repo.findStale(TickerStatus.locked(), lockedBefore, PageRequest.of(0, limit)));
    }

    @Override
    public List<TimeTicker> findByExecutionTimeBetween(Timestamp from, Timestamp to) {
        return call("findByExecutionTimeBetween",
                () -> repo.findByExecutionTimeBetweenOrderByExecutionTimeAscIdAsc(from, to));
    }

    @Override
    public List<TimeTicker> findChildren(Long parentId) {
        return call("findChildren", () -> repo.findByBatchParentIdOrderByIdAsc(parentId));
    }

    @Override
    public long countUnfinishedChildren(Long parentId) {
        return call("countUnfinishedChildren",
                () -> repo.countByBatchParentIdAndStatusNotIn(parentId, TickerStatus.terminal()));
    }

    @Override
    public void claim(TimeTicker snapshot, String owner, Timestamp now, Timestamp lockedBefore) {
        int updated = call("claim", () -> snapshot.getLockHolder() == null
                ? repo.claimUnlocked(snapshot.getId(), snapshot.getVersion(), snapshot.getStatus(),
                        TickerStatus.CLAIMED, owner, now)
                : repo.claimStale(snapshot.getId(), snapshot.getVersion(), snapshot.getStatus(),
                        snapshot.getLockHolder(), lockedBefore, TickerStatus.CLAIMED, owner, now));
        if (updated == 0) {
            throw new TickerConflictException(snapshot.getId(),
                    "Ticker %s changed since read (version=%s, status=%s)",
                    snapshot.getId(), snapshot.getVersion(), snapshot.getStatus());
        }
    }

    @Override
    public void markRunning(Long id, String owner, Timestamp now) {
        int updated = call("markRunning", () -> repo.markRunning(id, TickerStatus.CLAIMED, TickerStatus.RUNNING, owner, now));
        if (updated == 0) {
            throw new TickerConflictException(id, "Ticker %s is no longer claimed by %s", id, owner);
        }
    }

    @Override
    public void finish(Long id, String owner, TickerStatus status, long elapsedMs, String message, Timestamp now) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        int updated = call("finish", () -> repo.finish(id, TickerStatus.RUNNING, owner, status, elapsedMs, message, now));
        if (updated == 0) {
            throw new TickerConflictException(id, "Ticker %s is no longer running under %s", id, owner);
        }
    }

    @Override
    public void reschedule(Long id, String owner, Timestamp nextExecutionTime, long elapsedMs, String message, Timestamp now) {
        int updated = call("reschedule", () -> repo.reschedule(id, TickerStatus.RUNNING, owner, TickerStatus.PENDING,
                nextExecutionTime, elapsedMs, message, now));
        if (updated == 0) {
            throw new TickerConflictException(id, "Ticker %s is no longer running under %s", id, owner);
        }
    }

    @Override
    public void cancel(Long id, Timestamp now) {
        int updated = call("cancel", () -> repo.cancelPending(id, TickerStatus.PENDING, TickerStatus.CANCELLED, now));
        if (updated == 0) {
            throw new TickerConflictException(id, "Ticker %s is not PENDING, cannot cancel", id);
        }
    }

    @Override
    public boolean markBatchCompleted(Long parentId, Timestamp now) {
        return call("markBatchCompleted", () -> repo.markBatchCompleted(parentId, now)) > 0;
    }

    @Override
    public int detachChildren(Long parentId, Timestamp now) {
        return call("detachChildren", () -> repo.detachChildren(parentId, now));
    }

    @Override
    public void delete(Long id) {
        call("delete", () -> {
            repo.deleteById(id);
            repo.flush();
            return null;
        });
    }

    private static <T> T call(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (RuntimeException e) {
            throw StoreFailures.translate(e, operation);
        }
    }
}
