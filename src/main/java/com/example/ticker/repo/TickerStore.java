package com.example.ticker.repo;

import com.example.ticker.domain.TickerStatus;
import com.example.ticker.domain.TimeTicker;

import java.sql.Timestamp;
import java.util.List;
import java.util.Optional;

/**
 * Ticker 持久化接口。
 * 所有状态变更都是条件更新：未命中时抛出 TickerConflictException，
 * 底层存储故障统一转换为 TickerStoreUnavailableException。
 * 需在调用方事务中执行。
 */
public interface TickerStore {

    TimeTicker insert(TimeTicker ticker);

    Optional<TimeTicker> findById(Long id);

    boolean exists(Long id);

    /**
     * status=PENDING 且 execution_time <= now，按 (execution_time, id) 升序
     */
    List<TimeTicker> findDue(Timestamp now, int limit);

    /**
     * CLAIMED/RUNNING 且 locked_at 早于 lockedBefore 的行（租约过期），按 (execution_time, id) 升序
     */
    List<TimeTicker> findStale(Timestamp lockedBefore, int limit);

    List<TimeTicker> findByExecutionTimeBetween(Timestamp from, Timestamp to);

    List<TimeTicker> findChildren(Long parentId);

    long countUnfinishedChildren(Long parentId);

    /**
     * 以读取时的快照（version、status、lockHolder）为条件，将行转为 CLAIMED 并写入 owner。
     * 快照已被持有时，只有 locked_at 早于 lockedBefore 才能抢占。
     */
    void claim(TimeTicker snapshot, String owner, Timestamp now, Timestamp lockedBefore);

    void markRunning(Long id, String owner, Timestamp now);

    void finish(Long id, String owner, TickerStatus status, long elapsedMs, String message, Timestamp now);

    void reschedule(Long id, String owner, Timestamp nextExecutionTime, long elapsedMs, String message, Timestamp now);

    void cancel(Long id, Timestamp now);

    /**
     * @return true 表示本次调用首次标记该批次完成
     */
    boolean markBatchCompleted(Long parentId, Timestamp now);

    int detachChildren(Long parentId, Timestamp now);

    void delete(Long id);
}
