package com.example.ticker.repo;

import com.example.ticker.domain.TickerStatus;
import com.example.ticker.domain.TimeTicker;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.Collection;
import java.util.List;

@Repository
public interface TickerRepo extends JpaRepository<TimeTicker, Long> {

    // IX_TimeTicker_Status_ExecutionTime
    @Query("select t from TimeTicker t where t.status = :status and t.executionTime <= :now " +
            "order by t.executionTime asc, t.id asc")
    List<TimeTicker> findDue(@Param("status") TickerStatus status, @Param("now") Timestamp now, Pageable page);

    // 与 findDue 同序，便于两路结果合并
    @Query("select t from TimeTicker t where t.status in :statuses and t.lockedAt < :lockedBefore " +
            "order by t.executionTime asc, t.id asc")
    List<TimeTicker> findStale(@Param("statuses") Collection<TickerStatus> statuses,
                               @Param("lockedBefore") Timestamp lockedBefore, Pageable page);

    // IX_TimeTicker_ExecutionTime
    List<TimeTicker> findByExecutionTimeBetweenOrderByExecutionTimeAscIdAsc(Timestamp from, Timestamp to);

    List<TimeTicker> findByBatchParentIdOrderByIdAsc(Long batchParentId);

    long countByBatchParentIdAndStatusNotIn(Long batchParentId, Collection<TickerStatus> statuses);

    /**
     * 领取未被持有的行：version 与 status 必须与读取时一致
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update TimeTicker t set t.status = :claimed, t.lockHolder = :owner, t.lockedAt = :now, " +
            "t.updatedAt = :now, t.version = t.version + 1 " +
            "where t.id = :id and t.version = :version and t.status = :expected and t.lockHolder is null")
    int claimUnlocked(@Param("id") Long id,
                      @Param("version") Long version,
                      @Param("expected") TickerStatus expected,
                      @Param("claimed") TickerStatus claimed,
                      @Param("owner") String owner,
                      @Param("now") Timestamp now);

    /**
     * 抢占租约已过期的行：额外比对原持有者与 locked_at
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update TimeTicker t set t.status = :claimed, t.lockHolder = :owner, t.lockedAt = :now, " +
            "t.updatedAt = :now, t.version = t.version + 1 " +
            "where t.id = :id and t.version = :version and t.status = :expected and t.lockHolder = :previousOwner " +
            "and t.lockedAt < :lockedBefore")
    int claimStale(@Param("id") Long id,
                   @Param("version") Long version,
                   @Param("expected") TickerStatus expected,
                   @Param("previousOwner") String previousOwner,
                   @Param("lockedBefore") Timestamp lockedBefore,
                   @Param("claimed") TickerStatus claimed,
                   @Param("owner") String owner,
                   @Param("now") Timestamp now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update TimeTicker t set t.status = :running, t.lockedAt = :now, t.executedAt = :now, " +
            "t.updatedAt = :now, t.version = t.version + 1 " +
            "where t.id = :id and t.status = :claimed and t.lockHolder = :owner")
    int markRunning(@Param("id") Long id,
                    @Param("claimed") TickerStatus claimed,
                    @Param("running") TickerStatus running,
                    @Param("owner") String owner,
                    @Param("now") Timestamp now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update TimeTicker t set t.status = :status, t.lockHolder = null, t.lockedAt = null, " +
            "t.elapsedTime = :elapsed, t.exceptionMessage = :message, " +
            "t.updatedAt = :now, t.version = t.version + 1 " +
            "where t.id = :id and t.status = :running and t.lockHolder = :owner")
    int finish(@Param("id") Long id,
               @Param("running") TickerStatus running,
               @Param("owner") String owner,
               @Param("status") TickerStatus status,
               @Param("elapsed") Long elapsed,
               @Param("message") String message,
               @Param("now") Timestamp now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update TimeTicker t set t.status = :pending, t.lockHolder = null, t.lockedAt = null, " +
            "t.retryCount = t.retryCount + 1, t.executionTime = :nextExecutionTime, " +
            "t.elapsedTime = :elapsed, t.exceptionMessage = :message, " +
            "t.updatedAt = :now, t.version = t.version + 1 " +
            "where t.id = :id and t.status = :running and t.lockHolder = :owner")
    int reschedule(@Param("id") Long id,
                   @Param("running") TickerStatus running,
                   @Param("owner") String owner,
                   @Param("pending") TickerStatus pending,
                   @Param("nextExecutionTime") Timestamp nextExecutionTime,
                   @Param("elapsed") Long elapsed,
                   @Param("message") String message,
                   @Param("now") Timestamp now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update TimeTicker t set t.status = :cancelled, t.updatedAt = :now, t.version = t.version + 1 " +
            "where t.id = :id and t.status = :pending")
    int cancelPending(@Param("id") Long id,
                      @Param("pending") TickerStatus pending,
                      @Param("cancelled") TickerStatus cancelled,
                      @Param("now") Timestamp now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update TimeTicker t set t.batchCompletedAt = :now, t.updatedAt = :now, t.version = t.version + 1 " +
            "where t.id = :id and t.batchCompletedAt is null")
    int markBatchCompleted(@Param("id") Long id, @Param("now") Timestamp now);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("update TimeTicker t set t.batchParentId = null, t.updatedAt = :now, t.version = t.version + 1 " +
            "where t.batchParentId = :parentId")
    int detachChildren(@Param("parentId") Long parentId, @Param("now") Timestamp now);
}
