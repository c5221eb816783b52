package com.example.ticker.domain;

import lombok.*;

import javax.persistence.*;
import java.sql.Timestamp;

@Entity
@Getter @Setter @ToString
@Table(name = "time_tickers", indexes = {
        @Index(name = "IX_TimeTicker_ExecutionTime", columnList = "execution_time"),
        @Index(name = "IX_TimeTicker_Status_ExecutionTime", columnList = "status, execution_time"),
        @Index(name = "IX_TimeTicker_BatchParent", columnList = "batch_parent")})
public class TimeTicker {
    public static final int FUNCTION_NAME_LENGTH = 128;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "function_name", nullable = false, length = FUNCTION_NAME_LENGTH)
    private String function;

    @Column(name = "description", length = 512)
    private String description;

    @Lob
    @Column(name = "request")
    private String request;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private TickerStatus status = TickerStatus.PENDING;

    @Column(name = "execution_time", nullable = false, columnDefinition = "TIMESTAMP(3)")
    private Timestamp executionTime;

    /**
     * 当前持有执行锁的 worker。与 version 一起作为乐观并发令牌，所有条件更新都要带上读到的旧值。
     */
    @Column(name = "lock_holder", length = 128)
    private String lockHolder;

    /**
     * 领取/开始执行的时刻，租约过期判断以此为准
     */
    @Column(name = "locked_at", columnDefinition = "TIMESTAMP(3)")
    private Timestamp lockedAt;

    @Column(name = "retries", nullable = false)
    private Integer retries = 0;

    @Column(name = "retry_count", nullable = false)
    private Integer retryCount = 0;

    /**
     * 逗号分隔的重试间隔（秒），超出部分沿用最后一个
     */
    @Column(name = "retry_intervals", length = 256)
    private String retryIntervals;

    @Column(name = "batch_parent")
    private Long batchParentId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "batch_parent", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "FK_TimeTicker_BatchParent"))
    @ToString.Exclude
    @Getter(AccessLevel.NONE) @Setter(AccessLevel.NONE)
    private TimeTicker batchParent;

    @Column(name = "batch_completed_at", columnDefinition = "TIMESTAMP(3)")
    private Timestamp batchCompletedAt;

    @Column(name = "executed_at", columnDefinition = "TIMESTAMP(3)")
    private Timestamp executedAt;

    @Column(name = "elapsed_time")
    private Long elapsedTime;

    @Column(name = "exception_message", length = 2000)
    private String exceptionMessage;

    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    @Column(name = "created_at", nullable = false, columnDefinition = "TIMESTAMP(3)")
    private Timestamp createdAt;

    @Column(name = "updated_at", nullable = false, columnDefinition = "TIMESTAMP(3)")
    private Timestamp updatedAt;

    @PrePersist
    public void prePersist() {
        Timestamp now = new Timestamp(System.currentTimeMillis());
        createdAt = now;
        updatedAt = now;
    }

    @PreUpdate
    public void preUpdate() {
        updatedAt = new Timestamp(System.currentTimeMillis());
    }
}
