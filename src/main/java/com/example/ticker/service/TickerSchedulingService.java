package com.example.ticker.service;

import com.example.ticker.config.TickerProperties;
import com.example.ticker.domain.TickerStatus;
import com.example.ticker.domain.TimeTicker;
import com.example.ticker.exception.TickerNotFoundException;
import com.example.ticker.exception.TickerReferenceException;
import com.example.ticker.repo.TickerStore;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.sql.Timestamp;
import java.util.List;

/**
 * 对外的调度接口：创建、取消、查询、删除
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TickerSchedulingService {

    private final TickerStore store;
    private final TickerTxService tx;
    private final TickerProperties props;
    private final ObjectMapper mapper;

    @Transactional
    public TimeTicker create(TickerRequest req) {
        if (req.getFunction() == null || req.getFunction().trim().isEmpty()) {
            throw new IllegalArgumentException("function must not be empty");
        }
        if (req.getFunction().trim().length() > TimeTicker.FUNCTION_NAME_LENGTH) {
            throw new IllegalArgumentException("function longer than " + TimeTicker.FUNCTION_NAME_LENGTH);
        }
        if (req.getExecutionTime() == null) {
            throw new IllegalArgumentException("executionTime must not be null");
        }
        if (req.getRetries() != null && req.getRetries() < 0) {
            throw new IllegalArgumentException("retries must be >= 0");
        }
        validateIntervals(req.getRetryIntervals());
        String json = normalizeRequest(req.getRequest());

        if (req.getBatchParentId() != null && !store.exists(req.getBatchParentId())) {
            throw new TickerReferenceException("Batch parent not found: id=%s", req.getBatchParentId());
        }

        TimeTicker t = new TimeTicker();
        t.setFunction(req.getFunction().trim());
        t.setDescription(req.getDescription());
        t.setRequest(json);
        t.setExecutionTime(req.getExecutionTime());
        t.setStatus(TickerStatus.PENDING);
        t.setBatchParentId(req.getBatchParentId());
        t.setRetries(req.getRetries() != null ? req.getRetries() : props.getRetry().getDefaultRetries());
        t.setRetryCount(0);
        t.setRetryIntervals(req.getRetryIntervals());

        TimeTicker saved;
        try {
            saved = store.insert(t);
        } catch (DataIntegrityViolationException e) {
            // 父行在校验之后被并发删除
            throw new TickerReferenceException("Batch parent vanished during create: id=%s", req.getBatchParentId());
        }
        log.info("Ticker created id={}, function={}, executionTime={}, parent={}",
                saved.getId(), saved.getFunction(), saved.getExecutionTime(), saved.getBatchParentId());
        return saved;
    }

    /**
     * 只有 PENDING 可取消；已被领取的执行不受影响（抛 TickerConflictException）
     */
    public void cancel(Long id) {
        Long parentId = tx.cancelTx(id);
        if (parentId != null) {
            tx.propagateBatchTx(parentId);
        }
    }

    @Transactional(readOnly = true)
    public TickerStatus status(Long id) {
        return find(id).getStatus();
    }

    @Transactional(readOnly = true)
    public TimeTicker find(Long id) {
        return store.findById(id).orElseThrow(() -> new TickerNotFoundException(id));
    }

    @Transactional(readOnly = true)
    public List<TimeTicker> children(Long parentId) {
        return store.findChildren(parentId);
    }

    @Transactional(readOnly = true)
    public List<TimeTicker> findByExecutionTime(Timestamp from, Timestamp to) {
        return store.findByExecutionTimeBetween(from, to);
    }

    /**
     * 保留策略删除：子 ticker 的 batch_parent 被置空而不是级联删除
     */
    public void delete(Long id) {
        Long parentId = tx.deleteTx(id);
        if (parentId != null) {
            // 删掉的可能是批次里最后一个未完成的子 ticker
            tx.propagateBatchTx(parentId);
        }
    }

    private String normalizeRequest(String request) {
        String json = (request == null || request.trim().isEmpty()) ? "{}" : request.trim();
        try {
            mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Bad ticker request payload: " + e.getOriginalMessage(), e);
        }
        return json;
    }

    private static void validateIntervals(String intervals) {
        if (intervals == null || intervals.trim().isEmpty()) return;
        for (String part : intervals.split(",")) {
            long seconds;
            try {
                seconds = Long.parseLong(part.trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Bad retry interval '" + part + "' in '" + intervals + "'", e);
            }
            if (seconds < 0) {
                throw new IllegalArgumentException("Retry interval must be >= 0: " + intervals);
            }
        }
    }
}
