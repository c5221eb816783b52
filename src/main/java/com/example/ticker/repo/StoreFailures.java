package com.example.ticker.repo;

import com.example.ticker.exception.TickerStoreUnavailableException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessResourceException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionSystemException;

/**
 * 将 Spring 的数据访问异常归类：连接/事务层面的故障视为存储不可用，其余原样抛出
 */
public final class StoreFailures {

    private StoreFailures() {
    }

    public static boolean isUnavailable(Throwable t) {
        return t instanceof DataAccessResourceFailureException
                || t instanceof TransientDataAccessResourceException
                || t instanceof RecoverableDataAccessException
                || t instanceof QueryTimeoutException
                || t instanceof CannotCreateTransactionException
                || t instanceof TransactionSystemException;
    }

    public static RuntimeException translate(RuntimeException e, String operation) {
        if (e instanceof TickerStoreUnavailableException) return e;
        if (isUnavailable(e)) {
            return new TickerStoreUnavailableException(e, "Ticker store unavailable during %s: %s", operation, e.getMessage());
        }
        return e;
    }
}
