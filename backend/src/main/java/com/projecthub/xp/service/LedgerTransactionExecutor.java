package com.projecthub.xp.service;

import com.projecthub.xp.web.XpStorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.support.TransactionCallback;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Runs a unit of per-actor work in its own transaction, retrying the whole transaction with backoff on
 * storage contention. Work submitted here must be idempotent.
 */
@Component
public class LedgerTransactionExecutor {

    private static final Logger log = LoggerFactory.getLogger(LedgerTransactionExecutor.class);

    private final RetryTemplate retryTemplate;
    private final TransactionTemplate transactionTemplate;

    public LedgerTransactionExecutor(
            @Qualifier("xpLedgerRetryTemplate") RetryTemplate retryTemplate,
            TransactionTemplate transactionTemplate
    ) {
        this.retryTemplate = retryTemplate;
        this.transactionTemplate = transactionTemplate;
    }

    public <T> T execute(String operation, TransactionCallback<T> work) {
        try {
            return retryTemplate.execute(retryContext -> {
                if (retryContext.getRetryCount() > 0) {
                    log.debug("Retrying {} (attempt {}) after {}", operation, retryContext.getRetryCount() + 1,
                            retryContext.getLastThrowable() == null
                                    ? "unknown failure"
                                    : retryContext.getLastThrowable().getClass().getSimpleName());
                }
                return transactionTemplate.execute(work);
            });
        } catch (RuntimeException ex) {
            if (!isStorageContention(ex)) {
                throw ex;
            }
            log.warn("Giving up on {} after bounded retries: {}", operation, ex.getMessage());
            throw new XpStorageUnavailableException("Storage contention while running " + operation, ex);
        }
    }

    static boolean isStorageContention(Throwable failure) {
        for (Throwable current = failure; current != null; current = current.getCause()) {
            if (current instanceof TransientDataAccessException
                    || current instanceof DataIntegrityViolationException
                    || current instanceof CannotCreateTransactionException) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }
}
