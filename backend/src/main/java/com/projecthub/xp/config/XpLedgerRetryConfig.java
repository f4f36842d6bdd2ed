package com.projecthub.xp.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.transaction.CannotCreateTransactionException;

import java.util.List;

@Configuration
public class XpLedgerRetryConfig {

    /**
     * Retry policy for ledger appends. Appends are idempotent on their dedup key, so a retry after a
     * lost race or lock timeout either applies the award once or observes the winner's row.
     */
    @Bean
    public RetryTemplate xpLedgerRetryTemplate(XpEngineProperties xpEngineProperties) {
        XpEngineProperties.Ledger ledger = xpEngineProperties.getLedger();
        return RetryTemplate.builder()
                .maxAttempts(Math.max(1, ledger.getMaxAttempts()))
                .exponentialBackoff(
                        Math.max(1L, ledger.getInitialBackoffMs()),
                        Math.max(1.0, ledger.getBackoffMultiplier()),
                        Math.max(1L, ledger.getMaxBackoffMs())
                )
                .retryOn(List.of(
                        TransientDataAccessException.class,
                        DataIntegrityViolationException.class,
                        CannotCreateTransactionException.class
                ))
                .traversingCauses()
                .build();
    }
}
