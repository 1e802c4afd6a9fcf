package com.inboxai.credit_core.config;

import com.inboxai.credit_core.ledger.LedgerWriteConflictException;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.retry.support.RetryTemplate;

/**
 * Retry policy for ledger writes. Only lock and serialization conflicts are retried;
 * an unaffordable spend is an answer, not a failure.
 */
@Configuration
public class LedgerRetryConfig {

    @Bean
    public RetryTemplate ledgerRetryTemplate(CreditProperties properties) {
        return RetryTemplate.builder()
            .maxAttempts(properties.getLedger().getMaxAttempts())
            .fixedBackoff(properties.getLedger().getBackoffMs())
            .retryOn(LedgerWriteConflictException.class)
            .build();
    }
}
