package com.trustledger.ledger.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.transaction.TransactionManagerCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.support.AbstractPlatformTransactionManager;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(LedgerProperties.class)
public class LedgerConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock ledgerClock() {
        return Clock.systemUTC();
    }

    /**
     * A query that throws inside a running ledger operation (a transfer callback looking up a
     * missing item) must not mark the whole operation rollback-only.
     */
    @Bean
    public TransactionManagerCustomizer<AbstractPlatformTransactionManager> participationFailureCustomizer() {
        return transactionManager -> transactionManager.setGlobalRollbackOnParticipationFailure(false);
    }
}
