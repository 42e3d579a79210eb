package com.flagship.account_ledger.config;

import com.flagship.account_ledger.store.memory.InMemoryLedgerDatabase;
import com.flagship.account_ledger.store.memory.InMemoryUnitOfWorkFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Process-local storage, selected with {@code ledger.store.type=memory}.
 * State lives as long as the application context.
 */
@Configuration
@ConditionalOnProperty(name = "ledger.store.type", havingValue = "memory")
@Slf4j
public class InMemoryStoreConfiguration {

    @Bean
    public InMemoryLedgerDatabase inMemoryLedgerDatabase() {
        log.warn("Using in-memory ledger storage: balances are lost on shutdown");
        return new InMemoryLedgerDatabase();
    }

    @Bean
    public InMemoryUnitOfWorkFactory inMemoryUnitOfWorkFactory(
            InMemoryLedgerDatabase database,
            @Value("${ledger.locking.pessimistic:true}") boolean pessimisticLocking,
            @Value("${ledger.locking.lock-timeout-ms:2000}") long lockTimeoutMs) {
        return new InMemoryUnitOfWorkFactory(database, pessimisticLocking, lockTimeoutMs);
    }
}
