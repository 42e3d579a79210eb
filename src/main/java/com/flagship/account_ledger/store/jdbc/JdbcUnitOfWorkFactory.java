package com.flagship.account_ledger.store.jdbc;

import com.flagship.account_ledger.store.UnitOfWork;
import com.flagship.account_ledger.store.UnitOfWorkFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;

import java.util.Locale;

/**
 * Opens JDBC units of work.
 *
 * Row locking policy: {@code SELECT ... FOR UPDATE} is used when
 * {@code ledger.locking.pessimistic} is on and the database dialect can express it.
 * Otherwise reads-for-update are plain reads and the version check on write is the
 * only conflict detection. The lock timeout is applied on PostgreSQL only.
 *
 * The bundled Flyway migration ({@code db/migration/V1__create_accounts_and_ledger.sql})
 * is PostgreSQL-only: it uses {@code BIGSERIAL}, regex checks and a plpgsql trigger.
 * The other dialects are recognised only to pick a locking strategy for a schema
 * provisioned outside this service.
 */
@Component
@ConditionalOnProperty(name = "ledger.store.type", havingValue = "jdbc", matchIfMissing = true)
@Slf4j
public class JdbcUnitOfWorkFactory implements UnitOfWorkFactory {

    private final PlatformTransactionManager transactionManager;
    private final JdbcTemplate jdbcTemplate;
    private final boolean pessimisticLocking;
    private final long lockTimeoutMs;

    private volatile Dialect dialect;

    public JdbcUnitOfWorkFactory(PlatformTransactionManager transactionManager,
                                 JdbcTemplate jdbcTemplate,
                                 @Value("${ledger.locking.pessimistic:true}") boolean pessimisticLocking,
                                 @Value("${ledger.locking.lock-timeout-ms:2000}") long lockTimeoutMs) {
        this.transactionManager = transactionManager;
        this.jdbcTemplate = jdbcTemplate;
        this.pessimisticLocking = pessimisticLocking;
        this.lockTimeoutMs = lockTimeoutMs;
    }

    @Override
    public UnitOfWork begin() {
        Dialect current = dialect();
        boolean selectForUpdate = pessimisticLocking && current.supportsSelectForUpdate();
        long timeout = current == Dialect.POSTGRESQL ? lockTimeoutMs : 0L;
        return new JdbcUnitOfWork(transactionManager, jdbcTemplate, selectForUpdate, timeout);
    }

    private Dialect dialect() {
        Dialect current = dialect;
        if (current == null) {
            String productName = jdbcTemplate.execute(
                (ConnectionCallback<String>) connection -> connection.getMetaData().getDatabaseProductName());
            current = Dialect.fromProductName(productName);
            dialect = current;
            log.info("Ledger storage dialect: {} (product={}), pessimistic locking {}",
                current, productName, pessimisticLocking && current.supportsSelectForUpdate() ? "on" : "off");
        }
        return current;
    }

    enum Dialect {
        POSTGRESQL(true),
        MYSQL(true),
        H2(true),
        SQLITE(false),
        OTHER(false);

        private final boolean selectForUpdate;

        Dialect(boolean selectForUpdate) {
            this.selectForUpdate = selectForUpdate;
        }

        boolean supportsSelectForUpdate() {
            return selectForUpdate;
        }

        static Dialect fromProductName(String productName) {
            if (productName == null) {
                return OTHER;
            }
            String name = productName.toLowerCase(Locale.ROOT);
            if (name.contains("postgres")) {
                return POSTGRESQL;
            }
            if (name.contains("mysql") || name.contains("mariadb")) {
                return MYSQL;
            }
            if (name.equals("h2")) {
                return H2;
            }
            if (name.contains("sqlite")) {
                return SQLITE;
            }
            return OTHER;
        }
    }
}
