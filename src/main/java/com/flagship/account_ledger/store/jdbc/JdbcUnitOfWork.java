package com.flagship.account_ledger.store.jdbc;

import com.flagship.account_ledger.store.AccountStore;
import com.flagship.account_ledger.store.LedgerStore;
import com.flagship.account_ledger.store.UnitOfWork;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionStatus;
import org.springframework.transaction.support.DefaultTransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Unit of work backed by one programmatic Spring transaction.
 *
 * The transaction is bound to the opening thread (Spring resource binding), which is
 * how the JdbcTemplate calls of both stores join it. Opening a second unit of work on a
 * thread that already runs a transaction is rejected: boundaries are not reentrant.
 */
@Slf4j
class JdbcUnitOfWork implements UnitOfWork {

    private enum State {
        ACTIVE,
        COMMITTED,
        ROLLED_BACK
    }

    private final PlatformTransactionManager transactionManager;
    private final TransactionStatus status;
    private final JdbcAccountStore accounts;
    private final JdbcLedgerStore ledger;
    private State state;
    private boolean closed;

    JdbcUnitOfWork(PlatformTransactionManager transactionManager, JdbcTemplate jdbcTemplate,
                   boolean selectForUpdate, long lockTimeoutMs) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException(
                "A transaction is already active on this thread; units of work are not reentrant");
        }
        this.transactionManager = transactionManager;

        DefaultTransactionDefinition definition = new DefaultTransactionDefinition(TransactionDefinition.PROPAGATION_REQUIRED);
        definition.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        definition.setName("ledger-unit-of-work");
        this.status = transactionManager.getTransaction(definition);
        this.state = State.ACTIVE;

        try {
            if (lockTimeoutMs > 0) {
                // PostgreSQL only; scoped to this transaction
                jdbcTemplate.execute("SET LOCAL lock_timeout = " + lockTimeoutMs);
            }
        } catch (RuntimeException e) {
            rollback();
            throw e;
        }

        this.accounts = new JdbcAccountStore(jdbcTemplate, this, selectForUpdate);
        this.ledger = new JdbcLedgerStore(jdbcTemplate, this);
    }

    @Override
    public AccountStore accounts() {
        ensureActive();
        return accounts;
    }

    @Override
    public LedgerStore ledger() {
        ensureActive();
        return ledger;
    }

    @Override
    public void commit() {
        ensureActive();
        try {
            transactionManager.commit(status);
            state = State.COMMITTED;
        } catch (RuntimeException e) {
            // A failed commit has already completed the transaction.
            state = State.ROLLED_BACK;
            throw ConcurrencyFailures.translate("Commit", e);
        }
    }

    @Override
    public void rollback() {
        if (state != State.ACTIVE) {
            return;
        }
        state = State.ROLLED_BACK;
        if (!status.isCompleted()) {
            transactionManager.rollback(status);
            log.debug("Unit of work rolled back");
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        rollback();
    }

    void ensureActive() {
        if (closed) {
            throw new IllegalStateException("Unit of work is closed");
        }
        if (state != State.ACTIVE) {
            throw new IllegalStateException("Unit of work is no longer active: " + state);
        }
    }
}
