package com.flagship.account_ledger.store;

/**
 * One atomic scope over the account and ledger stores.
 *
 * Opening a unit of work (see {@link UnitOfWorkFactory#begin()}) starts exactly one
 * storage transaction; the stores it exposes are bound to that transaction. Callers
 * must {@link #commit()} explicitly. Closing without a successful commit rolls back,
 * so a try-with-resources block guarantees no partial state on any exit path:
 *
 * <pre>
 * try (UnitOfWork uow = unitOfWorkFactory.begin()) {
 *     Account account = uow.accounts().getByNumberForUpdate(number).orElseThrow(...);
 *     account.deposit(amount);
 *     uow.ledger().save(entry);
 *     uow.accounts().save(account);
 *     uow.commit();
 * }
 * </pre>
 *
 * Units of work are not reentrant and not shareable between threads.
 */
public interface UnitOfWork extends AutoCloseable {

    AccountStore accounts();

    LedgerStore ledger();

    /**
     * Commits the transaction.
     *
     * @throws com.flagship.account_ledger.error.ConcurrencyConflictException on a version
     *         mismatch or lock contention reported by storage; other storage failures
     *         propagate unchanged. Either way the transaction is rolled back.
     * @throws IllegalStateException if already committed, rolled back or closed
     */
    void commit();

    /**
     * Rolls back the transaction. Idempotent: safe after a failed commit, after a previous
     * rollback, or after close.
     */
    void rollback();

    /**
     * Ends the scope, rolling back unless {@link #commit()} succeeded.
     */
    @Override
    void close();
}
