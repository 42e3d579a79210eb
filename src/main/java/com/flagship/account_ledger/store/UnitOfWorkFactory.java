package com.flagship.account_ledger.store;

/**
 * Opens fresh units of work. Every retry attempt gets its own instance.
 */
@FunctionalInterface
public interface UnitOfWorkFactory {

    UnitOfWork begin();
}
