package com.flagship.account_ledger.operation;

import com.flagship.account_ledger.observability.LedgerMetrics;
import com.flagship.account_ledger.store.UnitOfWorkFactory;
import com.flagship.account_ledger.store.memory.InMemoryLedgerDatabase;
import com.flagship.account_ledger.store.memory.InMemoryUnitOfWorkFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.List;
import java.util.function.UnaryOperator;

/**
 * All operations wired over one in-memory database, the way the application context wires them.
 */
class LedgerFixture {

    static final String CURRENCY = "BRL";

    final InMemoryLedgerDatabase database = new InMemoryLedgerDatabase();
    final SimpleMeterRegistry registry = new SimpleMeterRegistry();
    final LedgerMetrics metrics = new LedgerMetrics(registry);
    final UnitOfWorkFactory unitOfWorkFactory;
    final ConflictRetryExecutor retryExecutor;

    final CreateAccountService createAccountService;
    final DepositService depositService;
    final WithdrawService withdrawService;
    final TransferService transferService;
    final GetBalanceService getBalanceService;
    final GetTransactionsService getTransactionsService;

    LedgerFixture() {
        this(factory -> factory);
    }

    /**
     * @param decorator wraps the in-memory factory used by the mutating operations
     */
    LedgerFixture(UnaryOperator<UnitOfWorkFactory> decorator) {
        InMemoryUnitOfWorkFactory base = new InMemoryUnitOfWorkFactory(database, true, 2000L);
        this.unitOfWorkFactory = decorator.apply(base);
        this.retryExecutor = new ConflictRetryExecutor(3, 0L, metrics);

        this.createAccountService = new CreateAccountService(base, metrics);
        this.depositService = new DepositService(unitOfWorkFactory, retryExecutor, metrics);
        this.withdrawService = new WithdrawService(unitOfWorkFactory, retryExecutor, metrics);
        this.transferService = new TransferService(unitOfWorkFactory, retryExecutor, metrics);
        this.getBalanceService = new GetBalanceService(base);
        this.getTransactionsService = new GetTransactionsService(base);
    }

    AccountCreatedResult openAccount(String accountNumber, long initialBalanceCents) {
        return createAccountService.createAccount(
            new CreateAccountCommand(accountNumber, initialBalanceCents, CURRENCY));
    }

    long balanceOf(String accountNumber) {
        return getBalanceService.getBalance(accountNumber).getBalanceCents();
    }

    List<LedgerEntryResult> entriesOf(String accountNumber) {
        return getTransactionsService.getTransactions(accountNumber);
    }

    double operationCount(String operation, String outcome) {
        return registry.counter("ledger.operations", "operation", operation, "outcome", outcome).count();
    }
}
