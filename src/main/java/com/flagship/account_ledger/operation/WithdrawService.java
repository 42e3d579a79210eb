package com.flagship.account_ledger.operation;

import com.flagship.account_ledger.account.Account;
import com.flagship.account_ledger.account.AccountNumber;
import com.flagship.account_ledger.account.Money;
import com.flagship.account_ledger.error.AccountNotFoundException;
import com.flagship.account_ledger.error.InsufficientFundsException;
import com.flagship.account_ledger.error.InvalidAmountException;
import com.flagship.account_ledger.ledger.LedgerEntry;
import com.flagship.account_ledger.ledger.LedgerEntryType;
import com.flagship.account_ledger.observability.LedgerMetrics;
import com.flagship.account_ledger.observability.RequestContext;
import com.flagship.account_ledger.store.UnitOfWork;
import com.flagship.account_ledger.store.UnitOfWorkFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

/**
 * Debits an account and records one WITHDRAWAL ledger entry, atomically.
 *
 * The balance check runs against the locked, freshly read account, so two concurrent
 * withdrawals can never both spend the same funds. Retried on concurrency conflicts.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class WithdrawService {

    static final String OPERATION = "withdraw";

    private final UnitOfWorkFactory unitOfWorkFactory;
    private final ConflictRetryExecutor retryExecutor;
    private final LedgerMetrics metrics;

    /**
     * @throws InvalidAmountException if the amount is zero or negative
     * @throws AccountNotFoundException if no account has the number
     * @throws InsufficientFundsException if the balance does not cover the amount
     * @throws com.flagship.account_ledger.error.ConcurrencyConflictException once attempts are exhausted
     */
    public TransactionResult withdraw(WithdrawCommand command) {
        long startTime = System.currentTimeMillis();
        MDC.put(RequestContext.ACCOUNT_NUMBER_MDC_KEY, String.valueOf(command.getAccountNumber()));

        try {
            AccountNumber accountNumber = AccountNumber.of(command.getAccountNumber());
            Money amount = Money.of(command.getAmountCents(), command.getCurrency());
            if (amount.isZero()) {
                throw new InvalidAmountException("Withdrawal amount must be greater than zero");
            }

            TransactionResult result = retryExecutor.execute(OPERATION,
                    attempt -> withdrawOnce(accountNumber, amount, attempt));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(OPERATION, LedgerMetrics.OUTCOME_SUCCESS);
            metrics.recordLatency(OPERATION, duration);
            log.debug("Withdrawal finished in {}ms", duration);
            return result;

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(OPERATION, LedgerMetrics.outcomeOf(e));
            metrics.recordLatency(OPERATION, duration);
            log.warn("Withdrawal failed: error={}, duration={}ms", e.getMessage(), duration);
            throw e;
        } finally {
            MDC.remove(RequestContext.ACCOUNT_NUMBER_MDC_KEY);
        }
    }

    private TransactionResult withdrawOnce(AccountNumber accountNumber, Money amount, int attempt) {
        try (UnitOfWork uow = unitOfWorkFactory.begin()) {
            Account account = uow.accounts().getByNumberForUpdate(accountNumber)
                .orElseThrow(() -> AccountNotFoundException.forNumber(accountNumber.getValue()));

            account.withdraw(amount);
            uow.ledger().save(LedgerEntry.create(account.getAccountId(), LedgerEntryType.WITHDRAWAL, amount));
            uow.accounts().save(account);
            uow.commit();

            log.info("Withdrawal completed: amount={}, balance={}, attempt={}",
                    amount, account.getBalance().getAmountCents(), attempt);
            return TransactionResult.from(account);
        }
    }
}
