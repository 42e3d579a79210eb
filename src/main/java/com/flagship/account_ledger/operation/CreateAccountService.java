package com.flagship.account_ledger.operation;

import com.flagship.account_ledger.account.Account;
import com.flagship.account_ledger.account.AccountNumber;
import com.flagship.account_ledger.account.Money;
import com.flagship.account_ledger.error.AccountAlreadyExistsException;
import com.flagship.account_ledger.ledger.LedgerEntry;
import com.flagship.account_ledger.ledger.LedgerEntryType;
import com.flagship.account_ledger.observability.LedgerMetrics;
import com.flagship.account_ledger.observability.RequestContext;
import com.flagship.account_ledger.store.UnitOfWork;
import com.flagship.account_ledger.store.UnitOfWorkFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;

/**
 * Opens new accounts.
 *
 * The existence check is a plain read. Two concurrent creates of the same number can
 * both pass it; the store's unique account number then rejects the second one at write
 * or commit time, and that rejection is reported as {@link AccountAlreadyExistsException}.
 * Single attempt, never retried.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreateAccountService {

    static final String OPERATION = "create_account";

    private final UnitOfWorkFactory unitOfWorkFactory;
    private final LedgerMetrics metrics;

    /**
     * @throws AccountAlreadyExistsException if the account number is taken
     */
    public AccountCreatedResult createAccount(CreateAccountCommand command) {
        long startTime = System.currentTimeMillis();
        MDC.put(RequestContext.ACCOUNT_NUMBER_MDC_KEY, String.valueOf(command.getAccountNumber()));

        try {
            AccountNumber accountNumber = AccountNumber.of(command.getAccountNumber());
            Money initialBalance = Money.of(command.getInitialBalanceCents(), command.getCurrency());

            AccountCreatedResult result;
            try {
                result = open(accountNumber, initialBalance);
            } catch (DuplicateKeyException e) {
                throw new AccountAlreadyExistsException(alreadyExistsMessage(accountNumber));
            }

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(OPERATION, LedgerMetrics.OUTCOME_SUCCESS);
            metrics.recordLatency(OPERATION, duration);
            log.info("Account created: accountId={}, balance={}, duration={}ms",
                    result.getAccountId(), initialBalance, duration);
            return result;

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(OPERATION, LedgerMetrics.outcomeOf(e));
            metrics.recordLatency(OPERATION, duration);
            log.warn("Account creation failed: error={}, duration={}ms", e.getMessage(), duration);
            throw e;
        } finally {
            MDC.remove(RequestContext.ACCOUNT_NUMBER_MDC_KEY);
        }
    }

    private AccountCreatedResult open(AccountNumber accountNumber, Money initialBalance) {
        try (UnitOfWork uow = unitOfWorkFactory.begin()) {
            if (uow.accounts().getByNumber(accountNumber).isPresent()) {
                throw new AccountAlreadyExistsException(alreadyExistsMessage(accountNumber));
            }

            Account account = Account.open(accountNumber, initialBalance.getCurrency());
            LedgerEntry initialDeposit = null;
            if (!initialBalance.isZero()) {
                account.deposit(initialBalance);
                initialDeposit = LedgerEntry.create(account.getAccountId(), LedgerEntryType.DEPOSIT, initialBalance);
            }

            // the account row must exist before any entry referencing it
            uow.accounts().save(account);
            if (initialDeposit != null) {
                uow.ledger().save(initialDeposit);
            }
            uow.commit();

            return AccountCreatedResult.from(account);
        }
    }

    private static String alreadyExistsMessage(AccountNumber accountNumber) {
        return "Account with number " + accountNumber + " already exists";
    }
}
