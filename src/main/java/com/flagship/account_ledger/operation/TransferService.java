package com.flagship.account_ledger.operation;

import com.flagship.account_ledger.account.Account;
import com.flagship.account_ledger.account.AccountNumber;
import com.flagship.account_ledger.account.Money;
import com.flagship.account_ledger.error.AccountNotFoundException;
import com.flagship.account_ledger.error.InsufficientFundsException;
import com.flagship.account_ledger.error.InvalidAmountException;
import com.flagship.account_ledger.error.SameAccountTransferException;
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

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Moves money between two accounts.
 *
 * Key invariants:
 * - both accounts are locked in ascending account-number order, whatever the direction
 * - the debit, the credit and both ledger entries commit together or not at all
 * - TRANSFER_OUT and TRANSFER_IN share one correlation id and name each other as counterparty
 * - the correlation id is generated once and reused by every retry attempt
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TransferService {

    static final String OPERATION = "transfer";

    private final UnitOfWorkFactory unitOfWorkFactory;
    private final ConflictRetryExecutor retryExecutor;
    private final LedgerMetrics metrics;

    /**
     * @throws SameAccountTransferException if source and destination are the same account
     * @throws InvalidAmountException if the amount is zero or negative
     * @throws AccountNotFoundException if either account is missing
     * @throws InsufficientFundsException if the source balance does not cover the amount
     * @throws com.flagship.account_ledger.error.ConcurrencyConflictException once attempts are exhausted
     */
    public TransferResult transfer(TransferCommand command) {
        long startTime = System.currentTimeMillis();
        UUID correlationId = UUID.randomUUID();
        MDC.put(RequestContext.TRANSFER_ID_MDC_KEY, correlationId.toString());

        log.info("Attempting transfer: from={}, to={}, amountCents={}",
                command.getFromAccountNumber(), command.getToAccountNumber(), command.getAmountCents());

        try {
            AccountNumber from = AccountNumber.of(command.getFromAccountNumber());
            AccountNumber to = AccountNumber.of(command.getToAccountNumber());
            if (from.equals(to)) {
                throw new SameAccountTransferException("Cannot transfer from account " + from + " to itself");
            }
            Money amount = Money.of(command.getAmountCents(), command.getCurrency());
            if (amount.isZero()) {
                throw new InvalidAmountException("Transfer amount must be greater than zero");
            }

            TransferResult result = retryExecutor.execute(OPERATION,
                    attempt -> transferOnce(from, to, amount, correlationId, attempt));

            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(OPERATION, LedgerMetrics.OUTCOME_SUCCESS);
            metrics.recordLatency(OPERATION, duration);
            log.debug("Transfer finished in {}ms", duration);
            return result;

        } catch (RuntimeException e) {
            long duration = System.currentTimeMillis() - startTime;
            metrics.recordOperation(OPERATION, LedgerMetrics.outcomeOf(e));
            metrics.recordLatency(OPERATION, duration);
            log.warn("Transfer failed: error={}, duration={}ms", e.getMessage(), duration);
            throw e;
        } finally {
            MDC.remove(RequestContext.TRANSFER_ID_MDC_KEY);
        }
    }

    private TransferResult transferOnce(AccountNumber from, AccountNumber to, Money amount, UUID correlationId,
                                        int attempt) {
        try (UnitOfWork uow = unitOfWorkFactory.begin()) {
            Map<AccountNumber, Account> locked = OrderedAccountLocker.lockInOrder(uow.accounts(), List.of(from, to));
            Account source = locked.get(from);
            Account destination = locked.get(to);

            source.withdraw(amount);
            destination.deposit(amount);

            Instant occurredAt = Instant.now();
            uow.ledger().save(LedgerEntry.create(source.getAccountId(), LedgerEntryType.TRANSFER_OUT,
                    amount, correlationId, to, occurredAt));
            uow.ledger().save(LedgerEntry.create(destination.getAccountId(), LedgerEntryType.TRANSFER_IN,
                    amount, correlationId, from, occurredAt));

            uow.accounts().save(source);
            uow.accounts().save(destination);
            uow.commit();

            log.info("Transfer completed: amount={}, fromBalance={}, toBalance={}, attempt={}",
                    amount, source.getBalance().getAmountCents(), destination.getBalance().getAmountCents(), attempt);
            return TransferResult.builder()
                .correlationId(correlationId)
                .fromAccountNumber(from.getValue())
                .toAccountNumber(to.getValue())
                .fromBalanceCents(source.getBalance().getAmountCents())
                .toBalanceCents(destination.getBalance().getAmountCents())
                .currency(amount.getCurrency())
                .build();
        }
    }
}
