package com.flagship.account_ledger.operation;

import com.flagship.account_ledger.account.Account;
import com.flagship.account_ledger.account.AccountNumber;
import com.flagship.account_ledger.error.AccountNotFoundException;
import com.flagship.account_ledger.ledger.LedgerEntry;
import com.flagship.account_ledger.store.UnitOfWork;
import com.flagship.account_ledger.store.UnitOfWorkFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Read-only ledger history of one account, most recent first.
 *
 * Entries with the same timestamp (the two legs of a transfer, for one) keep
 * reverse append order, so the later write is listed first.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GetTransactionsService {

    private final UnitOfWorkFactory unitOfWorkFactory;

    public List<LedgerEntryResult> getTransactions(String accountNumber) {
        AccountNumber number = AccountNumber.of(accountNumber);
        try (UnitOfWork uow = unitOfWorkFactory.begin()) {
            Account account = uow.accounts().getByNumber(number)
                .orElseThrow(() -> AccountNotFoundException.forNumber(number.getValue()));

            List<LedgerEntry> entries = new ArrayList<>(uow.ledger().listByAccount(account.getAccountId()));
            Collections.reverse(entries);
            entries.sort(Comparator.comparing(LedgerEntry::getOccurredAt).reversed());

            log.debug("Loaded {} ledger entries for account {}", entries.size(), number);
            return entries.stream()
                .map(LedgerEntryResult::from)
                .toList();
        }
    }
}
