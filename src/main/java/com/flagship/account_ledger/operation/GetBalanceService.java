package com.flagship.account_ledger.operation;

import com.flagship.account_ledger.account.AccountNumber;
import com.flagship.account_ledger.error.AccountNotFoundException;
import com.flagship.account_ledger.store.UnitOfWork;
import com.flagship.account_ledger.store.UnitOfWorkFactory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

/**
 * Read-only balance lookup. Takes no locks and never commits.
 */
@Service
@RequiredArgsConstructor
public class GetBalanceService {

    private final UnitOfWorkFactory unitOfWorkFactory;

    public BalanceResult getBalance(String accountNumber) {
        AccountNumber number = AccountNumber.of(accountNumber);
        try (UnitOfWork uow = unitOfWorkFactory.begin()) {
            return uow.accounts().getByNumber(number)
                .map(BalanceResult::from)
                .orElseThrow(() -> AccountNotFoundException.forNumber(number.getValue()));
        }
    }
}
