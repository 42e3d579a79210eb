package com.flagship.account_ledger.store.jdbc;

import com.flagship.account_ledger.account.Account;
import com.flagship.account_ledger.account.AccountId;
import com.flagship.account_ledger.account.AccountNumber;
import com.flagship.account_ledger.account.Money;
import com.flagship.account_ledger.error.ConcurrencyConflictException;
import com.flagship.account_ledger.store.AccountStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Account store on plain JDBC.
 *
 * Optimistic control: every update is {@code WHERE account_id = ? AND version = ?} and
 * bumps the version, so a writer that read a stale row updates nothing and gets a conflict.
 * Pessimistic control: {@link #getByNumberForUpdate} adds {@code FOR UPDATE} when the
 * database supports it and locking is enabled.
 */
@Slf4j
class JdbcAccountStore implements AccountStore {

    private static final String SELECT_BY_NUMBER =
        "SELECT account_id, account_number, balance_cents, currency, version " +
        "FROM accounts WHERE account_number = ?";

    private final JdbcTemplate jdbcTemplate;
    private final JdbcUnitOfWork unitOfWork;
    private final boolean selectForUpdate;

    JdbcAccountStore(JdbcTemplate jdbcTemplate, JdbcUnitOfWork unitOfWork, boolean selectForUpdate) {
        this.jdbcTemplate = jdbcTemplate;
        this.unitOfWork = unitOfWork;
        this.selectForUpdate = selectForUpdate;
    }

    @Override
    public Optional<Account> getByNumber(AccountNumber accountNumber) {
        unitOfWork.ensureActive();
        return queryByNumber(SELECT_BY_NUMBER, accountNumber);
    }

    @Override
    public Optional<Account> getByNumberForUpdate(AccountNumber accountNumber) {
        unitOfWork.ensureActive();
        if (!selectForUpdate) {
            return queryByNumber(SELECT_BY_NUMBER, accountNumber);
        }
        try {
            return queryByNumber(SELECT_BY_NUMBER + " FOR UPDATE", accountNumber);
        } catch (RuntimeException e) {
            throw ConcurrencyFailures.translate("Locking account " + accountNumber, e);
        }
    }

    @Override
    public void save(Account account) {
        unitOfWork.ensureActive();
        try {
            if (account.isNew()) {
                insert(account);
            } else {
                update(account);
            }
        } catch (RuntimeException e) {
            throw ConcurrencyFailures.translate("Saving account " + account.getAccountNumber(), e);
        }
        account.markPersisted();
    }

    private void insert(Account account) {
        // Duplicate account numbers fail here with DuplicateKeyException; not a conflict.
        jdbcTemplate.update(
            "INSERT INTO accounts (account_id, account_number, balance_cents, currency, version, created_at, updated_at) " +
            "VALUES (?, ?, ?, ?, 1, CURRENT_TIMESTAMP, CURRENT_TIMESTAMP)",
            account.getAccountId().getValue(),
            account.getAccountNumber().getValue(),
            account.getBalance().getAmountCents(),
            account.getCurrency()
        );
        log.debug("Inserted account {}", account.getAccountNumber());
    }

    private void update(Account account) {
        int updated = jdbcTemplate.update(
            "UPDATE accounts SET balance_cents = ?, version = version + 1, updated_at = CURRENT_TIMESTAMP " +
            "WHERE account_id = ? AND version = ?",
            account.getBalance().getAmountCents(),
            account.getAccountId().getValue(),
            account.getVersion()
        );
        if (updated == 0) {
            throw new ConcurrencyConflictException(String.format(
                "Account %s was modified concurrently (expected version %d)",
                account.getAccountNumber(), account.getVersion()));
        }
        log.debug("Updated account {} from version {}", account.getAccountNumber(), account.getVersion());
    }

    private Optional<Account> queryByNumber(String sql, AccountNumber accountNumber) {
        List<Account> rows = jdbcTemplate.query(sql, accountRowMapper(), accountNumber.getValue());
        return rows.stream().findFirst();
    }

    private RowMapper<Account> accountRowMapper() {
        return (rs, rowNum) -> Account.restore(
            AccountId.of(UUID.fromString(rs.getString("account_id"))),
            AccountNumber.of(rs.getString("account_number")),
            Money.of(rs.getLong("balance_cents"), rs.getString("currency")),
            rs.getLong("version")
        );
    }
}
