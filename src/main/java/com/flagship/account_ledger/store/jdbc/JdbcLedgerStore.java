package com.flagship.account_ledger.store.jdbc;

import com.flagship.account_ledger.account.AccountId;
import com.flagship.account_ledger.account.AccountNumber;
import com.flagship.account_ledger.account.Money;
import com.flagship.account_ledger.ledger.LedgerEntry;
import com.flagship.account_ledger.ledger.LedgerEntryType;
import com.flagship.account_ledger.store.LedgerStore;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;

import java.sql.Timestamp;
import java.util.List;
import java.util.UUID;

/**
 * Ledger store on plain JDBC. Inserts only; the database trigger rejects
 * UPDATE and DELETE on ledger_entries.
 */
class JdbcLedgerStore implements LedgerStore {

    private final JdbcTemplate jdbcTemplate;
    private final JdbcUnitOfWork unitOfWork;

    JdbcLedgerStore(JdbcTemplate jdbcTemplate, JdbcUnitOfWork unitOfWork) {
        this.jdbcTemplate = jdbcTemplate;
        this.unitOfWork = unitOfWork;
    }

    @Override
    public void save(LedgerEntry entry) {
        unitOfWork.ensureActive();
        jdbcTemplate.update(
            "INSERT INTO ledger_entries (entry_id, account_id, entry_type, amount_cents, currency, " +
            "correlation_id, counterparty_account_number, occurred_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?)",
            entry.getEntryId(),
            entry.getAccountId().getValue(),
            entry.getEntryType().name(),
            entry.getAmount().getAmountCents(),
            entry.getAmount().getCurrency(),
            entry.getCorrelationId(),
            entry.getCounterpartyAccountNumber() != null ? entry.getCounterpartyAccountNumber().getValue() : null,
            Timestamp.from(entry.getOccurredAt())
        );
    }

    @Override
    public List<LedgerEntry> listByAccount(AccountId accountId) {
        unitOfWork.ensureActive();
        return jdbcTemplate.query(
            "SELECT entry_id, account_id, entry_type, amount_cents, currency, correlation_id, " +
            "counterparty_account_number, occurred_at " +
            "FROM ledger_entries WHERE account_id = ? ORDER BY sequence_number",
            ledgerEntryRowMapper(),
            accountId.getValue()
        );
    }

    private RowMapper<LedgerEntry> ledgerEntryRowMapper() {
        return (rs, rowNum) -> {
            String correlationId = rs.getString("correlation_id");
            String counterparty = rs.getString("counterparty_account_number");
            return LedgerEntry.restore(
                UUID.fromString(rs.getString("entry_id")),
                AccountId.of(UUID.fromString(rs.getString("account_id"))),
                LedgerEntryType.valueOf(rs.getString("entry_type")),
                Money.of(rs.getLong("amount_cents"), rs.getString("currency")),
                correlationId != null ? UUID.fromString(correlationId) : null,
                counterparty != null ? AccountNumber.of(counterparty) : null,
                rs.getTimestamp("occurred_at").toInstant()
            );
        };
    }
}
