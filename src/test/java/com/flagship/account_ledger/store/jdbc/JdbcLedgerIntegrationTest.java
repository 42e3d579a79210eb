package com.flagship.account_ledger.store.jdbc;

import com.flagship.account_ledger.account.Account;
import com.flagship.account_ledger.account.AccountNumber;
import com.flagship.account_ledger.account.Money;
import com.flagship.account_ledger.error.AccountAlreadyExistsException;
import com.flagship.account_ledger.error.ConcurrencyConflictException;
import com.flagship.account_ledger.error.InsufficientFundsException;
import com.flagship.account_ledger.ledger.LedgerEntryType;
import com.flagship.account_ledger.operation.CreateAccountCommand;
import com.flagship.account_ledger.operation.CreateAccountService;
import com.flagship.account_ledger.operation.DepositCommand;
import com.flagship.account_ledger.operation.DepositService;
import com.flagship.account_ledger.operation.GetBalanceService;
import com.flagship.account_ledger.operation.GetTransactionsService;
import com.flagship.account_ledger.operation.LedgerEntryResult;
import com.flagship.account_ledger.operation.TransferCommand;
import com.flagship.account_ledger.operation.TransferResult;
import com.flagship.account_ledger.operation.TransferService;
import com.flagship.account_ledger.operation.WithdrawCommand;
import com.flagship.account_ledger.operation.WithdrawService;
import com.flagship.account_ledger.store.UnitOfWork;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JDBC backend against a real PostgreSQL: schema constraints, row locks,
 * version checks and the operations on top of them.
 */
@SpringBootTest
@Testcontainers(disabledWithoutDocker = true)
class JdbcLedgerIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:15-alpine")
            .withDatabaseName("test_ledger")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        registry.add("spring.datasource.url", postgres::getJdbcUrl);
        registry.add("spring.datasource.username", postgres::getUsername);
        registry.add("spring.datasource.password", postgres::getPassword);
        registry.add("ledger.store.type", () -> "jdbc");
    }

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Autowired
    private CreateAccountService createAccountService;

    @Autowired
    private DepositService depositService;

    @Autowired
    private WithdrawService withdrawService;

    @Autowired
    private TransferService transferService;

    @Autowired
    private GetBalanceService getBalanceService;

    @Autowired
    private GetTransactionsService getTransactionsService;

    @BeforeEach
    void setUp() {
        // TRUNCATE does not fire the append-only row trigger
        jdbcTemplate.execute("TRUNCATE ledger_entries, accounts");
    }

    // Helper methods for test output
    private void printTestHeader(String testName) {
        System.out.println("\n" + "=".repeat(80));
        System.out.println("TEST: " + testName);
        System.out.println("=".repeat(80));
    }

    private void printOutput(String label, Object value) {
        System.out.println("OUTPUT - " + label + ": " + value);
    }

    private void printSuccess(String message) {
        System.out.println("✓ SUCCESS: " + message);
    }

    private void open(String accountNumber, long initialBalanceCents) {
        createAccountService.createAccount(new CreateAccountCommand(accountNumber, initialBalanceCents, "BRL"));
    }

    private long balanceOf(String accountNumber) {
        return getBalanceService.getBalance(accountNumber).getBalanceCents();
    }

    @Test
    @DisplayName("Deposit, withdraw and transfer persist balances, versions and ledger entries")
    void testOperationsPersist() {
        printTestHeader("Operations persist through JDBC");
        open("100000", 0L);
        open("200000", 0L);

        depositService.deposit(new DepositCommand("100000", 10000L, "BRL"));
        withdrawService.withdraw(new WithdrawCommand("100000", 2000L, "BRL"));
        TransferResult transfer = transferService.transfer(new TransferCommand("100000", "200000", 3000L, "BRL"));

        assertEquals(5000L, balanceOf("100000"));
        assertEquals(3000L, balanceOf("200000"));
        assertEquals(4L, jdbcTemplate.queryForObject(
            "SELECT version FROM accounts WHERE account_number = ?", Long.class, "100000"));

        List<LedgerEntryResult> entries = getTransactionsService.getTransactions("100000");
        printOutput("Entries", entries);
        assertEquals(List.of(LedgerEntryType.TRANSFER_OUT, LedgerEntryType.WITHDRAWAL, LedgerEntryType.DEPOSIT),
            entries.stream().map(LedgerEntryResult::getEntryType).toList());
        assertEquals(transfer.getCorrelationId(), entries.get(0).getCorrelationId());
        assertEquals("200000", entries.get(0).getCounterpartyAccountNumber());
        printSuccess("Balances and history match");
    }

    @Test
    void testDuplicateAccount() {
        open("100000", 100L);

        assertThrows(AccountAlreadyExistsException.class, () -> open("100000", 0L));
        assertEquals(1, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM accounts", Integer.class));
    }

    @Test
    @DisplayName("A failed transfer rolls back the debit on the source")
    void testInsufficientFundsRollsBack() {
        open("100000", 100L);
        open("200000", 0L);

        assertThrows(InsufficientFundsException.class,
            () -> transferService.transfer(new TransferCommand("100000", "200000", 101L, "BRL")));

        assertEquals(100L, balanceOf("100000"));
        assertEquals(0L, balanceOf("200000"));
        assertEquals(1, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM ledger_entries", Integer.class));
    }

    @Test
    @DisplayName("Ledger entries cannot be updated")
    void testLedgerIsAppendOnly() {
        open("100000", 100L);

        assertThrows(DataAccessException.class,
            () -> jdbcTemplate.update("UPDATE ledger_entries SET amount_cents = 1"));
    }

    @Test
    @DisplayName("Without row locks, a stale write is rejected by the version check")
    void testOptimisticVersionConflict() throws Exception {
        printTestHeader("Optimistic version conflict");
        open("100000", 1000L);
        JdbcUnitOfWorkFactory optimistic = new JdbcUnitOfWorkFactory(transactionManager, jdbcTemplate, false, 0L);
        CountDownLatch staleRead = new CountDownLatch(1);
        CountDownLatch otherCommitted = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            Future<?> stale = executor.submit(() -> {
                try (UnitOfWork uow = optimistic.begin()) {
                    Account account = uow.accounts().getByNumberForUpdate(AccountNumber.of("100000")).orElseThrow();
                    staleRead.countDown();
                    otherCommitted.await(5, TimeUnit.SECONDS);
                    account.withdraw(Money.of(100L, "BRL"));
                    uow.accounts().save(account);
                    uow.commit();
                }
                return null;
            });
            Future<?> winner = executor.submit(() -> {
                staleRead.await(5, TimeUnit.SECONDS);
                try (UnitOfWork uow = optimistic.begin()) {
                    Account account = uow.accounts().getByNumberForUpdate(AccountNumber.of("100000")).orElseThrow();
                    account.withdraw(Money.of(300L, "BRL"));
                    uow.accounts().save(account);
                    uow.commit();
                } finally {
                    otherCommitted.countDown();
                }
                return null;
            });

            winner.get(10, TimeUnit.SECONDS);
            Exception e = assertThrows(Exception.class, () -> stale.get(10, TimeUnit.SECONDS));
            assertInstanceOf(ConcurrencyConflictException.class, e.getCause());
        } finally {
            executor.shutdownNow();
        }

        assertEquals(700L, balanceOf("100000"));
        printSuccess("Stale write rejected, winner kept");
    }

    @Test
    @DisplayName("A row lock held past the lock timeout surfaces as a concurrency conflict")
    void testLockTimeoutIsConflict() throws Exception {
        open("100000", 1000L);
        JdbcUnitOfWorkFactory impatient = new JdbcUnitOfWorkFactory(transactionManager, jdbcTemplate, true, 200L);
        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            Future<?> holder = executor.submit(() -> {
                try (UnitOfWork uow = impatient.begin()) {
                    uow.accounts().getByNumberForUpdate(AccountNumber.of("100000")).orElseThrow();
                    locked.countDown();
                    release.await(10, TimeUnit.SECONDS);
                }
                return null;
            });
            Future<?> contender = executor.submit(() -> {
                locked.await(5, TimeUnit.SECONDS);
                try (UnitOfWork uow = impatient.begin()) {
                    uow.accounts().getByNumberForUpdate(AccountNumber.of("100000"));
                } finally {
                    release.countDown();
                }
                return null;
            });

            Exception e = assertThrows(Exception.class, () -> contender.get(10, TimeUnit.SECONDS));
            assertInstanceOf(ConcurrencyConflictException.class, e.getCause());
            holder.get(10, TimeUnit.SECONDS);
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    @DisplayName("Concurrent opposite-direction transfers conserve the total without deadlocks")
    void testOppositeTransfersConserveTotal() throws Exception {
        printTestHeader("Opposite-direction transfers on PostgreSQL");
        open("100000", 5000L);
        open("200000", 5000L);
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<TransferResult>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < 20; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return transferService.transfer(new TransferCommand("100000", "200000", 11L, "BRL"));
                }));
                futures.add(executor.submit(() -> {
                    start.await();
                    return transferService.transfer(new TransferCommand("200000", "100000", 11L, "BRL"));
                }));
            }
            start.countDown();
            for (Future<TransferResult> future : futures) {
                future.get(30, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        long total = balanceOf("100000") + balanceOf("200000");
        printOutput("Total", total);
        assertEquals(10000L, total);
        assertEquals(5000L, balanceOf("100000"));
        assertEquals(82, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM ledger_entries", Integer.class));
        printSuccess("Total conserved");
    }
}
