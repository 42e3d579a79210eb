package com.flagship.account_ledger.operation;

import com.flagship.account_ledger.observability.LedgerMetrics;
import com.flagship.account_ledger.store.memory.InMemoryUnitOfWorkFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrent operations against shared in-memory storage.
 *
 * Dependent scenarios gate the second operation on the first one finishing, so the
 * expected balances are exact; the stress scenarios only assert conservation.
 */
class ConcurrentOperationsTest {

    private static final String A = "123000";
    private static final String B = "456000";
    private static final String C = "789000";

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

    private static <T> T await(Future<T> future) throws Exception {
        return future.get(10, TimeUnit.SECONDS);
    }

    @Test
    @DisplayName("Deposit 50 and withdraw 30 in parallel threads end at 20")
    void testParallelDepositAndWithdraw() throws Exception {
        printTestHeader("Parallel deposit + withdraw");
        LedgerFixture ledger = new LedgerFixture();
        ledger.openAccount(A, 0L);
        CountDownLatch depositDone = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            Future<TransactionResult> deposit = executor.submit(() -> {
                try {
                    return ledger.depositService.deposit(new DepositCommand(A, 50L, "BRL"));
                } finally {
                    depositDone.countDown();
                }
            });
            Future<TransactionResult> withdraw = executor.submit(() -> {
                depositDone.await();
                return ledger.withdrawService.withdraw(new WithdrawCommand(A, 30L, "BRL"));
            });

            await(deposit);
            await(withdraw);
        } finally {
            executor.shutdownNow();
        }

        printOutput("Final balance", ledger.balanceOf(A));
        assertEquals(20L, ledger.balanceOf(A));
        assertEquals(2, ledger.entriesOf(A).size());
        printSuccess("Both operations applied exactly once");
    }

    @Test
    @DisplayName("Deposit 100 then transfer 50 from another thread end at 50 / 50")
    void testParallelDepositAndTransfer() throws Exception {
        printTestHeader("Parallel deposit + transfer");
        LedgerFixture ledger = new LedgerFixture();
        ledger.openAccount(A, 0L);
        ledger.openAccount(B, 0L);
        CountDownLatch depositDone = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            Future<TransactionResult> deposit = executor.submit(() -> {
                try {
                    return ledger.depositService.deposit(new DepositCommand(A, 100L, "BRL"));
                } finally {
                    depositDone.countDown();
                }
            });
            Future<TransferResult> transfer = executor.submit(() -> {
                depositDone.await();
                return ledger.transferService.transfer(new TransferCommand(A, B, 50L, "BRL"));
            });

            await(deposit);
            await(transfer);
        } finally {
            executor.shutdownNow();
        }

        printOutput("Balances", A + "=" + ledger.balanceOf(A) + " " + B + "=" + ledger.balanceOf(B));
        assertEquals(50L, ledger.balanceOf(A));
        assertEquals(50L, ledger.balanceOf(B));
        printSuccess("Transfer saw the committed deposit");
    }

    @Test
    @DisplayName("Chained transfers A->B 20 and B->C 10 end at 80 / 10 / 10")
    void testChainedTransfers() throws Exception {
        printTestHeader("Chained transfers");
        LedgerFixture ledger = new LedgerFixture();
        ledger.openAccount(A, 100L);
        ledger.openAccount(B, 0L);
        ledger.openAccount(C, 0L);
        CountDownLatch firstDone = new CountDownLatch(1);
        ExecutorService executor = Executors.newFixedThreadPool(2);

        try {
            Future<TransferResult> first = executor.submit(() -> {
                try {
                    return ledger.transferService.transfer(new TransferCommand(A, B, 20L, "BRL"));
                } finally {
                    firstDone.countDown();
                }
            });
            Future<TransferResult> second = executor.submit(() -> {
                firstDone.await();
                return ledger.transferService.transfer(new TransferCommand(B, C, 10L, "BRL"));
            });

            await(first);
            await(second);
        } finally {
            executor.shutdownNow();
        }

        assertEquals(80L, ledger.balanceOf(A));
        assertEquals(10L, ledger.balanceOf(B));
        assertEquals(10L, ledger.balanceOf(C));
        printSuccess("Chained transfers settled in order");
    }

    @Test
    @DisplayName("Many opposite-direction transfers conserve the total and never deadlock")
    void testOppositeTransfersConserveTotal() throws Exception {
        printTestHeader("Opposite-direction transfers");
        LedgerFixture ledger = new LedgerFixture();
        ledger.openAccount(A, 10_000L);
        ledger.openAccount(B, 10_000L);
        int transfersPerDirection = 50;
        ExecutorService executor = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<TransferResult>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < transfersPerDirection; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    return ledger.transferService.transfer(new TransferCommand(A, B, 7L, "BRL"));
                }));
                futures.add(executor.submit(() -> {
                    start.await();
                    return ledger.transferService.transfer(new TransferCommand(B, A, 7L, "BRL"));
                }));
            }
            start.countDown();
            for (Future<TransferResult> future : futures) {
                await(future);
            }
        } finally {
            executor.shutdownNow();
        }

        printOutput("Balances", A + "=" + ledger.balanceOf(A) + " " + B + "=" + ledger.balanceOf(B));
        assertEquals(20_000L, ledger.balanceOf(A) + ledger.balanceOf(B));
        assertEquals(10_000L, ledger.balanceOf(A));
        assertEquals(2 + 4 * transfersPerDirection, ledger.database.entryCount());
        printSuccess("Total conserved across " + futures.size() + " transfers");
    }

    @Test
    @DisplayName("Without row locks, version checks plus retry keep two opposite transfers consistent")
    void testOptimisticOnlyTransfers() throws Exception {
        printTestHeader("Optimistic-only opposite transfers");
        LedgerFixture ledger = new LedgerFixture(factory ->
            new InMemoryUnitOfWorkFactory(((InMemoryUnitOfWorkFactory) factory).getDatabase(), false, 0L));
        ledger.openAccount(A, 500L);
        ledger.openAccount(B, 500L);
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch start = new CountDownLatch(1);

        try {
            Future<TransferResult> forward = executor.submit(() -> {
                start.await();
                return ledger.transferService.transfer(new TransferCommand(A, B, 100L, "BRL"));
            });
            Future<TransferResult> backward = executor.submit(() -> {
                start.await();
                return ledger.transferService.transfer(new TransferCommand(B, A, 40L, "BRL"));
            });
            start.countDown();
            await(forward);
            await(backward);
        } finally {
            executor.shutdownNow();
        }

        assertEquals(440L, ledger.balanceOf(A));
        assertEquals(560L, ledger.balanceOf(B));
        printSuccess("Lost updates prevented by version checks");
    }

    @Test
    @DisplayName("Concurrent deposits to one account are all applied")
    void testConcurrentDeposits() throws Exception {
        printTestHeader("Concurrent deposits");
        LedgerFixture ledger = new LedgerFixture();
        ledger.openAccount(A, 0L);
        int threads = 20;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        AtomicInteger failures = new AtomicInteger();
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    try {
                        start.await();
                        ledger.depositService.deposit(new DepositCommand(A, 10L, "BRL"));
                    } catch (Exception e) {
                        failures.incrementAndGet();
                    }
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                await(future);
            }
        } finally {
            executor.shutdownNow();
        }

        assertEquals(0, failures.get());
        assertEquals(threads * 10L, ledger.balanceOf(A));
        assertEquals(threads, ledger.entriesOf(A).size());
        assertEquals((double) threads, ledger.operationCount("deposit", LedgerMetrics.OUTCOME_SUCCESS));
    }
}
