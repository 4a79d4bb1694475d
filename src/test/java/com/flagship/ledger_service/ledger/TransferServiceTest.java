package com.flagship.ledger_service.ledger;

import com.flagship.ledger_service.TestAccounts;
import com.flagship.ledger_service.account.AccountService;
import com.flagship.ledger_service.concurrency.AccountLockManager;
import com.flagship.ledger_service.exception.AccountNotFoundException;
import com.flagship.ledger_service.exception.InsufficientFundsException;
import com.flagship.ledger_service.exception.SameAccountException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Single-threaded transfer behaviour: happy path, rejections and atomicity.
 */
@SpringBootTest
@ActiveProfiles("test")
class TransferServiceTest {

    @Autowired
    private TransferService transferService;

    @Autowired
    private DepositService depositService;

    @Autowired
    private AccountService accountService;

    @Autowired
    private LedgerQueryService queryService;

    @Autowired
    private AccountLockManager lockManager;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private String x;
    private String y;

    @BeforeEach
    void setUp() {
        x = accountService.createAccount(TestAccounts.holder()).getAccountNumber();
        y = accountService.createAccount(TestAccounts.holder()).getAccountNumber();
    }

    private int transferRowsBetween(String from, String to) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM transactions WHERE from_account = ? AND to_account = ? "
                        + "AND transaction_type = 'TRANSFER'",
                Integer.class, from, to);
        return count != null ? count : 0;
    }

    @Nested
    @DisplayName("Successful transfers")
    class SuccessTests {

        @Test
        @DisplayName("Transfer moves funds and reports both balances after commit")
        void testTransferMovesFunds() {
            depositService.deposit(x, new BigDecimal("100.00"));

            TransferResult result = transferService.transfer(x, y, new BigDecimal("40.00"));

            assertNotNull(result.getTransferId());
            assertEquals(x, result.getFromAccount());
            assertEquals(y, result.getToAccount());
            assertEquals(new BigDecimal("40.00"), result.getAmount());
            assertEquals(new BigDecimal("60.00"), result.getFromBalance());
            assertEquals(new BigDecimal("40.00"), result.getToBalance());

            assertEquals(new BigDecimal("60.00"), queryService.getBalance(x));
            assertEquals(new BigDecimal("40.00"), queryService.getBalance(y));
            assertEquals(1, transferRowsBetween(x, y));
        }

        @Test
        @DisplayName("Transfer of the entire balance leaves the source at zero")
        void testTransferEntireBalance() {
            depositService.deposit(x, new BigDecimal("75.25"));

            TransferResult result = transferService.transfer(x, y, new BigDecimal("75.25"));

            assertEquals(new BigDecimal("0.00"), result.getFromBalance());
            assertEquals(new BigDecimal("75.25"), result.getToBalance());
        }

        @Test
        @DisplayName("Transfer appears in the history of both accounts")
        void testTransferVisibleFromBothSides() {
            depositService.deposit(x, new BigDecimal("10.00"));
            transferService.transfer(x, y, new BigDecimal("3.00"));

            LedgerTransaction latestForX = queryService.getHistory(x, 1).get(0);
            LedgerTransaction latestForY = queryService.getHistory(y, 1).get(0);

            assertEquals(TransactionType.TRANSFER, latestForX.getType());
            assertEquals(latestForX.getId(), latestForY.getId());
        }
    }

    @Nested
    @DisplayName("Rejected transfers")
    class RejectionTests {

        @Test
        @DisplayName("Insufficient funds leaves both balances and the log untouched")
        void testInsufficientFunds() {
            depositService.deposit(x, new BigDecimal("50.00"));

            InsufficientFundsException e = assertThrows(InsufficientFundsException.class,
                    () -> transferService.transfer(x, y, new BigDecimal("100.00")));

            assertEquals(new BigDecimal("50.00"), e.getAvailable());
            assertEquals(new BigDecimal("100.00"), e.getRequired());
            assertEquals(new BigDecimal("50.00"), queryService.getBalance(x));
            assertEquals(new BigDecimal("0.00"), queryService.getBalance(y));
            assertEquals(0, transferRowsBetween(x, y));
            assertFalse(lockManager.isLocked(x));
            assertFalse(lockManager.isLocked(y));
        }

        @Test
        @DisplayName("Same-account transfer fails immediately without touching the lock")
        void testSameAccountRejectedBeforeLocking() throws Exception {
            depositService.deposit(x, new BigDecimal("20.00"));

            // Hold the account's lock elsewhere: a lock attempt would time out instead
            ExecutorService executor = Executors.newSingleThreadExecutor();
            CountDownLatch held = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            Future<?> holder = executor.submit(() -> {
                lockManager.acquire(x, Duration.ofSeconds(5));
                try {
                    held.countDown();
                    release.await(10, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    lockManager.release(x);
                }
            });
            assertTrue(held.await(5, TimeUnit.SECONDS));

            try {
                long start = System.nanoTime();
                assertThrows(SameAccountException.class,
                        () -> transferService.transfer(x, x, new BigDecimal("10.00")));
                long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                assertTrue(elapsedMs < 1000, "Rejection should not wait on the lock, took " + elapsedMs + "ms");
            } finally {
                release.countDown();
                holder.get(5, TimeUnit.SECONDS);
                executor.shutdown();
            }

            assertEquals(new BigDecimal("20.00"), queryService.getBalance(x));
        }

        @Test
        @DisplayName("Missing destination rolls back and leaves the source untouched")
        void testMissingDestination() {
            depositService.deposit(x, new BigDecimal("30.00"));

            assertThrows(AccountNotFoundException.class,
                    () -> transferService.transfer(x, "1999999999", new BigDecimal("10.00")));

            assertEquals(new BigDecimal("30.00"), queryService.getBalance(x));
            assertEquals(0, transferRowsBetween(x, "1999999999"));
        }

        @Test
        @DisplayName("Missing source is reported as not found")
        void testMissingSource() {
            AccountNotFoundException e = assertThrows(AccountNotFoundException.class,
                    () -> transferService.transfer("1888888888", y, new BigDecimal("10.00")));

            assertEquals("1888888888", e.getAccountNumber());
        }

        @Test
        @DisplayName("Non-positive amounts are rejected")
        void testNonPositiveAmount() {
            assertThrows(IllegalArgumentException.class,
                    () -> transferService.transfer(x, y, BigDecimal.ZERO));
            assertThrows(IllegalArgumentException.class,
                    () -> transferService.transfer(x, y, new BigDecimal("-1.00")));
        }

        @Test
        @DisplayName("Direct balance changes made outside the ledger are honoured")
        void testOutOfBandBalanceChange() {
            depositService.deposit(x, new BigDecimal("100.00"));
            // Administrative write that bypasses the engine
            jdbcTemplate.update("UPDATE accounts SET balance = 5.00 WHERE account_number = ?", x);

            assertThrows(InsufficientFundsException.class,
                    () -> transferService.transfer(x, y, new BigDecimal("50.00")));

            assertEquals(new BigDecimal("5.00"), queryService.getBalance(x));
            assertEquals(new BigDecimal("0.00"), queryService.getBalance(y));
        }
    }

    @Test
    @DisplayName("Lock order is lexicographic regardless of transfer direction")
    void testLockOrder() {
        assertEquals(List.of("1000000000", "2000000000"), TransferService.lockOrder("1000000000", "2000000000"));
        assertEquals(List.of("1000000000", "2000000000"), TransferService.lockOrder("2000000000", "1000000000"));
    }
}
