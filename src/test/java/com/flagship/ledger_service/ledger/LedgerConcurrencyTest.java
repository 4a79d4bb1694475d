package com.flagship.ledger_service.ledger;

import com.flagship.ledger_service.TestAccounts;
import com.flagship.ledger_service.account.AccountService;
import com.flagship.ledger_service.concurrency.AccountLockManager;
import com.flagship.ledger_service.exception.InsufficientFundsException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tries to break the ledger with concurrent transfers.
 *
 * These tests verify:
 * - Opposite-direction transfers over the same pair never deadlock
 * - Total money across accounts is conserved
 * - Every committed transfer is applied exactly once
 * - No lock survives the run
 */
@SpringBootTest
@ActiveProfiles("test")
class LedgerConcurrencyTest {

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

    private String a;
    private String b;
    private String c;

    @BeforeEach
    void setUp() {
        a = accountService.createAccount(TestAccounts.holder()).getAccountNumber();
        b = accountService.createAccount(TestAccounts.holder()).getAccountNumber();
        c = accountService.createAccount(TestAccounts.holder()).getAccountNumber();
        depositService.deposit(a, new BigDecimal("1000.00"));
        depositService.deposit(b, new BigDecimal("1000.00"));
        depositService.deposit(c, new BigDecimal("1000.00"));
    }

    private BigDecimal total(String... accounts) {
        BigDecimal sum = BigDecimal.ZERO;
        for (String account : accounts) {
            sum = sum.add(queryService.getBalance(account));
        }
        return sum;
    }

    private int transferRowsAmong(String... accounts) {
        String in = "'" + String.join("','", accounts) + "'";
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM transactions WHERE transaction_type = 'TRANSFER' "
                        + "AND from_account IN (" + in + ") AND to_account IN (" + in + ")",
                Integer.class);
        return count != null ? count : 0;
    }

    @Test
    @DisplayName("Opposite transfers over the same pair both complete with net zero effect")
    void testOppositeTransfersDoNotDeadlock() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(2);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(2);
        AtomicInteger failures = new AtomicInteger();

        executor.submit(() -> runAfter(startLatch, doneLatch, failures,
                () -> transferService.transfer(a, b, new BigDecimal("25.00"))));
        executor.submit(() -> runAfter(startLatch, doneLatch, failures,
                () -> transferService.transfer(b, a, new BigDecimal("25.00"))));

        startLatch.countDown();
        assertTrue(doneLatch.await(30, TimeUnit.SECONDS), "Transfers deadlocked");
        executor.shutdown();

        assertEquals(0, failures.get());
        assertEquals(new BigDecimal("1000.00"), queryService.getBalance(a));
        assertEquals(new BigDecimal("1000.00"), queryService.getBalance(b));
        assertEquals(2, transferRowsAmong(a, b));
    }

    @Test
    @DisplayName("Fifty random-direction transfers among three accounts conserve money")
    void testRandomTransfersConserveMoney() throws Exception {
        int transfers = 50;
        List<String> accounts = List.of(a, b, c);
        Random random = new Random(42);
        BigDecimal before = total(a, b, c);

        ExecutorService executor = Executors.newFixedThreadPool(10);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(transfers);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger insufficient = new AtomicInteger();
        AtomicInteger unexpected = new AtomicInteger();

        for (int i = 0; i < transfers; i++) {
            List<String> pair = new ArrayList<>(accounts);
            Collections.shuffle(pair, random);
            String from = pair.get(0);
            String to = pair.get(1);
            BigDecimal amount = BigDecimal.valueOf(1 + random.nextInt(100)).setScale(2);

            executor.submit(() -> {
                try {
                    startLatch.await();
                    transferService.transfer(from, to, amount);
                    succeeded.incrementAndGet();
                } catch (InsufficientFundsException e) {
                    insufficient.incrementAndGet();
                } catch (Exception e) {
                    unexpected.incrementAndGet();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(60, TimeUnit.SECONDS), "Transfers did not finish, possible deadlock");
        executor.shutdown();

        assertEquals(0, unexpected.get(), "No transfer should fail for reasons other than funds");
        assertEquals(transfers, succeeded.get() + insufficient.get());
        assertEquals(0, before.compareTo(total(a, b, c)), "Money must be conserved");
        assertEquals(succeeded.get(), transferRowsAmong(a, b, c), "Each committed transfer is recorded once");
        for (String account : accounts) {
            assertTrue(queryService.getBalance(account).signum() >= 0);
            assertFalse(lockManager.isLocked(account));
        }
    }

    @Test
    @DisplayName("Concurrent withdrawals from one account never overdraw it")
    void testConcurrentTransfersNeverOverdraw() throws Exception {
        // a holds 1000.00; twenty 100.00 transfers can succeed at most ten times
        int attempts = 20;
        ExecutorService executor = Executors.newFixedThreadPool(attempts);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(attempts);
        AtomicInteger succeeded = new AtomicInteger();
        AtomicInteger insufficient = new AtomicInteger();
        AtomicInteger unexpected = new AtomicInteger();

        for (int i = 0; i < attempts; i++) {
            String to = i % 2 == 0 ? b : c;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    transferService.transfer(a, to, new BigDecimal("100.00"));
                    succeeded.incrementAndGet();
                } catch (InsufficientFundsException e) {
                    insufficient.incrementAndGet();
                } catch (Exception e) {
                    unexpected.incrementAndGet();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(60, TimeUnit.SECONDS));
        executor.shutdown();

        assertEquals(0, unexpected.get());
        assertEquals(10, succeeded.get());
        assertEquals(10, insufficient.get());
        assertEquals(new BigDecimal("0.00"), queryService.getBalance(a));
        assertEquals(0, new BigDecimal("3000.00").compareTo(total(a, b, c)));
    }

    private static void runAfter(CountDownLatch startLatch, CountDownLatch doneLatch,
                                 AtomicInteger failures, Runnable action) {
        try {
            startLatch.await();
            action.run();
        } catch (Exception e) {
            failures.incrementAndGet();
        } finally {
            doneLatch.countDown();
        }
    }
}
