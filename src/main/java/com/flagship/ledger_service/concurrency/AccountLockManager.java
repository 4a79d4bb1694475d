package com.flagship.ledger_service.concurrency;

import com.flagship.ledger_service.exception.LockTimeoutException;
import com.flagship.ledger_service.observability.LedgerMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-account mutual exclusion for ledger mutations.
 *
 * One lock entry exists per account number while at least one thread holds
 * or waits for it. Every thread asking for the same account in that window
 * contends on the same lock instance. The entry is dropped when its last
 * user releases it or gives up waiting, so the table only ever contains
 * accounts that are in use.
 *
 * Locks are not re-entrant from the caller's point of view: a thread that
 * already holds an account lock and asks for it again has a bug, and gets an
 * {@link IllegalStateException} instead of a silent second hold count.
 *
 * The table lives in this process only. Running several instances against one
 * database needs a store-level or distributed lock instead.
 */
@Component
@Slf4j
public class AccountLockManager {

    private final ConcurrentHashMap<String, LockEntry> locks = new ConcurrentHashMap<>();
    private final LedgerMetrics metrics;

    public AccountLockManager(LedgerMetrics metrics) {
        this.metrics = metrics;
    }

    /**
     * Blocks until the account lock is free or the timeout elapses.
     *
     * @throws LockTimeoutException if the lock could not be obtained in time
     * @throws IllegalStateException if the calling thread already holds it
     */
    public void acquire(String accountNumber, Duration timeout) {
        LockEntry current = locks.get(accountNumber);
        if (current != null && current.lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Lock on account " + accountNumber + " is already held by this thread");
        }

        LockEntry entry = locks.compute(accountNumber, (key, existing) -> {
            LockEntry registered = existing != null ? existing : new LockEntry();
            registered.users++;
            return registered;
        });

        boolean acquired;
        try {
            acquired = entry.lock.tryLock(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            unregister(accountNumber);
            Thread.currentThread().interrupt();
            throw new LockTimeoutException(accountNumber, e);
        }

        if (!acquired) {
            unregister(accountNumber);
            metrics.recordLockTimeout();
            log.warn("Timed out waiting {} ms for lock on account {}", timeout.toMillis(), accountNumber);
            throw new LockTimeoutException(accountNumber, timeout);
        }
        log.debug("Lock acquired: account={}", accountNumber);
    }

    /**
     * Releases a lock held by the calling thread. Releasing a lock the thread
     * does not hold is logged and ignored.
     */
    public void release(String accountNumber) {
        LockEntry entry = locks.get(accountNumber);
        if (entry == null || !entry.lock.isHeldByCurrentThread()) {
            log.warn("Release requested for account {} but this thread does not hold its lock", accountNumber);
            return;
        }
        entry.lock.unlock();
        unregister(accountNumber);
        log.debug("Lock released: account={}", accountNumber);
    }

    /**
     * Acquires every lock in the given order. If one of them times out, the
     * locks already taken are released before the failure propagates.
     */
    public void acquireAll(List<String> accountNumbers, Duration timeout) {
        List<String> acquired = new ArrayList<>(accountNumbers.size());
        try {
            for (String accountNumber : accountNumbers) {
                acquire(accountNumber, timeout);
                acquired.add(accountNumber);
            }
        } catch (RuntimeException e) {
            releaseAll(acquired);
            throw e;
        }
    }

    /**
     * Releases the locks in reverse of the given acquisition order. Never throws.
     */
    public void releaseAll(List<String> accountNumbers) {
        for (int i = accountNumbers.size() - 1; i >= 0; i--) {
            String accountNumber = accountNumbers.get(i);
            try {
                release(accountNumber);
            } catch (RuntimeException e) {
                log.error("Failed to release lock on account {}", accountNumber, e);
            }
        }
    }

    /**
     * Advisory only: the answer may be stale by the time the caller reads it.
     */
    public boolean isLocked(String accountNumber) {
        LockEntry entry = locks.get(accountNumber);
        return entry != null && entry.lock.isLocked();
    }

    public Set<String> lockedAccounts() {
        Set<String> locked = new TreeSet<>();
        locks.forEach((accountNumber, entry) -> {
            if (entry.lock.isLocked()) {
                locked.add(accountNumber);
            }
        });
        return locked;
    }

    /**
     * Number of accounts with a live entry, held or awaited.
     */
    int trackedAccounts() {
        return locks.size();
    }

    private void unregister(String accountNumber) {
        locks.computeIfPresent(accountNumber, (key, entry) -> --entry.users == 0 ? null : entry);
    }

    /**
     * {@code users} counts holders plus waiters and is only read or written
     * inside the map's per-key compute functions.
     */
    private static final class LockEntry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }
}
