package com.financeforge.ledger;

import com.financeforge.common.exception.ConcurrencyConflictException;
import com.financeforge.common.exception.LedgerPersistenceException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.Collection;
import java.util.Deque;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Write locks for the event log.
 *
 * Each account has its own lock so that one writer at a time extends an account's
 * chain. All appends also share the log lock, which a backup takes exclusively
 * for the instant it needs to fix a high-water mark. Every wait is bounded.
 */
@Component
@Slf4j
public class AccountLockRegistry {

    private final ConcurrentMap<String, ReentrantLock> accountLocks = new ConcurrentHashMap<>();
    private final ReentrantReadWriteLock logLock = new ReentrantReadWriteLock(true);
    private final long timeoutMillis;

    public AccountLockRegistry(@Value("${financeforge.ledger.lock-timeout-ms:2000}") long timeoutMillis) {
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * Acquire the shared log lock and the locks of the given accounts, always in
     * account id order so that multi-account appends cannot deadlock.
     *
     * @return the held locks, to be passed to {@link #release(Deque)}
     * @throws ConcurrencyConflictException if a lock is not obtained in time
     */
    public Deque<Lock> acquireForAppend(Collection<String> accountIds) {
        Deque<Lock> held = new ArrayDeque<>();
        try {
            tryAcquire(logLock.readLock(), "event log", held);
            for (String accountId : new TreeSet<>(accountIds)) {
                ReentrantLock lock = accountLocks.computeIfAbsent(accountId, id -> new ReentrantLock(true));
                tryAcquire(lock, accountId, held);
            }
            return held;
        } catch (RuntimeException e) {
            release(held);
            throw e;
        }
    }

    /**
     * Acquire the log lock exclusively. Waits for in-flight appends to commit.
     */
    public Lock acquireExclusive() {
        Lock lock = logLock.writeLock();
        try {
            if (!lock.tryLock(timeoutMillis, TimeUnit.MILLISECONDS)) {
                throw new LedgerPersistenceException(
                    "Timed out waiting for in-flight appends to finish", null);
            }
            return lock;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LedgerPersistenceException("Interrupted while freezing the event log", e);
        }
    }

    public void release(Deque<Lock> held) {
        while (!held.isEmpty()) {
            held.pop().unlock();
        }
    }

    private void tryAcquire(Lock lock, String name, Deque<Lock> held) {
        try {
            if (!lock.tryLock(timeoutMillis, TimeUnit.MILLISECONDS)) {
                log.warn("Lock wait on {} exceeded {} ms", name, timeoutMillis);
                throw new ConcurrencyConflictException(name,
                    "Timed out after " + timeoutMillis + " ms waiting to append to " + name);
            }
            held.push(lock);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ConcurrencyConflictException(name, "Interrupted while waiting to append to " + name);
        }
    }
}
