package com.catalog.reconciliation.lock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * In-process keyed lock using one {@link ReentrantLock} per key. Locks are reentrant for
 * the holding thread and are kept for the lifetime of the instance; the key space here is
 * one key per snapshot provider.
 */
public class LocalKeyedLock implements KeyedLock {
    private static final Logger log = LoggerFactory.getLogger(LocalKeyedLock.class);

    private final Map<String, ReentrantLock> locksByKey = new ConcurrentHashMap<>();
    private final Duration timeout;

    public LocalKeyedLock() {
        this(LockConfig.defaults());
    }

    public LocalKeyedLock(LockConfig config) {
        this.timeout = config.timeout();
    }

    @Override
    public boolean tryLock(String key) {
        ReentrantLock lock = locksByKey.computeIfAbsent(key, ignored -> new ReentrantLock());
        long waitStart = System.nanoTime();
        boolean acquired;
        try {
            acquired = lock.tryLock(timeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LockAcquisitionException("Interrupted while waiting for lock '" + key + "'", e);
        }

        long waitedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - waitStart);
        if (!acquired) {
            log.warn("lock.timeout key={} waitedMs={}", key, waitedMs);
            throw new LockAcquisitionException("Lock '" + key + "' not acquired within " + timeout);
        }
        log.debug("lock.acquired key={} waitedMs={} holds={}", key, waitedMs, lock.getHoldCount());
        return true;
    }

    @Override
    public void unlock(String key) {
        ReentrantLock lock = locksByKey.get(key);
        if (lock == null || !lock.isHeldByCurrentThread()) {
            log.debug("lock.release-ignored key={}", key);
            return;
        }
        lock.unlock();
        log.debug("lock.released key={}", key);
    }
}
