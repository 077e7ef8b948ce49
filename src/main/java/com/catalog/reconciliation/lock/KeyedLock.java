package com.catalog.reconciliation.lock;

import java.util.function.Supplier;

/**
 * Mutual exclusion per key within one process.
 * There is no cross-process locking; persisted state relies on the store's own transactions.
 */
public interface KeyedLock {

    /**
     * Acquires the lock on the given key, waiting up to the configured timeout.
     *
     * @param key the lock key
     * @return true if the lock was acquired
     * @throws LockAcquisitionException if the lock could not be acquired in time
     */
    boolean tryLock(String key);

    /**
     * Releases a lock on the given key held by the current thread.
     *
     * @param key the lock key
     */
    void unlock(String key);

    /**
     * Runs {@code action} while holding the lock on {@code key}.
     *
     * @throws LockAcquisitionException if the lock could not be acquired in time
     */
    default <T> T withLock(String key, Supplier<T> action) {
        tryLock(key);
        try {
            return action.get();
        } finally {
            unlock(key);
        }
    }
}
