package com.catalog.reconciliation.lock;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration for keyed lock implementations.
 *
 * @param timeout maximum time to wait for lock acquisition
 */
public record LockConfig(Duration timeout) {

    public LockConfig {
        Objects.requireNonNull(timeout, "timeout is required");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be > 0");
        }
    }

    /**
     * Default configuration: 2 minute timeout, long enough to wait out a full provider resync.
     */
    public static LockConfig defaults() {
        return new LockConfig(Duration.ofMinutes(2));
    }
}
