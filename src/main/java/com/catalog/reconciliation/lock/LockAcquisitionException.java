package com.catalog.reconciliation.lock;

/**
 * Thrown when a keyed lock cannot be acquired within its timeout.
 */
public class LockAcquisitionException extends RuntimeException {

    public LockAcquisitionException(String message) {
        super(message);
    }

    public LockAcquisitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
