package com.catalog.reconciliation.snapshot;

/**
 * Thrown when the snapshot cannot be refreshed or read. A failed refresh leaves the
 * previously persisted snapshot in place.
 */
public class SnapshotSyncException extends RuntimeException {

    public SnapshotSyncException(String message) {
        super(message);
    }

    public SnapshotSyncException(String message, Throwable cause) {
        super(message, cause);
    }
}
