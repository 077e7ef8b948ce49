package com.catalog.reconciliation.snapshot;

/**
 * The single sync-state row of a snapshot.
 *
 * @param lastSyncedAt ISO-8601 time of the fetch that produced the snapshot
 * @param version      provider data version of that fetch
 * @param itemCount    number of object entries the fetch returned
 */
public record SyncState(String lastSyncedAt, String version, int itemCount) {}
