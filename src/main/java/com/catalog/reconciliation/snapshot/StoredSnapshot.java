package com.catalog.reconciliation.snapshot;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Sync state and raw items read together in one transaction.
 *
 * @param syncState state row, empty if the snapshot was never written
 * @param itemsRaw  parsed raw payloads ordered by name, case-insensitively
 */
public record StoredSnapshot(Optional<SyncState> syncState, List<JsonNode> itemsRaw) {
    public StoredSnapshot {
        syncState = syncState != null ? syncState : Optional.empty();
        itemsRaw = itemsRaw != null ? List.copyOf(itemsRaw) : List.of();
    }
}
