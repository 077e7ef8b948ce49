package com.catalog.reconciliation.provider;

import com.catalog.reconciliation.core.model.Provider;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Objects;

/**
 * Raw result of one provider fetch.
 *
 * @param sourceId        the provider that was fetched
 * @param fetchedAt       ISO-8601 fetch timestamp
 * @param versionOrCommit provider data version or commit sha, {@code "unknown"} when not published
 * @param itemsRaw        raw item payloads, one per item, uninterpreted
 */
public record FetchResult(Provider sourceId, String fetchedAt, String versionOrCommit, List<JsonNode> itemsRaw) {

    public static final String UNKNOWN_VERSION = "unknown";

    public FetchResult {
        Objects.requireNonNull(sourceId, "sourceId is required");
        Objects.requireNonNull(fetchedAt, "fetchedAt is required");
        versionOrCommit = versionOrCommit != null ? versionOrCommit : UNKNOWN_VERSION;
        itemsRaw = itemsRaw != null ? List.copyOf(itemsRaw) : List.of();
    }
}
