package com.catalog.reconciliation.core.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Per-provider metadata of one pipeline run.
 *
 * @param sourceId        the provider
 * @param fetchedAt       ISO-8601 fetch timestamp
 * @param versionOrCommit provider data version, commit sha, or {@code "unavailable"} on failure
 * @param itemCount       number of normalized items
 * @param error           failure message, null when the fetch succeeded
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SourceSummary(
        Provider sourceId,
        String fetchedAt,
        String versionOrCommit,
        int itemCount,
        String error
) {
    public static final String UNAVAILABLE = "unavailable";

    public static SourceSummary success(Provider sourceId, String fetchedAt, String versionOrCommit, int itemCount) {
        return new SourceSummary(sourceId, fetchedAt, versionOrCommit, itemCount, null);
    }

    public static SourceSummary failure(Provider sourceId, String fetchedAt, String error) {
        return new SourceSummary(sourceId, fetchedAt, UNAVAILABLE, 0, error);
    }

    public boolean failed() {
        return error != null;
    }
}
