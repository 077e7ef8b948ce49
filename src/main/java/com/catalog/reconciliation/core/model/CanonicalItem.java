package com.catalog.reconciliation.core.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * A resolved real-world item aggregating at most one {@link SourceItem} per provider.
 */
public record CanonicalItem(
        String canonicalId,
        String nameKey,
        String displayName,
        Map<Provider, SourceItem> bySource,
        Map<Provider, MatchDetail> matchDetails,
        DiffReport diffReport
) {
    public CanonicalItem {
        Objects.requireNonNull(canonicalId, "canonicalId is required");
        Objects.requireNonNull(nameKey, "nameKey is required");
        bySource = unmodifiableCopy(bySource);
        matchDetails = unmodifiableCopy(matchDetails);
        diffReport = diffReport != null ? diffReport : DiffReport.empty();
        for (Map.Entry<Provider, SourceItem> entry : bySource.entrySet()) {
            if (entry.getValue().sourceId() != entry.getKey()) {
                throw new IllegalArgumentException("Source item of " + entry.getValue().sourceId()
                        + " filed under provider " + entry.getKey());
            }
        }
    }

    /**
     * Returns the entry of the given provider, or null if the provider has none.
     */
    public SourceItem source(Provider provider) {
        return bySource.get(provider);
    }

    public boolean hasSource(Provider provider) {
        return bySource.containsKey(provider);
    }

    public CanonicalItem withDiffReport(DiffReport report) {
        return new CanonicalItem(canonicalId, nameKey, displayName, bySource, matchDetails, report);
    }

    private static <V> Map<Provider, V> unmodifiableCopy(Map<Provider, V> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new EnumMap<>(source));
    }
}
