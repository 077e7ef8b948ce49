package com.catalog.reconciliation.core.model;

import java.util.List;

/**
 * Output of a reconciliation run, consumed by the presentation layer.
 * Field names and nesting are part of the wire contract.
 *
 * @param generatedAt      ISO-8601 generation timestamp
 * @param enabledSources   providers that actually contributed data
 * @param sourceSummaries  one summary per requested provider, including failed ones
 * @param canonicalItems   resolved items sorted by severity
 */
public record DiffDataResponse(
        String generatedAt,
        List<Provider> enabledSources,
        List<SourceSummary> sourceSummaries,
        List<CanonicalItem> canonicalItems
) {
    public DiffDataResponse {
        enabledSources = enabledSources != null ? List.copyOf(enabledSources) : List.of();
        sourceSummaries = sourceSummaries != null ? List.copyOf(sourceSummaries) : List.of();
        canonicalItems = canonicalItems != null ? List.copyOf(canonicalItems) : List.of();
    }
}
