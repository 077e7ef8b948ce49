package com.catalog.reconciliation.core.model;

import java.util.Objects;

/**
 * Match provenance for one provider entry of a canonical item.
 *
 * @param method     how the entry was matched
 * @param confidence match confidence between 0.0 and 1.0
 */
public record MatchDetail(MatchMethod method, double confidence) {

    private static final MatchDetail EXACT = new MatchDetail(MatchMethod.EXACT, 1.0);

    public MatchDetail {
        Objects.requireNonNull(method, "method is required");
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0");
        }
    }

    public static MatchDetail exact() {
        return EXACT;
    }

    public static MatchDetail fuzzy(double confidence) {
        return new MatchDetail(MatchMethod.FUZZY, confidence);
    }
}
