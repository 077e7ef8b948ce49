package com.catalog.reconciliation.core.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * How a provider's item was attached to a canonical item.
 */
public enum MatchMethod {
    /**
     * Identical name key.
     */
    EXACT,

    /**
     * Bigram similarity at or above the fuzzy threshold.
     */
    FUZZY,

    NONE;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
