package com.catalog.reconciliation.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;
import java.util.Optional;

/**
 * External item data providers. Each provider publishes the same catalog under its own
 * schema, identifiers and update cadence; the provider id is the tag that selects the
 * field mapping applied to its raw payloads.
 */
public enum Provider {
    @JsonProperty("ardb")
    ARDB("ardb"),
    @JsonProperty("metaforge")
    METAFORGE("metaforge"),
    @JsonProperty("raidtheory")
    RAIDTHEORY("raidtheory"),
    @JsonProperty("mahcks")
    MAHCKS("mahcks");

    private final String id;

    Provider(String id) {
        this.id = id;
    }

    /**
     * Wire identifier. JSON values and map keys carry the same string through the
     * constants' {@link JsonProperty} names.
     */
    public String id() {
        return id;
    }

    /**
     * Looks up a provider by its id, ignoring case and surrounding whitespace.
     */
    public static Optional<Provider> fromId(String id) {
        if (id == null) {
            return Optional.empty();
        }
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (Provider provider : values()) {
            if (provider.id.equals(normalized)) {
                return Optional.of(provider);
            }
        }
        return Optional.empty();
    }

    @Override
    public String toString() {
        return id;
    }
}
