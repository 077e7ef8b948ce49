package com.catalog.reconciliation.provider;

import com.catalog.reconciliation.core.model.Provider;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.util.List;

/**
 * ARDB: a single GET returning either a bare array or {@code {"data": [...]}}.
 * The version is the latest {@code updatedAt} across items.
 */
public class ArdbFetcher extends AbstractProviderFetcher {

    private final String itemsUrl;

    public ArdbFetcher(JsonHttpClient http, String itemsUrl) {
        this(http, itemsUrl, Clock.systemUTC());
    }

    public ArdbFetcher(JsonHttpClient http, String itemsUrl, Clock clock) {
        super(Provider.ARDB, http, clock);
        this.itemsUrl = itemsUrl;
    }

    @Override
    protected FetchResult fetch(String fetchedAt) {
        JsonNode body = http.getJson(itemsUrl);
        List<JsonNode> items = body.isArray() ? elements(body) : elements(body.get("data"));
        return new FetchResult(Provider.ARDB, fetchedAt, latestTimestamp(items, "updatedAt"), items);
    }
}
