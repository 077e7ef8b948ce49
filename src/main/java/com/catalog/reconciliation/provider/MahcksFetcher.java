package com.catalog.reconciliation.provider;

import com.catalog.reconciliation.core.model.Provider;
import com.fasterxml.jackson.databind.JsonNode;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Mahcks: the API root {@code /v1} publishes the data version; items come from
 * {@code /v1/items?full=true} with offset paging until {@code next} is empty or a page
 * has no items.
 */
public class MahcksFetcher extends AbstractProviderFetcher {

    private final String baseUrl;
    private final int pageSize;

    public MahcksFetcher(JsonHttpClient http, String baseUrl, int pageSize) {
        this(http, baseUrl, pageSize, Clock.systemUTC());
    }

    public MahcksFetcher(JsonHttpClient http, String baseUrl, int pageSize, Clock clock) {
        super(Provider.MAHCKS, http, clock);
        this.baseUrl = baseUrl;
        this.pageSize = pageSize;
    }

    @Override
    protected FetchResult fetch(String fetchedAt) {
        JsonNode info = http.getJson(baseUrl + "/v1");
        String apiVersion = info.path("version").asText("");
        String version = apiVersion.isEmpty() ? FetchResult.UNKNOWN_VERSION : "api-" + apiVersion;

        List<JsonNode> items = new ArrayList<>();
        int offset = 0;
        while (true) {
            JsonNode page = http.getJson(baseUrl + "/v1/items?full=true&limit=" + pageSize + "&offset=" + offset);
            List<JsonNode> pageItems = elements(page.get("items"));
            items.addAll(pageItems);

            String next = page.path("next").asText("");
            if (next.isEmpty() || pageItems.isEmpty()) {
                break;
            }
            offset += pageSize;
        }

        return new FetchResult(Provider.MAHCKS, fetchedAt, version, items);
    }
}
