package com.catalog.reconciliation.provider;

import com.catalog.reconciliation.core.model.Provider;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * MetaForge: page-numbered listing ({@code page}, {@code limit}, optional
 * {@code includeComponents=true}). Paging stops after {@code pagination.totalPages}
 * or as soon as {@code pagination.hasNextPage} is false. The version is the latest
 * {@code updated_at} across items.
 */
public class MetaForgeFetcher extends AbstractProviderFetcher {
    private static final Logger log = LoggerFactory.getLogger(MetaForgeFetcher.class);

    private final String itemsUrl;
    private final int pageSize;
    private final boolean includeComponents;

    public MetaForgeFetcher(JsonHttpClient http, String itemsUrl, int pageSize, boolean includeComponents) {
        this(http, itemsUrl, pageSize, includeComponents, Clock.systemUTC());
    }

    public MetaForgeFetcher(JsonHttpClient http, String itemsUrl, int pageSize, boolean includeComponents,
                            Clock clock) {
        super(Provider.METAFORGE, http, clock);
        this.itemsUrl = itemsUrl;
        this.pageSize = pageSize;
        this.includeComponents = includeComponents;
    }

    @Override
    protected FetchResult fetch(String fetchedAt) {
        List<JsonNode> items = new ArrayList<>();
        int page = 1;
        int totalPages = 1;

        while (page <= totalPages) {
            JsonNode body = http.getJson(pageUrl(page));
            items.addAll(elements(body.get("data")));

            JsonNode pagination = body.path("pagination");
            JsonNode total = pagination.get("totalPages");
            totalPages = total != null && total.isNumber() ? total.asInt() : page;
            log.debug("metaforge.page page={} totalPages={} items={}", page, totalPages, items.size());

            JsonNode hasNext = pagination.get("hasNextPage");
            if (hasNext != null && hasNext.isBoolean() && !hasNext.asBoolean()) {
                break;
            }
            page++;
        }

        return new FetchResult(Provider.METAFORGE, fetchedAt, latestTimestamp(items, "updated_at"), items);
    }

    private String pageUrl(int page) {
        StringBuilder url = new StringBuilder(itemsUrl)
                .append("?limit=").append(pageSize)
                .append("&page=").append(page);
        if (includeComponents) {
            url.append("&includeComponents=true");
        }
        return url.toString();
    }
}
