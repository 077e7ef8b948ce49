package com.catalog.reconciliation.provider;

import com.catalog.reconciliation.core.model.Provider;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Base class for HTTP-backed fetchers. Stamps the fetch time, logs the outcome and
 * attributes every failure to the fetcher's provider.
 */
public abstract class AbstractProviderFetcher implements ProviderFetcher {
    private static final Logger log = LoggerFactory.getLogger(AbstractProviderFetcher.class);

    protected final JsonHttpClient http;
    private final Provider provider;
    private final Clock clock;

    protected AbstractProviderFetcher(Provider provider, JsonHttpClient http, Clock clock) {
        this.provider = Objects.requireNonNull(provider, "provider is required");
        this.http = Objects.requireNonNull(http, "http client is required");
        this.clock = Objects.requireNonNull(clock, "clock is required");
    }

    @Override
    public final Provider provider() {
        return provider;
    }

    @Override
    public final FetchResult fetchRaw() {
        long start = System.nanoTime();
        try {
            FetchResult result = fetch(Instant.now(clock).toString());
            log.info("fetch.completed provider={} items={} version={} durationMs={}",
                    provider, result.itemsRaw().size(), result.versionOrCommit(),
                    (System.nanoTime() - start) / 1_000_000);
            return result;
        } catch (ProviderFetchException e) {
            if (e.getProvider() == provider) {
                throw e;
            }
            throw new ProviderFetchException(provider, e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new ProviderFetchException(provider, provider + " fetch failed: " + e.getMessage(), e);
        }
    }

    /**
     * Performs the provider-specific requests.
     *
     * @param fetchedAt ISO-8601 timestamp to stamp on the result
     */
    protected abstract FetchResult fetch(String fetchedAt);

    /**
     * Returns the elements of {@code node} if it is an array, else an empty list.
     */
    protected static List<JsonNode> elements(JsonNode node) {
        List<JsonNode> out = new ArrayList<>();
        if (node != null && node.isArray()) {
            node.forEach(out::add);
        }
        return out;
    }

    /**
     * Returns the lexicographically greatest non-empty string value of {@code field} across
     * {@code items}, or {@link FetchResult#UNKNOWN_VERSION}. ISO timestamps sort chronologically.
     */
    protected static String latestTimestamp(List<JsonNode> items, String field) {
        String latest = null;
        for (JsonNode item : items) {
            JsonNode value = item.get(field);
            if (value == null || !value.isTextual() || value.asText().isEmpty()) {
                continue;
            }
            if (latest == null || value.asText().compareTo(latest) > 0) {
                latest = value.asText();
            }
        }
        return latest != null ? latest : FetchResult.UNKNOWN_VERSION;
    }
}
