package com.catalog.reconciliation.provider;

import com.catalog.reconciliation.config.ReconciliationConfig;
import com.catalog.reconciliation.core.model.Provider;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Lookup of fetchers by provider.
 */
public class ProviderRegistry {

    private final Map<Provider, ProviderFetcher> fetchers = new EnumMap<>(Provider.class);

    public ProviderRegistry(Collection<? extends ProviderFetcher> fetchers) {
        for (ProviderFetcher fetcher : fetchers) {
            this.fetchers.put(fetcher.provider(), fetcher);
        }
    }

    /**
     * Creates a registry with the HTTP fetcher of every known provider.
     */
    public static ProviderRegistry fromConfig(ReconciliationConfig config) {
        JsonHttpClient http = new JsonHttpClient(config.getRequestTimeout());
        return new ProviderRegistry(List.of(
                new ArdbFetcher(http, config.getArdbItemsUrl()),
                new MetaForgeFetcher(http, config.getMetaforgeItemsUrl(), config.getMetaforgePageSize(),
                        config.isMetaforgeIncludeComponents()),
                new RaidTheoryFetcher(http, config.getRaidTheoryOwner(), config.getRaidTheoryRepo(),
                        config.getRaidTheoryBranch(), config.getRaidTheoryItemsPath(),
                        config.getRaidTheoryConcurrency(), config.getRaidTheoryMaxItems()),
                new MahcksFetcher(http, config.getMahcksBaseUrl(), config.getMahcksPageSize())
        ));
    }

    public Optional<ProviderFetcher> find(Provider provider) {
        return Optional.ofNullable(fetchers.get(provider));
    }

    /**
     * Returns the fetcher for {@code provider}.
     *
     * @throws IllegalArgumentException if none is registered
     */
    public ProviderFetcher get(Provider provider) {
        return find(provider).orElseThrow(
                () -> new IllegalArgumentException("No fetcher registered for provider " + provider));
    }
}
