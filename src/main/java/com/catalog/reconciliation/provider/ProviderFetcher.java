package com.catalog.reconciliation.provider;

import com.catalog.reconciliation.core.model.Provider;

/**
 * Fetches the raw item list of one provider.
 *
 * <p>Implementations perform blocking I/O and are called from the pipeline's executor.
 * They return the payloads uninterpreted; normalization happens downstream.</p>
 */
public interface ProviderFetcher {

    /**
     * The provider this fetcher reads.
     */
    Provider provider();

    /**
     * Fetches every item the provider publishes.
     *
     * @return raw items with fetch time and data version
     * @throws ProviderFetchException if the provider cannot be read
     */
    FetchResult fetchRaw();
}
