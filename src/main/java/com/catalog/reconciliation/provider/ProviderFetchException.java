package com.catalog.reconciliation.provider;

import com.catalog.reconciliation.core.model.Provider;

/**
 * Thrown when a provider's data cannot be fetched. Within a pipeline run this marks
 * the provider as failed; the run itself continues with the remaining providers.
 */
public class ProviderFetchException extends RuntimeException {

    private final Provider provider;

    public ProviderFetchException(Provider provider, String message) {
        super(message);
        this.provider = provider;
    }

    public ProviderFetchException(Provider provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    /**
     * The provider whose fetch failed, or null when the failure is not tied to one.
     */
    public Provider getProvider() {
        return provider;
    }
}
