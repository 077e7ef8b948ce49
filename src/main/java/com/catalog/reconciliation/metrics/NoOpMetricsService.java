package com.catalog.reconciliation.metrics;

import com.catalog.reconciliation.core.model.Provider;

import java.time.Duration;

/**
 * No-op metrics implementation. All methods are empty.
 */
public class NoOpMetricsService implements MetricsService {

    @Override
    public void recordPipelineDuration(Duration duration) {
    }

    @Override
    public void recordProviderFetch(Provider provider, boolean success) {
    }

    @Override
    public void recordCanonicalItems(int count) {
    }

    @Override
    public void recordSnapshotResync(Provider provider, boolean success) {
    }

    @Override
    public void recordCacheHit() {
    }

    @Override
    public void recordCacheMiss() {
    }
}
