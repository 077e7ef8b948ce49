package com.catalog.reconciliation.metrics;

import com.catalog.reconciliation.core.model.Provider;

import java.time.Duration;

/**
 * Interface for recording reconciliation metrics.
 * Implementations can integrate with Micrometer, Prometheus, or other metrics systems.
 * The default {@link NoOpMetricsService} does nothing, so the pipeline works
 * without any metrics backend on the classpath.
 */
public interface MetricsService {

    void recordPipelineDuration(Duration duration);

    void recordProviderFetch(Provider provider, boolean success);

    void recordCanonicalItems(int count);

    void recordSnapshotResync(Provider provider, boolean success);

    void recordCacheHit();

    void recordCacheMiss();
}
