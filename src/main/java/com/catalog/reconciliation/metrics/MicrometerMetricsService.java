package com.catalog.reconciliation.metrics;

import com.catalog.reconciliation.core.model.Provider;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsService}.
 *
 * <p>Recorded metrics:</p>
 * <ul>
 *   <li>{@code reconciliation.pipeline.duration}: Timer</li>
 *   <li>{@code reconciliation.provider.fetch}: Counter (tags: provider, outcome)</li>
 *   <li>{@code reconciliation.canonical.items}: DistributionSummary</li>
 *   <li>{@code reconciliation.snapshot.resync}: Counter (tags: provider, outcome)</li>
 *   <li>{@code reconciliation.cache.hit}: Counter</li>
 *   <li>{@code reconciliation.cache.miss}: Counter</li>
 * </ul>
 */
public class MicrometerMetricsService implements MetricsService {

    private final MeterRegistry registry;
    private final Map<String, Counter> counterCache = new ConcurrentHashMap<>();
    private final Timer pipelineTimer;
    private final DistributionSummary canonicalItemsSummary;
    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;

    public MicrometerMetricsService(MeterRegistry registry) {
        this.registry = registry;
        this.pipelineTimer = Timer.builder("reconciliation.pipeline.duration")
                .description("Time to fetch, resolve and diff all enabled providers")
                .register(registry);
        this.canonicalItemsSummary = DistributionSummary.builder("reconciliation.canonical.items")
                .description("Number of canonical items produced per run")
                .register(registry);
        this.cacheHitCounter = Counter.builder("reconciliation.cache.hit")
                .description("Number of memoized cache hits")
                .register(registry);
        this.cacheMissCounter = Counter.builder("reconciliation.cache.miss")
                .description("Number of memoized cache misses")
                .register(registry);
    }

    @Override
    public void recordPipelineDuration(Duration duration) {
        pipelineTimer.record(duration);
    }

    @Override
    public void recordProviderFetch(Provider provider, boolean success) {
        outcomeCounter("reconciliation.provider.fetch", "Provider fetch attempts", provider, success).increment();
    }

    @Override
    public void recordCanonicalItems(int count) {
        canonicalItemsSummary.record(count);
    }

    @Override
    public void recordSnapshotResync(Provider provider, boolean success) {
        outcomeCounter("reconciliation.snapshot.resync", "Snapshot resync attempts", provider, success).increment();
    }

    @Override
    public void recordCacheHit() {
        cacheHitCounter.increment();
    }

    @Override
    public void recordCacheMiss() {
        cacheMissCounter.increment();
    }

    private Counter outcomeCounter(String name, String description, Provider provider, boolean success) {
        String outcome = success ? "success" : "failure";
        String key = name + ":" + provider.id() + ":" + outcome;
        return counterCache.computeIfAbsent(key, k ->
                Counter.builder(name)
                        .description(description)
                        .tag("provider", provider.id())
                        .tag("outcome", outcome)
                        .register(registry));
    }
}
