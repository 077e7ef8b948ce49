package com.catalog.reconciliation.pipeline;

import com.catalog.reconciliation.cache.CacheConfig;
import com.catalog.reconciliation.cache.MemoizedCache;
import com.catalog.reconciliation.config.ReconciliationConfig;
import com.catalog.reconciliation.core.model.DiffDataResponse;
import com.catalog.reconciliation.core.model.Provider;
import com.catalog.reconciliation.metrics.MetricsService;
import com.catalog.reconciliation.metrics.NoOpMetricsService;
import com.catalog.reconciliation.normalize.ItemNormalizer;
import com.catalog.reconciliation.provider.ProviderRegistry;
import com.catalog.reconciliation.resolve.EntityResolver;
import com.catalog.reconciliation.snapshot.SnapshotStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Entry point for serving reconciliation data.
 *
 * <p>Both the live multi-provider diff and the single-provider snapshot view are memoized
 * for the configured cache ttl. Concurrent callers share one in-flight computation; a failed
 * computation is not cached.</p>
 *
 * <pre>
 * try (DiffDataService service = DiffDataService.builder()
 *         .config(ReconciliationConfig.defaults())
 *         .registry(ProviderRegistry.fromConfig(config))
 *         .build()) {
 *     DiffDataResponse data = service.diffData().join();
 * }
 * </pre>
 */
public class DiffDataService implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(DiffDataService.class);

    static final String DIFF_DATA_KEY = "diff-data";
    static final String SNAPSHOT_DATA_KEY_PREFIX = "snapshot-data:";

    private final ReconciliationConfig config;
    private final PipelineOrchestrator orchestrator;
    private final SnapshotStore snapshotStore;
    private final MemoizedCache cache;
    private final ExecutorService executor;
    private final boolean ownsExecutor;

    private DiffDataService(Builder builder) {
        this.config = builder.config;
        MetricsService metricsService = builder.metricsService != null
                ? builder.metricsService : new NoOpMetricsService();

        if (builder.executor != null) {
            this.executor = builder.executor;
            this.ownsExecutor = false;
        } else {
            this.executor = newFetchExecutor(config.getFetchParallelism());
            this.ownsExecutor = true;
        }

        this.cache = builder.cache != null
                ? builder.cache
                : new MemoizedCache(new CacheConfig(config.getCacheMaxSize(), config.getCacheTtl(),
                        config.isCacheEnabled()), metricsService);

        this.orchestrator = new PipelineOrchestrator(
                builder.registry,
                new ItemNormalizer(),
                builder.resolver != null ? builder.resolver : new EntityResolver(),
                config.getFuzzyMatchThreshold(),
                executor,
                metricsService,
                builder.clock);
        this.snapshotStore = builder.snapshotStore;

        log.info("DiffDataService initialized: sources={}, cacheTtl={}, snapshot={}",
                config.getEnabledSources(), config.getCacheTtl(),
                snapshotStore != null ? snapshotStore.provider() : "none");
    }

    /**
     * Returns the live reconciliation of the configured providers, memoized under one key.
     */
    public CompletableFuture<DiffDataResponse> diffData() {
        List<Provider> providers = config.getEnabledSources();
        return cache.getOrSet(DIFF_DATA_KEY, config.getCacheTtl(), () -> orchestrator.buildDiffData(providers));
    }

    /**
     * Returns the reconciliation of the snapshot provider, read from the persisted snapshot.
     *
     * @throws IllegalStateException if no snapshot store is configured
     */
    public CompletableFuture<DiffDataResponse> snapshotData() {
        if (snapshotStore == null) {
            throw new IllegalStateException("No snapshot store configured");
        }
        String key = SNAPSHOT_DATA_KEY_PREFIX + snapshotStore.provider().id();
        return cache.getOrSet(key, config.getCacheTtl(),
                () -> CompletableFuture.supplyAsync(snapshotStore::buildFromStore, executor));
    }

    /**
     * Drops every memoized response; the next call recomputes.
     */
    public void invalidate() {
        cache.invalidateAll();
        log.info("DiffDataService cache invalidated");
    }

    public MemoizedCache getCache() {
        return cache;
    }

    @Override
    public void close() {
        if (!ownsExecutor) {
            return;
        }
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("DiffDataService closed");
    }

    private static ExecutorService newFetchExecutor(int threads) {
        AtomicInteger sequence = new AtomicInteger();
        return Executors.newFixedThreadPool(threads, runnable -> {
            Thread thread = new Thread(runnable, "reconciliation-fetch-" + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private ReconciliationConfig config = ReconciliationConfig.defaults();
        private ProviderRegistry registry;
        private SnapshotStore snapshotStore;
        private MemoizedCache cache;
        private EntityResolver resolver;
        private ExecutorService executor;
        private MetricsService metricsService;
        private Clock clock = Clock.systemUTC();

        public Builder config(ReconciliationConfig config) {
            this.config = config;
            return this;
        }

        public Builder registry(ProviderRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder snapshotStore(SnapshotStore snapshotStore) {
            this.snapshotStore = snapshotStore;
            return this;
        }

        public Builder cache(MemoizedCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder resolver(EntityResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        /**
         * Executor for provider fetches and snapshot reads. The caller keeps ownership.
         */
        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public DiffDataService build() {
            Objects.requireNonNull(config, "config is required");
            Objects.requireNonNull(clock, "clock is required");
            if (registry == null) {
                registry = ProviderRegistry.fromConfig(config);
            }
            return new DiffDataService(this);
        }
    }
}
