package com.catalog.reconciliation.snapshot;

import com.catalog.reconciliation.core.model.CanonicalItem;
import com.catalog.reconciliation.core.model.DiffDataResponse;
import com.catalog.reconciliation.core.model.Provider;
import com.catalog.reconciliation.core.model.SourceItem;
import com.catalog.reconciliation.core.model.SourceSummary;
import com.catalog.reconciliation.lock.KeyedLock;
import com.catalog.reconciliation.lock.LocalKeyedLock;
import com.catalog.reconciliation.logging.LogContext;
import com.catalog.reconciliation.metrics.MetricsService;
import com.catalog.reconciliation.metrics.NoOpMetricsService;
import com.catalog.reconciliation.normalize.ItemNormalizer;
import com.catalog.reconciliation.provider.FetchResult;
import com.catalog.reconciliation.provider.ProviderFetcher;
import com.catalog.reconciliation.resolve.EntityResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Serves one provider's data from a persisted SQLite snapshot, refreshing it from the
 * provider when it is older than the sync interval.
 *
 * <p>Concurrent refreshes are serialized through a {@link KeyedLock}; a caller that waited
 * for the lock re-checks staleness and skips the fetch if another caller already refreshed.
 * A failed refresh propagates and leaves the previous snapshot untouched.</p>
 *
 * <pre>
 * SnapshotStore store = SnapshotStore.builder()
 *     .database(database)
 *     .fetcher(metaForgeFetcher)
 *     .syncInterval(Duration.ofHours(6))
 *     .build();
 * DiffDataResponse data = store.buildFromStore();
 * </pre>
 */
public class SnapshotStore {
    private static final Logger log = LoggerFactory.getLogger(SnapshotStore.class);

    private final SnapshotRepository repository;
    private final ProviderFetcher fetcher;
    private final ItemNormalizer normalizer;
    private final EntityResolver resolver;
    private final KeyedLock lock;
    private final Duration syncInterval;
    private final double fuzzyThreshold;
    private final Clock clock;
    private final MetricsService metricsService;

    private SnapshotStore(Builder builder) {
        this.repository = builder.repository != null
                ? builder.repository : new SnapshotRepository(builder.database);
        this.fetcher = builder.fetcher;
        this.normalizer = builder.normalizer != null ? builder.normalizer : new ItemNormalizer();
        this.resolver = builder.resolver != null ? builder.resolver : new EntityResolver();
        this.lock = builder.lock != null ? builder.lock : new LocalKeyedLock();
        this.syncInterval = builder.syncInterval;
        this.fuzzyThreshold = builder.fuzzyThreshold;
        this.clock = builder.clock;
        this.metricsService = builder.metricsService != null ? builder.metricsService : new NoOpMetricsService();
    }

    public Provider provider() {
        return fetcher.provider();
    }

    /**
     * Ensures the snapshot is fresh, then resolves its items as a single-provider set.
     *
     * @throws com.catalog.reconciliation.provider.ProviderFetchException if a needed refresh cannot fetch
     * @throws SnapshotSyncException if the snapshot cannot be written or read
     */
    public DiffDataResponse buildFromStore() {
        Provider provider = fetcher.provider();
        ensureFresh();

        StoredSnapshot snapshot = repository.readSnapshot();
        Optional<SyncState> state = snapshot.syncState();
        String now = Instant.now(clock).toString();

        FetchResult stored = new FetchResult(
                provider,
                state.map(SyncState::lastSyncedAt).orElse(now),
                state.map(SyncState::version).orElse(FetchResult.UNKNOWN_VERSION),
                snapshot.itemsRaw());
        List<SourceItem> normalized = normalizer.normalizeAll(stored);
        List<CanonicalItem> canonicalItems = resolver.resolve(
                Map.of(provider, normalized), List.of(provider), fuzzyThreshold);

        SourceSummary summary = SourceSummary.success(
                provider, stored.fetchedAt(), stored.versionOrCommit(), normalized.size());
        return new DiffDataResponse(now, List.of(provider), List.of(summary), canonicalItems);
    }

    /**
     * Returns true when no snapshot exists or it is at least one sync interval old.
     */
    public boolean isStale() {
        return isStale(repository.readSyncState());
    }

    /**
     * Refreshes the snapshot if it is stale. At most one refresh per provider runs at a time.
     */
    public void ensureFresh() {
        if (!isStale()) {
            return;
        }
        lock.withLock(lockKey(), () -> {
            if (isStale()) {
                resync();
            } else {
                log.debug("snapshot.resync-skipped provider={} reason=refreshed-concurrently", provider());
            }
            return null;
        });
    }

    /**
     * Fetches the provider and replaces the snapshot unconditionally.
     */
    public SyncState resync() {
        Provider provider = fetcher.provider();
        try (LogContext ctx = LogContext.forResync(provider)) {
            long start = System.nanoTime();
            try {
                FetchResult result = fetcher.fetchRaw();
                int written = repository.replaceAll(result);
                metricsService.recordSnapshotResync(provider, true);
                log.info("snapshot.resynced provider={} items={} version={} durationMs={}",
                        provider, written, result.versionOrCommit(), (System.nanoTime() - start) / 1_000_000);
                return repository.readSyncState().orElseThrow(
                        () -> new SnapshotSyncException("Sync state missing after resync of " + provider));
            } catch (RuntimeException e) {
                metricsService.recordSnapshotResync(provider, false);
                log.error("snapshot.resync-failed provider={} error={}", provider, e.getMessage());
                throw e;
            }
        }
    }

    public List<ItemLink> findLinks(String itemId) {
        return repository.findLinks(itemId);
    }

    public List<ItemLink> findLinksByRelation(LinkRelation relation) {
        return repository.findLinksByRelation(relation);
    }

    private boolean isStale(Optional<SyncState> state) {
        if (state.isEmpty()) {
            return true;
        }
        try {
            Instant lastSynced = Instant.parse(state.get().lastSyncedAt());
            return Duration.between(lastSynced, Instant.now(clock)).compareTo(syncInterval) >= 0;
        } catch (DateTimeParseException e) {
            log.warn("snapshot.invalid-sync-time provider={} value={}", provider(), state.get().lastSyncedAt());
            return true;
        }
    }

    private String lockKey() {
        return "snapshot-resync:" + fetcher.provider().id();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private SnapshotDatabase database;
        private SnapshotRepository repository;
        private ProviderFetcher fetcher;
        private ItemNormalizer normalizer;
        private EntityResolver resolver;
        private KeyedLock lock;
        private Duration syncInterval = Duration.ofHours(6);
        private double fuzzyThreshold = 0.93;
        private Clock clock = Clock.systemUTC();
        private MetricsService metricsService;

        public Builder database(SnapshotDatabase database) {
            this.database = database;
            return this;
        }

        /**
         * Overrides the repository; when set, {@link #database(SnapshotDatabase)} is not needed.
         */
        public Builder repository(SnapshotRepository repository) {
            this.repository = repository;
            return this;
        }

        public Builder fetcher(ProviderFetcher fetcher) {
            this.fetcher = fetcher;
            return this;
        }

        public Builder normalizer(ItemNormalizer normalizer) {
            this.normalizer = normalizer;
            return this;
        }

        public Builder resolver(EntityResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder lock(KeyedLock lock) {
            this.lock = lock;
            return this;
        }

        public Builder syncInterval(Duration syncInterval) {
            this.syncInterval = syncInterval;
            return this;
        }

        public Builder fuzzyThreshold(double fuzzyThreshold) {
            this.fuzzyThreshold = fuzzyThreshold;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder metricsService(MetricsService metricsService) {
            this.metricsService = metricsService;
            return this;
        }

        public SnapshotStore build() {
            Objects.requireNonNull(fetcher, "fetcher is required");
            Objects.requireNonNull(clock, "clock is required");
            Objects.requireNonNull(syncInterval, "syncInterval is required");
            if (repository == null && database == null) {
                throw new IllegalStateException("database or repository is required");
            }
            return new SnapshotStore(this);
        }
    }
}
