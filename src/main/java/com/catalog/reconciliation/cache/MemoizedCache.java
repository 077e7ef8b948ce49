package com.catalog.reconciliation.cache;

import com.catalog.reconciliation.metrics.MetricsService;
import com.catalog.reconciliation.metrics.NoOpMetricsService;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import com.github.benmanes.caffeine.cache.Ticker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Single-flight TTL cache for asynchronous producers, backed by a Caffeine {@link AsyncCache}.
 *
 * <p>For a given key:</p>
 * <ul>
 *   <li>a live value is returned without invoking the producer;</li>
 *   <li>while a producer is in flight, every caller joins the same future;</li>
 *   <li>otherwise the producer is started and its future published atomically, so at most
 *       one producer runs per key at a time;</li>
 *   <li>on success the value lives for the ttl passed with the call that produced it;</li>
 *   <li>on failure the key is removed before any caller observes the failure, and the
 *       failure propagates to every caller.</li>
 * </ul>
 *
 * <p>Usage:</p>
 * <pre>
 * MemoizedCache cache = new MemoizedCache(CacheConfig.defaults());
 * CompletableFuture&lt;DiffDataResponse&gt; data =
 *     cache.getOrSet("diff-data", Duration.ofMinutes(10), () -&gt; orchestrator.buildDiffData(providers));
 * </pre>
 */
public class MemoizedCache {
    private static final Logger log = LoggerFactory.getLogger(MemoizedCache.class);

    private final AsyncCache<String, Timed> cache;
    private final CacheConfig config;
    private final MetricsService metricsService;

    public MemoizedCache(CacheConfig config) {
        this(config, Ticker.systemTicker(), new NoOpMetricsService());
    }

    public MemoizedCache(CacheConfig config, MetricsService metricsService) {
        this(config, Ticker.systemTicker(), metricsService);
    }

    /**
     * Creates a cache reading time from {@code ticker}; tests pass a manual ticker.
     */
    public MemoizedCache(CacheConfig config, Ticker ticker, MetricsService metricsService) {
        this.config = config;
        this.metricsService = metricsService;
        this.cache = Caffeine.newBuilder()
                .maximumSize(config.maxSize())
                .expireAfter(new PerEntryExpiry())
                .ticker(ticker)
                .executor(Runnable::run)
                .recordStats()
                .buildAsync();
        log.info("MemoizedCache initialized: maxSize={}, defaultTtl={}, enabled={}",
                config.maxSize(), config.defaultTtl(), config.enabled());
    }

    /**
     * Same as {@link #getOrSet(String, Duration, Supplier)} with the configured default ttl.
     */
    public <T> CompletableFuture<T> getOrSet(String key, Supplier<CompletableFuture<T>> producer) {
        return getOrSet(key, config.defaultTtl(), producer);
    }

    /**
     * Returns the live value for {@code key}, joins the in-flight producer for it, or starts
     * {@code producer} and memoizes its result for {@code ttl}.
     *
     * @param key      cache key
     * @param ttl      lifetime of the value once produced
     * @param producer asynchronous producer, invoked at most once per key at a time
     * @return a future completing with the value, or exceptionally with the producer's failure
     */
    @SuppressWarnings("unchecked")
    public <T> CompletableFuture<T> getOrSet(String key, Duration ttl, Supplier<CompletableFuture<T>> producer) {
        if (!config.enabled()) {
            return invoke(producer);
        }
        if (ttl.isNegative() || ttl.isZero()) {
            throw new IllegalArgumentException("ttl must be > 0");
        }

        long ttlNanos = ttl.toNanos();
        AtomicBoolean started = new AtomicBoolean(false);
        CompletableFuture<Timed> shared = cache.get(key, (k, executor) -> {
            started.set(true);
            return invoke(producer).thenApply(value -> new Timed(value, ttlNanos));
        });

        if (started.get()) {
            metricsService.recordCacheMiss();
            log.debug("cache.miss key={} ttl={}", key, ttl);
        } else {
            metricsService.recordCacheHit();
        }

        return shared
                .whenComplete((timed, error) -> {
                    if (error != null && cache.asMap().remove(key, shared)) {
                        log.warn("cache.evicted key={} error={}", key, error.getMessage());
                    }
                })
                .thenApply(timed -> (T) timed.value());
    }

    /**
     * Removes the entry for {@code key}, whether live or in flight.
     */
    public void invalidate(String key) {
        cache.synchronous().invalidate(key);
        log.debug("Invalidated cache entry {}", key);
    }

    /**
     * Removes all entries.
     */
    public void invalidateAll() {
        cache.synchronous().invalidateAll();
        log.debug("Invalidated all cache entries");
    }

    /**
     * Returns whether a completed, non-expired value is cached for {@code key}. Never blocks.
     */
    public boolean containsKey(String key) {
        CompletableFuture<Timed> future = cache.getIfPresent(key);
        return future != null && future.isDone() && !future.isCompletedExceptionally();
    }

    /**
     * Returns cache statistics.
     */
    public CacheStats getStats() {
        com.github.benmanes.caffeine.cache.stats.CacheStats caffeineStats = cache.synchronous().stats();
        return new CacheStats(
                caffeineStats.hitCount(),
                caffeineStats.missCount(),
                caffeineStats.evictionCount(),
                cache.synchronous().estimatedSize()
        );
    }

    private static <T> CompletableFuture<T> invoke(Supplier<CompletableFuture<T>> producer) {
        try {
            CompletableFuture<T> future = producer.get();
            if (future == null) {
                return CompletableFuture.failedFuture(new NullPointerException("producer returned null future"));
            }
            return future;
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /**
     * Produced value with the ttl requested by the call that produced it.
     */
    record Timed(Object value, long ttlNanos) {}

    private static final class PerEntryExpiry implements Expiry<String, Timed> {

        @Override
        public long expireAfterCreate(String key, Timed value, long currentTime) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterUpdate(String key, Timed value, long currentTime, long currentDuration) {
            return value.ttlNanos();
        }

        @Override
        public long expireAfterRead(String key, Timed value, long currentTime, long currentDuration) {
            return currentDuration;
        }
    }
}
