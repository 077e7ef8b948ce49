package com.catalog.reconciliation.cache;

import com.catalog.reconciliation.metrics.MetricsService;
import com.catalog.reconciliation.metrics.NoOpMetricsService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class MemoizedCacheTest {

    private static final Duration TTL = Duration.ofMinutes(1);

    @Nested
    @DisplayName("Single flight")
    class SingleFlightTests {

        @Test
        @DisplayName("Callers arriving while the producer runs share one invocation")
        void testSharedInFlight() {
            MemoizedCache cache = new MemoizedCache(CacheConfig.defaults());
            CompletableFuture<String> pending = new CompletableFuture<>();
            AtomicInteger invocations = new AtomicInteger();

            List<CompletableFuture<String>> callers = new ArrayList<>();
            for (int i = 0; i < 5; i++) {
                callers.add(cache.getOrSet("diff-data", TTL, () -> {
                    invocations.incrementAndGet();
                    return pending;
                }));
            }

            assertEquals(1, invocations.get());
            assertTrue(callers.stream().noneMatch(CompletableFuture::isDone));

            pending.complete("value");

            for (CompletableFuture<String> caller : callers) {
                assertEquals("value", caller.join());
            }
        }

        @Test
        @DisplayName("Concurrent threads invoke the producer once")
        void testConcurrentThreads() throws Exception {
            MemoizedCache cache = new MemoizedCache(CacheConfig.defaults());
            AtomicInteger invocations = new AtomicInteger();
            CompletableFuture<Integer> pending = new CompletableFuture<>();
            int threads = 16;
            CountDownLatch start = new CountDownLatch(1);
            ExecutorService executor = Executors.newFixedThreadPool(threads);
            try {
                List<java.util.concurrent.Future<CompletableFuture<Integer>>> submitted = new ArrayList<>();
                for (int i = 0; i < threads; i++) {
                    submitted.add(executor.submit(() -> {
                        start.await();
                        return cache.getOrSet("k", TTL, () -> {
                            invocations.incrementAndGet();
                            return pending;
                        });
                    }));
                }
                start.countDown();

                List<CompletableFuture<Integer>> results = new ArrayList<>();
                for (java.util.concurrent.Future<CompletableFuture<Integer>> future : submitted) {
                    results.add(future.get(5, TimeUnit.SECONDS));
                }
                pending.complete(42);

                assertEquals(1, invocations.get());
                for (CompletableFuture<Integer> result : results) {
                    assertEquals(42, result.join());
                }
            } finally {
                executor.shutdownNow();
            }
        }
    }

    @Nested
    @DisplayName("Failures")
    class FailureTests {

        @Test
        @DisplayName("A failed producer is evicted so the next call retries")
        void testFailureNotCached() {
            MemoizedCache cache = new MemoizedCache(CacheConfig.defaults());
            AtomicInteger invocations = new AtomicInteger();
            IllegalStateException boom = new IllegalStateException("boom");

            CompletableFuture<String> first = cache.getOrSet("k", TTL, () -> {
                invocations.incrementAndGet();
                return CompletableFuture.failedFuture(boom);
            });
            CompletionException thrown = assertThrows(CompletionException.class, first::join);
            assertSame(boom, thrown.getCause());
            assertFalse(cache.containsKey("k"));

            CompletableFuture<String> second = cache.getOrSet("k", TTL, () -> {
                invocations.incrementAndGet();
                return CompletableFuture.completedFuture("ok");
            });
            assertEquals("ok", second.join());
            assertEquals(2, invocations.get());
        }

        @Test
        @DisplayName("Every waiting caller sees the failure")
        void testFailurePropagatesToAllWaiters() {
            MemoizedCache cache = new MemoizedCache(CacheConfig.defaults());
            CompletableFuture<String> pending = new CompletableFuture<>();

            CompletableFuture<String> a = cache.getOrSet("k", TTL, () -> pending);
            CompletableFuture<String> b = cache.getOrSet("k", TTL, () -> pending);
            pending.completeExceptionally(new IllegalArgumentException("bad"));

            assertThrows(CompletionException.class, a::join);
            assertThrows(CompletionException.class, b::join);
            assertFalse(cache.containsKey("k"));
        }

        @Test
        @DisplayName("A producer that throws synchronously yields a failed future")
        void testSynchronousThrow() {
            MemoizedCache cache = new MemoizedCache(CacheConfig.defaults());

            CompletableFuture<String> result = cache.getOrSet("k", TTL, () -> {
                throw new IllegalStateException("sync");
            });

            CompletionException thrown = assertThrows(CompletionException.class, result::join);
            assertEquals("sync", thrown.getCause().getMessage());
        }
    }

    @Nested
    @DisplayName("Expiry")
    class ExpiryTests {

        @Test
        @DisplayName("Values live for the ttl of the call that produced them")
        void testTtl() {
            AtomicLong nanos = new AtomicLong();
            MemoizedCache cache = new MemoizedCache(CacheConfig.defaults(), nanos::get, new NoOpMetricsService());
            AtomicInteger invocations = new AtomicInteger();

            assertEquals(1, cache.getOrSet("k", TTL,
                    () -> CompletableFuture.completedFuture(invocations.incrementAndGet())).join());

            nanos.addAndGet(Duration.ofSeconds(30).toNanos());
            assertEquals(1, cache.getOrSet("k", TTL,
                    () -> CompletableFuture.completedFuture(invocations.incrementAndGet())).join());

            nanos.addAndGet(Duration.ofSeconds(31).toNanos());
            assertEquals(2, cache.getOrSet("k", TTL,
                    () -> CompletableFuture.completedFuture(invocations.incrementAndGet())).join());
        }

        @Test
        @DisplayName("Keys expire independently according to their own ttl")
        void testPerKeyTtl() {
            AtomicLong nanos = new AtomicLong();
            MemoizedCache cache = new MemoizedCache(CacheConfig.defaults(), nanos::get, new NoOpMetricsService());

            cache.getOrSet("short", Duration.ofSeconds(10), () -> CompletableFuture.completedFuture("s")).join();
            cache.getOrSet("long", Duration.ofMinutes(10), () -> CompletableFuture.completedFuture("l")).join();

            nanos.addAndGet(Duration.ofSeconds(11).toNanos());

            assertFalse(cache.containsKey("short"));
            assertTrue(cache.containsKey("long"));
        }

        @Test
        @DisplayName("Non-positive ttl is rejected")
        void testInvalidTtl() {
            MemoizedCache cache = new MemoizedCache(CacheConfig.defaults());

            assertThrows(IllegalArgumentException.class,
                    () -> cache.getOrSet("k", Duration.ZERO, () -> CompletableFuture.completedFuture("v")));
        }
    }

    @Nested
    @DisplayName("Management")
    class ManagementTests {

        @Test
        @DisplayName("Disabled cache invokes the producer on every call")
        void testDisabled() {
            MemoizedCache cache = new MemoizedCache(CacheConfig.disabled());
            AtomicInteger invocations = new AtomicInteger();

            cache.getOrSet("k", TTL, () -> CompletableFuture.completedFuture(invocations.incrementAndGet())).join();
            cache.getOrSet("k", TTL, () -> CompletableFuture.completedFuture(invocations.incrementAndGet())).join();

            assertEquals(2, invocations.get());
            assertFalse(cache.containsKey("k"));
        }

        @Test
        @DisplayName("Invalidate forces recomputation")
        void testInvalidate() {
            MemoizedCache cache = new MemoizedCache(CacheConfig.defaults());
            AtomicInteger invocations = new AtomicInteger();

            cache.getOrSet("k", TTL, () -> CompletableFuture.completedFuture(invocations.incrementAndGet())).join();
            cache.invalidate("k");
            cache.getOrSet("k", TTL, () -> CompletableFuture.completedFuture(invocations.incrementAndGet())).join();
            cache.invalidateAll();
            cache.getOrSet("k", TTL, () -> CompletableFuture.completedFuture(invocations.incrementAndGet())).join();

            assertEquals(3, invocations.get());
        }

        @Test
        @DisplayName("containsKey is false while the value is still being produced")
        void testContainsKeyInFlight() {
            MemoizedCache cache = new MemoizedCache(CacheConfig.defaults());
            CompletableFuture<String> pending = new CompletableFuture<>();

            cache.getOrSet("k", TTL, () -> pending);
            assertFalse(cache.containsKey("k"));

            pending.complete("v");
            assertTrue(cache.containsKey("k"));
        }

        @Test
        @DisplayName("Hits and misses are reported to metrics")
        void testMetrics() {
            MetricsService metrics = mock(MetricsService.class);
            MemoizedCache cache = new MemoizedCache(CacheConfig.defaults(), metrics);

            cache.getOrSet("k", TTL, () -> CompletableFuture.completedFuture("v")).join();
            cache.getOrSet("k", TTL, () -> CompletableFuture.completedFuture("v")).join();

            verify(metrics, times(1)).recordCacheMiss();
            verify(metrics, times(1)).recordCacheHit();
            assertEquals(1, cache.getStats().size());
        }

        @Test
        @DisplayName("Hit rate is zero before any lookup")
        void testHitRate() {
            assertEquals(0.0, CacheStats.empty().hitRate());
            assertEquals(0.75, new CacheStats(3, 1, 0, 1).hitRate());
        }
    }
}
