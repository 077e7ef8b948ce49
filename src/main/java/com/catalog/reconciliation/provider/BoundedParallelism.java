package com.catalog.reconciliation.provider;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;

/**
 * Maps values with a bounded number of concurrent mapper calls.
 */
public final class BoundedParallelism {

    private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

    private BoundedParallelism() {
    }

    /**
     * Applies {@code mapper} to every value with at most {@code concurrency} calls in flight.
     * Results are in input order. The first failure cancels the remaining work and is rethrown.
     *
     * @throws IllegalArgumentException if concurrency is not positive
     */
    public static <T, R> List<R> map(List<T> values, int concurrency, Function<? super T, ? extends R> mapper) {
        if (concurrency <= 0) {
            throw new IllegalArgumentException("concurrency must be > 0");
        }
        if (values.isEmpty()) {
            return List.of();
        }

        int workers = Math.min(concurrency, values.size());
        int poolId = POOL_SEQUENCE.incrementAndGet();
        AtomicInteger threadSequence = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(workers, runnable -> {
            Thread thread = new Thread(runnable, "bounded-map-" + poolId + "-" + threadSequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });

        try {
            List<Future<R>> futures = new ArrayList<>(values.size());
            for (T value : values) {
                futures.add(executor.submit(() -> mapper.apply(value)));
            }

            List<R> results = new ArrayList<>(values.size());
            for (Future<R> future : futures) {
                results.add(await(future));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private static <R> R await(Future<R> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new CancellationException("Interrupted while waiting for mapped values");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            if (cause instanceof Error error) {
                throw error;
            }
            throw new IllegalStateException(cause);
        }
    }
}
