package com.catalog.reconciliation.pipeline;

import com.catalog.reconciliation.core.model.CanonicalItem;
import com.catalog.reconciliation.core.model.DiffDataResponse;
import com.catalog.reconciliation.core.model.Provider;
import com.catalog.reconciliation.core.model.SourceItem;
import com.catalog.reconciliation.core.model.SourceSummary;
import com.catalog.reconciliation.logging.LogContext;
import com.catalog.reconciliation.metrics.MetricsService;
import com.catalog.reconciliation.metrics.NoOpMetricsService;
import com.catalog.reconciliation.normalize.ItemNormalizer;
import com.catalog.reconciliation.provider.FetchResult;
import com.catalog.reconciliation.provider.ProviderFetchException;
import com.catalog.reconciliation.provider.ProviderFetcher;
import com.catalog.reconciliation.provider.ProviderRegistry;
import com.catalog.reconciliation.resolve.EntityResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;

/**
 * Runs one reconciliation: fetches all requested providers concurrently, normalizes the
 * ones that succeeded, resolves them into canonical items and assembles the response.
 *
 * <p>A failing provider never fails the run. It is reported in its source summary with
 * version {@code "unavailable"}, zero items and the failure message, and is left out of
 * {@code enabledSources}.</p>
 */
public class PipelineOrchestrator {
    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    private final ProviderRegistry registry;
    private final ItemNormalizer normalizer;
    private final EntityResolver resolver;
    private final double fuzzyThreshold;
    private final Executor executor;
    private final MetricsService metricsService;
    private final Clock clock;

    public PipelineOrchestrator(ProviderRegistry registry, double fuzzyThreshold, Executor executor) {
        this(registry, new ItemNormalizer(), new EntityResolver(), fuzzyThreshold, executor,
                new NoOpMetricsService(), Clock.systemUTC());
    }

    public PipelineOrchestrator(ProviderRegistry registry, ItemNormalizer normalizer, EntityResolver resolver,
                                double fuzzyThreshold, Executor executor, MetricsService metricsService,
                                Clock clock) {
        this.registry = registry;
        this.normalizer = normalizer;
        this.resolver = resolver;
        this.fuzzyThreshold = fuzzyThreshold;
        this.executor = executor;
        this.metricsService = metricsService;
        this.clock = clock;
    }

    /**
     * Builds the reconciliation response for {@code providers}. Duplicate providers are
     * fetched once; summaries follow the order of first appearance.
     *
     * @return a future that completes once every fetch has settled; it does not complete
     *         exceptionally because of provider failures
     */
    public CompletableFuture<DiffDataResponse> buildDiffData(List<Provider> providers) {
        List<Provider> requested = new ArrayList<>(new LinkedHashSet<>(providers));
        String runId = LogContext.generateRunId();
        long start = System.nanoTime();

        try (LogContext ctx = LogContext.forPipeline(runId)) {
            log.info("pipeline.started providers={}", requested);
        }

        List<CompletableFuture<FetchOutcome>> fetches = new ArrayList<>(requested.size());
        for (Provider provider : requested) {
            fetches.add(CompletableFuture
                    .supplyAsync(() -> fetch(runId, provider), executor)
                    .handle((result, error) -> error == null
                            ? FetchOutcome.success(result)
                            : FetchOutcome.failure(provider, Instant.now(clock).toString(), error)));
        }

        return CompletableFuture.allOf(fetches.toArray(new CompletableFuture[0]))
                .thenApply(ignored -> {
                    try (LogContext ctx = LogContext.forPipeline(runId)) {
                        List<FetchOutcome> outcomes = fetches.stream().map(CompletableFuture::join).toList();
                        DiffDataResponse response = assemble(outcomes);
                        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
                        metricsService.recordPipelineDuration(elapsed);
                        metricsService.recordCanonicalItems(response.canonicalItems().size());
                        log.info("pipeline.completed sources={} failed={} canonicalItems={} durationMs={}",
                                response.enabledSources(), requested.size() - response.enabledSources().size(),
                                response.canonicalItems().size(), elapsed.toMillis());
                        return response;
                    }
                });
    }

    private FetchResult fetch(String runId, Provider provider) {
        try (LogContext ctx = LogContext.forFetch(runId, provider)) {
            ProviderFetcher fetcher = registry.find(provider).orElseThrow(
                    () -> new ProviderFetchException(provider, "No fetcher registered for provider " + provider));
            try {
                FetchResult result = fetcher.fetchRaw();
                metricsService.recordProviderFetch(provider, true);
                return result;
            } catch (RuntimeException e) {
                metricsService.recordProviderFetch(provider, false);
                log.warn("fetch.failed provider={} error={}", provider, e.getMessage());
                throw e;
            }
        }
    }

    private DiffDataResponse assemble(List<FetchOutcome> outcomes) {
        List<Provider> succeeded = new ArrayList<>();
        List<SourceSummary> summaries = new ArrayList<>(outcomes.size());
        Map<Provider, List<SourceItem>> normalized = new EnumMap<>(Provider.class);

        for (FetchOutcome outcome : outcomes) {
            if (outcome.summary() != null) {
                summaries.add(outcome.summary());
                continue;
            }
            FetchResult result = outcome.result();
            List<SourceItem> items = normalizer.normalizeAll(result);
            normalized.put(result.sourceId(), items);
            succeeded.add(result.sourceId());
            summaries.add(SourceSummary.success(
                    result.sourceId(), result.fetchedAt(), result.versionOrCommit(), items.size()));
        }

        List<CanonicalItem> canonicalItems = resolver.resolve(normalized, succeeded, fuzzyThreshold);
        return new DiffDataResponse(Instant.now(clock).toString(), succeeded, summaries, canonicalItems);
    }

    static String failureMessage(Throwable error) {
        Throwable cause = error;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException)
                && cause.getCause() != null) {
            cause = cause.getCause();
        }
        String message = cause.getMessage();
        return message != null && !message.isBlank() ? message : cause.getClass().getSimpleName();
    }

    /**
     * Settled fetch: either a result or a failure summary.
     */
    private record FetchOutcome(FetchResult result, SourceSummary summary) {

        static FetchOutcome success(FetchResult result) {
            return new FetchOutcome(result, null);
        }

        static FetchOutcome failure(Provider provider, String fetchedAt, Throwable error) {
            return new FetchOutcome(null, SourceSummary.failure(provider, fetchedAt, failureMessage(error)));
        }
    }
}
