package com.catalog.reconciliation.cdi;

import com.catalog.reconciliation.config.EnabledSources;
import com.catalog.reconciliation.config.ReconciliationConfig;
import com.catalog.reconciliation.core.model.Provider;
import com.catalog.reconciliation.metrics.MetricsService;
import com.catalog.reconciliation.metrics.MicrometerMetricsService;
import com.catalog.reconciliation.metrics.NoOpMetricsService;
import com.catalog.reconciliation.pipeline.DiffDataService;
import com.catalog.reconciliation.provider.ProviderRegistry;
import com.catalog.reconciliation.snapshot.SnapshotDatabase;
import com.catalog.reconciliation.snapshot.SnapshotStore;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;

/**
 * CDI producer that wires the reconciliation service from MicroProfile Config properties.
 *
 * <p>Every property has a default, so the service starts with no configuration at all:</p>
 * <pre>
 * catalog-reconciliation:
 *   enabled-sources: ardb,metaforge,raidtheory
 *   cache:
 *     ttl-seconds: 600
 *   snapshot:
 *     db-path: data/metaforge.sqlite
 *     sync-interval-minutes: 360
 * </pre>
 *
 * <p>Inject the service directly:</p>
 * <pre>
 * &#64;Inject DiffDataService diffDataService;
 * </pre>
 */
@ApplicationScoped
public class ReconciliationProducer {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationProducer.class);

    // ── Sources ───────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.enabled-sources", defaultValue = "ardb,metaforge,raidtheory")
    String enabledSources;

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.request-timeout-seconds", defaultValue = "30")
    int requestTimeoutSeconds;

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.fuzzy-match-threshold", defaultValue = "0.93")
    double fuzzyMatchThreshold;

    // ── Cache ─────────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.cache.enabled", defaultValue = "true")
    boolean cacheEnabled;

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.cache.max-size", defaultValue = "1000")
    int cacheMaxSize;

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.cache.ttl-seconds", defaultValue = "600")
    long cacheTtlSeconds;

    // ── Snapshot ──────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.snapshot.provider", defaultValue = "metaforge")
    String snapshotProvider;

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.snapshot.db-path", defaultValue = "data/metaforge.sqlite")
    String snapshotDbPath;

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.snapshot.sync-interval-minutes", defaultValue = "360")
    long snapshotSyncIntervalMinutes;

    // ── Providers ─────────────────────────────────────────────

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.ardb.items-url", defaultValue = "https://ardb.app/api/items")
    String ardbItemsUrl;

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.metaforge.items-url",
            defaultValue = "https://metaforge.app/api/arc-raiders/items")
    String metaforgeItemsUrl;

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.metaforge.page-size", defaultValue = "100")
    int metaforgePageSize;

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.metaforge.include-components", defaultValue = "true")
    boolean metaforgeIncludeComponents;

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.raidtheory.owner", defaultValue = "RaidTheory")
    String raidTheoryOwner;

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.raidtheory.repo", defaultValue = "arcraiders-data")
    String raidTheoryRepo;

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.raidtheory.branch", defaultValue = "main")
    String raidTheoryBranch;

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.raidtheory.items-path", defaultValue = "items")
    String raidTheoryItemsPath;

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.raidtheory.concurrency", defaultValue = "20")
    int raidTheoryConcurrency;

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.raidtheory.max-items", defaultValue = "0")
    int raidTheoryMaxItems;

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.mahcks.base-url", defaultValue = "https://arcdata.mahcks.com")
    String mahcksBaseUrl;

    @Inject
    @ConfigProperty(name = "catalog-reconciliation.mahcks.page-size", defaultValue = "45")
    int mahcksPageSize;

    @Inject
    Instance<MeterRegistry> meterRegistry;

    // ══════════════════════════════════════════════════════════
    //  Producers
    // ══════════════════════════════════════════════════════════

    @Produces
    @ApplicationScoped
    public ReconciliationConfig reconciliationConfig() {
        ReconciliationConfig config = ReconciliationConfig.builder()
                .enabledSources(EnabledSources.parse(enabledSources))
                .requestTimeout(Duration.ofSeconds(requestTimeoutSeconds))
                .fuzzyMatchThreshold(fuzzyMatchThreshold)
                .cacheEnabled(cacheEnabled)
                .cacheMaxSize(cacheMaxSize)
                .cacheTtl(Duration.ofSeconds(cacheTtlSeconds))
                .snapshotProvider(Provider.fromId(snapshotProvider).orElse(Provider.METAFORGE))
                .snapshotDbPath(Path.of(snapshotDbPath))
                .snapshotSyncInterval(Duration.ofMinutes(snapshotSyncIntervalMinutes))
                .ardbItemsUrl(ardbItemsUrl)
                .metaforgeItemsUrl(metaforgeItemsUrl)
                .metaforgePageSize(metaforgePageSize)
                .metaforgeIncludeComponents(metaforgeIncludeComponents)
                .raidTheoryOwner(raidTheoryOwner)
                .raidTheoryRepo(raidTheoryRepo)
                .raidTheoryBranch(raidTheoryBranch)
                .raidTheoryItemsPath(raidTheoryItemsPath)
                .raidTheoryConcurrency(raidTheoryConcurrency)
                .raidTheoryMaxItems(raidTheoryMaxItems)
                .mahcksBaseUrl(mahcksBaseUrl)
                .mahcksPageSize(mahcksPageSize)
                .build();
        log.info("Reconciliation config: sources={} cacheTtl={} snapshot={}@{}",
                config.getEnabledSources(), config.getCacheTtl(),
                config.getSnapshotProvider(), config.getSnapshotDbPath());
        return config;
    }

    @Produces
    @ApplicationScoped
    public MetricsService metricsService() {
        if (meterRegistry != null && meterRegistry.isResolvable()) {
            log.info("Micrometer metrics enabled");
            return new MicrometerMetricsService(meterRegistry.get());
        }
        return new NoOpMetricsService();
    }

    @Produces
    @ApplicationScoped
    public ProviderRegistry providerRegistry(ReconciliationConfig config) {
        return ProviderRegistry.fromConfig(config);
    }

    @Produces
    @ApplicationScoped
    public SnapshotDatabase snapshotDatabase(ReconciliationConfig config) {
        SnapshotDatabase database = new SnapshotDatabase(config.getSnapshotDbPath());
        database.initialize();
        return database;
    }

    @Produces
    @ApplicationScoped
    public DiffDataService diffDataService(ReconciliationConfig config, ProviderRegistry registry,
                                           SnapshotDatabase database, MetricsService metricsService) {
        SnapshotStore snapshotStore = SnapshotStore.builder()
                .database(database)
                .fetcher(registry.get(config.getSnapshotProvider()))
                .syncInterval(config.getSnapshotSyncInterval())
                .fuzzyThreshold(config.getFuzzyMatchThreshold())
                .metricsService(metricsService)
                .build();

        return DiffDataService.builder()
                .config(config)
                .registry(registry)
                .snapshotStore(snapshotStore)
                .metricsService(metricsService)
                .build();
    }

    public void closeDiffDataService(@Disposes DiffDataService service) {
        log.info("Closing DiffDataService");
        service.close();
    }
}
