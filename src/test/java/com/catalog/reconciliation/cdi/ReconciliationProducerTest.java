package com.catalog.reconciliation.cdi;

import com.catalog.reconciliation.config.ReconciliationConfig;
import com.catalog.reconciliation.core.model.Provider;
import com.catalog.reconciliation.metrics.MetricsService;
import com.catalog.reconciliation.metrics.MicrometerMetricsService;
import com.catalog.reconciliation.metrics.NoOpMetricsService;
import com.catalog.reconciliation.pipeline.DiffDataService;
import com.catalog.reconciliation.provider.ProviderRegistry;
import com.catalog.reconciliation.snapshot.SnapshotDatabase;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import jakarta.enterprise.inject.Instance;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class ReconciliationProducerTest {

    @TempDir
    Path tempDir;

    private ReconciliationProducer producer;

    @BeforeEach
    void setUp() {
        producer = new ReconciliationProducer();
        producer.enabledSources = "metaforge, ardb";
        producer.requestTimeoutSeconds = 15;
        producer.fuzzyMatchThreshold = 0.9;
        producer.cacheEnabled = true;
        producer.cacheMaxSize = 50;
        producer.cacheTtlSeconds = 120;
        producer.snapshotProvider = "metaforge";
        producer.snapshotDbPath = tempDir.resolve("data").resolve("metaforge.sqlite").toString();
        producer.snapshotSyncIntervalMinutes = 30;
        producer.ardbItemsUrl = "https://ardb.example/api/items";
        producer.metaforgeItemsUrl = "https://metaforge.example/api/items";
        producer.metaforgePageSize = 100;
        producer.metaforgeIncludeComponents = true;
        producer.raidTheoryOwner = "RaidTheory";
        producer.raidTheoryRepo = "arcraiders-data";
        producer.raidTheoryBranch = "main";
        producer.raidTheoryItemsPath = "items";
        producer.raidTheoryConcurrency = 20;
        producer.raidTheoryMaxItems = 0;
        producer.mahcksBaseUrl = "https://mahcks.example";
        producer.mahcksPageSize = 45;
    }

    @Test
    @DisplayName("Config properties map onto the reconciliation config")
    void testConfig() {
        ReconciliationConfig config = producer.reconciliationConfig();

        assertEquals(List.of(Provider.METAFORGE, Provider.ARDB), config.getEnabledSources());
        assertEquals(Duration.ofSeconds(15), config.getRequestTimeout());
        assertEquals(0.9, config.getFuzzyMatchThreshold());
        assertEquals(50, config.getCacheMaxSize());
        assertEquals(Duration.ofMinutes(2), config.getCacheTtl());
        assertEquals(Duration.ofMinutes(30), config.getSnapshotSyncInterval());
        assertEquals("https://mahcks.example", config.getMahcksBaseUrl());
    }

    @Test
    @DisplayName("An unknown snapshot provider falls back to metaforge")
    void testUnknownSnapshotProvider() {
        producer.snapshotProvider = "nope";

        assertEquals(Provider.METAFORGE, producer.reconciliationConfig().getSnapshotProvider());
    }

    @Test
    @DisplayName("Metrics use Micrometer only when a registry is available")
    @SuppressWarnings("unchecked")
    void testMetricsService() {
        assertInstanceOf(NoOpMetricsService.class, producer.metricsService());

        Instance<MeterRegistry> instance = mock(Instance.class);
        when(instance.isResolvable()).thenReturn(true);
        when(instance.get()).thenReturn(new SimpleMeterRegistry());
        producer.meterRegistry = instance;
        assertInstanceOf(MicrometerMetricsService.class, producer.metricsService());

        Instance<MeterRegistry> unresolvable = mock(Instance.class);
        when(unresolvable.isResolvable()).thenReturn(false);
        producer.meterRegistry = unresolvable;
        assertInstanceOf(NoOpMetricsService.class, producer.metricsService());
    }

    @Test
    @DisplayName("The produced service wires the snapshot store to the configured database")
    void testDiffDataService() {
        ReconciliationConfig config = producer.reconciliationConfig();
        ProviderRegistry registry = producer.providerRegistry(config);
        SnapshotDatabase database = producer.snapshotDatabase(config);
        MetricsService metrics = producer.metricsService();

        assertTrue(Files.exists(database.getPath()));

        DiffDataService service = producer.diffDataService(config, registry, database, metrics);
        try {
            assertNotNull(service.getCache());
            assertEquals(0, service.getCache().getStats().size());
            assertFalse(service.getCache().containsKey("snapshot-data:metaforge"));
        } finally {
            producer.closeDiffDataService(service);
        }
    }
}
