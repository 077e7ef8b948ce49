package com.catalog.reconciliation.config;

import com.catalog.reconciliation.core.model.Provider;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Settings for the reconciliation pipeline, the memoized cache, the snapshot store and
 * the provider fetchers.
 */
public class ReconciliationConfig {

    public static final List<Provider> DEFAULT_ENABLED_SOURCES =
            List.of(Provider.ARDB, Provider.METAFORGE, Provider.RAIDTHEORY);

    private static final Duration DEFAULT_CACHE_TTL = Duration.ofMinutes(10);
    private static final int DEFAULT_CACHE_MAX_SIZE = 1_000;
    private static final double DEFAULT_FUZZY_MATCH_THRESHOLD = 0.93;
    private static final Duration DEFAULT_REQUEST_TIMEOUT = Duration.ofSeconds(30);
    private static final Path DEFAULT_SNAPSHOT_DB_PATH = Path.of("data", "metaforge.sqlite");
    private static final Duration DEFAULT_SNAPSHOT_SYNC_INTERVAL = Duration.ofHours(6);

    private final Duration cacheTtl;
    private final int cacheMaxSize;
    private final boolean cacheEnabled;
    private final double fuzzyMatchThreshold;
    private final List<Provider> enabledSources;
    private final Duration requestTimeout;
    private final int fetchParallelism;
    private final Provider snapshotProvider;
    private final Path snapshotDbPath;
    private final Duration snapshotSyncInterval;
    private final String ardbItemsUrl;
    private final String metaforgeItemsUrl;
    private final int metaforgePageSize;
    private final boolean metaforgeIncludeComponents;
    private final String raidTheoryOwner;
    private final String raidTheoryRepo;
    private final String raidTheoryBranch;
    private final String raidTheoryItemsPath;
    private final int raidTheoryConcurrency;
    private final int raidTheoryMaxItems;
    private final String mahcksBaseUrl;
    private final int mahcksPageSize;

    private ReconciliationConfig(Builder builder) {
        this.cacheTtl = builder.cacheTtl;
        this.cacheMaxSize = builder.cacheMaxSize;
        this.cacheEnabled = builder.cacheEnabled;
        this.fuzzyMatchThreshold = builder.fuzzyMatchThreshold;
        this.enabledSources = List.copyOf(builder.enabledSources);
        this.requestTimeout = builder.requestTimeout;
        this.fetchParallelism = builder.fetchParallelism;
        this.snapshotProvider = builder.snapshotProvider;
        this.snapshotDbPath = builder.snapshotDbPath;
        this.snapshotSyncInterval = builder.snapshotSyncInterval;
        this.ardbItemsUrl = builder.ardbItemsUrl;
        this.metaforgeItemsUrl = builder.metaforgeItemsUrl;
        this.metaforgePageSize = builder.metaforgePageSize;
        this.metaforgeIncludeComponents = builder.metaforgeIncludeComponents;
        this.raidTheoryOwner = builder.raidTheoryOwner;
        this.raidTheoryRepo = builder.raidTheoryRepo;
        this.raidTheoryBranch = builder.raidTheoryBranch;
        this.raidTheoryItemsPath = builder.raidTheoryItemsPath;
        this.raidTheoryConcurrency = builder.raidTheoryConcurrency;
        this.raidTheoryMaxItems = builder.raidTheoryMaxItems;
        this.mahcksBaseUrl = builder.mahcksBaseUrl;
        this.mahcksPageSize = builder.mahcksPageSize;
    }

    public Duration getCacheTtl() {
        return cacheTtl;
    }

    public int getCacheMaxSize() {
        return cacheMaxSize;
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    public double getFuzzyMatchThreshold() {
        return fuzzyMatchThreshold;
    }

    public List<Provider> getEnabledSources() {
        return enabledSources;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    /**
     * Number of provider fetches that may run at the same time within one pipeline run.
     */
    public int getFetchParallelism() {
        return fetchParallelism;
    }

    public Provider getSnapshotProvider() {
        return snapshotProvider;
    }

    public Path getSnapshotDbPath() {
        return snapshotDbPath;
    }

    public Duration getSnapshotSyncInterval() {
        return snapshotSyncInterval;
    }

    public String getArdbItemsUrl() {
        return ardbItemsUrl;
    }

    public String getMetaforgeItemsUrl() {
        return metaforgeItemsUrl;
    }

    public int getMetaforgePageSize() {
        return metaforgePageSize;
    }

    public boolean isMetaforgeIncludeComponents() {
        return metaforgeIncludeComponents;
    }

    public String getRaidTheoryOwner() {
        return raidTheoryOwner;
    }

    public String getRaidTheoryRepo() {
        return raidTheoryRepo;
    }

    public String getRaidTheoryBranch() {
        return raidTheoryBranch;
    }

    public String getRaidTheoryItemsPath() {
        return raidTheoryItemsPath;
    }

    public int getRaidTheoryConcurrency() {
        return raidTheoryConcurrency;
    }

    /**
     * Maximum number of RaidTheory item files to download; 0 means all.
     */
    public int getRaidTheoryMaxItems() {
        return raidTheoryMaxItems;
    }

    public String getMahcksBaseUrl() {
        return mahcksBaseUrl;
    }

    public int getMahcksPageSize() {
        return mahcksPageSize;
    }

    /**
     * Creates default configuration.
     */
    public static ReconciliationConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private Duration cacheTtl = DEFAULT_CACHE_TTL;
        private int cacheMaxSize = DEFAULT_CACHE_MAX_SIZE;
        private boolean cacheEnabled = true;
        private double fuzzyMatchThreshold = DEFAULT_FUZZY_MATCH_THRESHOLD;
        private List<Provider> enabledSources = DEFAULT_ENABLED_SOURCES;
        private Duration requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private int fetchParallelism = Provider.values().length;
        private Provider snapshotProvider = Provider.METAFORGE;
        private Path snapshotDbPath = DEFAULT_SNAPSHOT_DB_PATH;
        private Duration snapshotSyncInterval = DEFAULT_SNAPSHOT_SYNC_INTERVAL;
        private String ardbItemsUrl = "https://ardb.app/api/items";
        private String metaforgeItemsUrl = "https://metaforge.app/api/arc-raiders/items";
        private int metaforgePageSize = 100;
        private boolean metaforgeIncludeComponents = true;
        private String raidTheoryOwner = "RaidTheory";
        private String raidTheoryRepo = "arcraiders-data";
        private String raidTheoryBranch = "main";
        private String raidTheoryItemsPath = "items";
        private int raidTheoryConcurrency = 20;
        private int raidTheoryMaxItems = 0;
        private String mahcksBaseUrl = "https://arcdata.mahcks.com";
        private int mahcksPageSize = 45;

        public Builder cacheTtl(Duration cacheTtl) {
            this.cacheTtl = requirePositive(cacheTtl, "cacheTtl");
            return this;
        }

        public Builder cacheMaxSize(int cacheMaxSize) {
            if (cacheMaxSize <= 0) {
                throw new IllegalArgumentException("cacheMaxSize must be > 0");
            }
            this.cacheMaxSize = cacheMaxSize;
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public Builder fuzzyMatchThreshold(double fuzzyMatchThreshold) {
            if (fuzzyMatchThreshold < 0.0 || fuzzyMatchThreshold > 1.0) {
                throw new IllegalArgumentException("fuzzyMatchThreshold must be between 0.0 and 1.0");
            }
            this.fuzzyMatchThreshold = fuzzyMatchThreshold;
            return this;
        }

        public Builder enabledSources(List<Provider> enabledSources) {
            Objects.requireNonNull(enabledSources, "enabledSources is required");
            this.enabledSources = enabledSources.isEmpty() ? DEFAULT_ENABLED_SOURCES : enabledSources;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requirePositive(requestTimeout, "requestTimeout");
            return this;
        }

        public Builder fetchParallelism(int fetchParallelism) {
            if (fetchParallelism <= 0) {
                throw new IllegalArgumentException("fetchParallelism must be > 0");
            }
            this.fetchParallelism = fetchParallelism;
            return this;
        }

        public Builder snapshotProvider(Provider snapshotProvider) {
            this.snapshotProvider = Objects.requireNonNull(snapshotProvider, "snapshotProvider is required");
            return this;
        }

        public Builder snapshotDbPath(Path snapshotDbPath) {
            this.snapshotDbPath = Objects.requireNonNull(snapshotDbPath, "snapshotDbPath is required");
            return this;
        }

        public Builder snapshotSyncInterval(Duration snapshotSyncInterval) {
            this.snapshotSyncInterval = requirePositive(snapshotSyncInterval, "snapshotSyncInterval");
            return this;
        }

        public Builder ardbItemsUrl(String ardbItemsUrl) {
            this.ardbItemsUrl = ardbItemsUrl;
            return this;
        }

        public Builder metaforgeItemsUrl(String metaforgeItemsUrl) {
            this.metaforgeItemsUrl = metaforgeItemsUrl;
            return this;
        }

        public Builder metaforgePageSize(int metaforgePageSize) {
            this.metaforgePageSize = requirePositive(metaforgePageSize, "metaforgePageSize");
            return this;
        }

        public Builder metaforgeIncludeComponents(boolean metaforgeIncludeComponents) {
            this.metaforgeIncludeComponents = metaforgeIncludeComponents;
            return this;
        }

        public Builder raidTheoryOwner(String raidTheoryOwner) {
            this.raidTheoryOwner = raidTheoryOwner;
            return this;
        }

        public Builder raidTheoryRepo(String raidTheoryRepo) {
            this.raidTheoryRepo = raidTheoryRepo;
            return this;
        }

        public Builder raidTheoryBranch(String raidTheoryBranch) {
            this.raidTheoryBranch = raidTheoryBranch;
            return this;
        }

        public Builder raidTheoryItemsPath(String raidTheoryItemsPath) {
            this.raidTheoryItemsPath = raidTheoryItemsPath;
            return this;
        }

        public Builder raidTheoryConcurrency(int raidTheoryConcurrency) {
            this.raidTheoryConcurrency = requirePositive(raidTheoryConcurrency, "raidTheoryConcurrency");
            return this;
        }

        public Builder raidTheoryMaxItems(int raidTheoryMaxItems) {
            if (raidTheoryMaxItems < 0) {
                throw new IllegalArgumentException("raidTheoryMaxItems must be >= 0");
            }
            this.raidTheoryMaxItems = raidTheoryMaxItems;
            return this;
        }

        public Builder mahcksBaseUrl(String mahcksBaseUrl) {
            this.mahcksBaseUrl = mahcksBaseUrl;
            return this;
        }

        public Builder mahcksPageSize(int mahcksPageSize) {
            this.mahcksPageSize = requirePositive(mahcksPageSize, "mahcksPageSize");
            return this;
        }

        public ReconciliationConfig build() {
            return new ReconciliationConfig(this);
        }

        private static Duration requirePositive(Duration value, String name) {
            Objects.requireNonNull(value, name + " is required");
            if (value.isNegative() || value.isZero()) {
                throw new IllegalArgumentException(name + " must be > 0");
            }
            return value;
        }

        private static int requirePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be > 0");
            }
            return value;
        }
    }
}
