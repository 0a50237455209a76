package com.openrangelabs.nycdata.sync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for freshness scoring, sync planning and ingestion, bound from {@code nycdata.*}.
 */
@ConfigurationProperties(prefix = "nycdata")
public class NycDataProperties {

    private Source source = new Source();
    private Freshness freshness = new Freshness();
    private Pipeline pipeline = new Pipeline();
    private Executor executor = new Executor();
    private Catalog catalog = new Catalog();
    private Discovery discovery = new Discovery();

    public Source getSource() { return source; }
    public void setSource(Source source) { this.source = source; }

    public Freshness getFreshness() { return freshness; }
    public void setFreshness(Freshness freshness) { this.freshness = freshness; }

    public Pipeline getPipeline() { return pipeline; }
    public void setPipeline(Pipeline pipeline) { this.pipeline = pipeline; }

    public Executor getExecutor() { return executor; }
    public void setExecutor(Executor executor) { this.executor = executor; }

    public Catalog getCatalog() { return catalog; }
    public void setCatalog(Catalog catalog) { this.catalog = catalog; }

    public Discovery getDiscovery() { return discovery; }
    public void setDiscovery(Discovery discovery) { this.discovery = discovery; }

    public static class Source {
        private String baseUrl = "https://data.cityofnewyork.us/resource";
        private String appToken;
        private int timeoutSeconds = 30;
        private int retryAttempts = 3;
        private long retryBackoffMillis = 1000;
        private long maxRetryBackoffMillis = 10_000;
        private int maxInMemorySizeMb = 16;

        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }

        public String getAppToken() { return appToken; }
        public void setAppToken(String appToken) { this.appToken = appToken; }

        public int getTimeoutSeconds() { return timeoutSeconds; }
        public void setTimeoutSeconds(int timeoutSeconds) { this.timeoutSeconds = timeoutSeconds; }

        public int getRetryAttempts() { return retryAttempts; }
        public void setRetryAttempts(int retryAttempts) { this.retryAttempts = retryAttempts; }

        public long getRetryBackoffMillis() { return retryBackoffMillis; }
        public void setRetryBackoffMillis(long retryBackoffMillis) { this.retryBackoffMillis = retryBackoffMillis; }

        public long getMaxRetryBackoffMillis() { return maxRetryBackoffMillis; }
        public void setMaxRetryBackoffMillis(long maxRetryBackoffMillis) { this.maxRetryBackoffMillis = maxRetryBackoffMillis; }

        public int getMaxInMemorySizeMb() { return maxInMemorySizeMb; }
        public void setMaxInMemorySizeMb(int maxInMemorySizeMb) { this.maxInMemorySizeMb = maxInMemorySizeMb; }
    }

    public static class Freshness {
        private double staleThreshold = 0.99;
        private double criticalThreshold = 0.5;
        private double moderateThreshold = 0.9;
        private double approachingMargin = 0.005;
        private int defaultMaxAgeHours = 168;
        private int recentSyncWindowMinutes = 60;
        private double fullSyncGapRatio = 0.2;

        public double getStaleThreshold() { return staleThreshold; }
        public void setStaleThreshold(double staleThreshold) { this.staleThreshold = staleThreshold; }

        public double getCriticalThreshold() { return criticalThreshold; }
        public void setCriticalThreshold(double criticalThreshold) { this.criticalThreshold = criticalThreshold; }

        public double getModerateThreshold() { return moderateThreshold; }
        public void setModerateThreshold(double moderateThreshold) { this.moderateThreshold = moderateThreshold; }

        public double getApproachingMargin() { return approachingMargin; }
        public void setApproachingMargin(double approachingMargin) { this.approachingMargin = approachingMargin; }

        public int getDefaultMaxAgeHours() { return defaultMaxAgeHours; }
        public void setDefaultMaxAgeHours(int defaultMaxAgeHours) { this.defaultMaxAgeHours = defaultMaxAgeHours; }

        public int getRecentSyncWindowMinutes() { return recentSyncWindowMinutes; }
        public void setRecentSyncWindowMinutes(int recentSyncWindowMinutes) { this.recentSyncWindowMinutes = recentSyncWindowMinutes; }

        public double getFullSyncGapRatio() { return fullSyncGapRatio; }
        public void setFullSyncGapRatio(double fullSyncGapRatio) { this.fullSyncGapRatio = fullSyncGapRatio; }
    }

    public static class Pipeline {
        private int fullBatchSize = 10_000;
        private int incrementalBatchSize = 5_000;
        private long datasetTimeBudgetSeconds = 900;
        private long staleInProgressMinutes = 120;

        public int getFullBatchSize() { return fullBatchSize; }
        public void setFullBatchSize(int fullBatchSize) { this.fullBatchSize = fullBatchSize; }

        public int getIncrementalBatchSize() { return incrementalBatchSize; }
        public void setIncrementalBatchSize(int incrementalBatchSize) { this.incrementalBatchSize = incrementalBatchSize; }

        public long getDatasetTimeBudgetSeconds() { return datasetTimeBudgetSeconds; }
        public void setDatasetTimeBudgetSeconds(long datasetTimeBudgetSeconds) { this.datasetTimeBudgetSeconds = datasetTimeBudgetSeconds; }

        public long getStaleInProgressMinutes() { return staleInProgressMinutes; }
        public void setStaleInProgressMinutes(long staleInProgressMinutes) { this.staleInProgressMinutes = staleInProgressMinutes; }
    }

    public static class Executor {
        private int defaultMaxConcurrent = 2;
        private long defaultMaxDurationSeconds = 3600;
        private int maxConcurrentLimit = 10;

        public int getDefaultMaxConcurrent() { return defaultMaxConcurrent; }
        public void setDefaultMaxConcurrent(int defaultMaxConcurrent) { this.defaultMaxConcurrent = defaultMaxConcurrent; }

        public long getDefaultMaxDurationSeconds() { return defaultMaxDurationSeconds; }
        public void setDefaultMaxDurationSeconds(long defaultMaxDurationSeconds) { this.defaultMaxDurationSeconds = defaultMaxDurationSeconds; }

        public int getMaxConcurrentLimit() { return maxConcurrentLimit; }
        public void setMaxConcurrentLimit(int maxConcurrentLimit) { this.maxConcurrentLimit = maxConcurrentLimit; }
    }

    public static class Catalog {
        private List<BuiltInDataset> builtIn = new ArrayList<>();

        public List<BuiltInDataset> getBuiltIn() { return builtIn; }
        public void setBuiltIn(List<BuiltInDataset> builtIn) { this.builtIn = builtIn; }
    }

    /**
     * Socrata catalog search used to find datasets worth registering
     */
    public static class Discovery {
        private String catalogUrl = "https://api.us.socrata.com/api/catalog/v1";
        private String domain = "data.cityofnewyork.us";
        private int defaultLimit = 20;
        private int maxLimit = 100;
        private int recommendedLimit = 10;
        private List<String> recommendedKeywords = new ArrayList<>(List.of(
                "property", "building", "housing", "permit", "violation", "construction",
                "rent", "sale", "assessment", "zoning", "eviction", "real estate"));

        public String getCatalogUrl() { return catalogUrl; }
        public void setCatalogUrl(String catalogUrl) { this.catalogUrl = catalogUrl; }

        public String getDomain() { return domain; }
        public void setDomain(String domain) { this.domain = domain; }

        public int getDefaultLimit() { return defaultLimit; }
        public void setDefaultLimit(int defaultLimit) { this.defaultLimit = defaultLimit; }

        public int getMaxLimit() { return maxLimit; }
        public void setMaxLimit(int maxLimit) { this.maxLimit = maxLimit; }

        public int getRecommendedLimit() { return recommendedLimit; }
        public void setRecommendedLimit(int recommendedLimit) { this.recommendedLimit = recommendedLimit; }

        public List<String> getRecommendedKeywords() { return recommendedKeywords; }
        public void setRecommendedKeywords(List<String> recommendedKeywords) { this.recommendedKeywords = recommendedKeywords; }
    }

    /**
     * A dataset seeded into the registry at startup
     */
    public static class BuiltInDataset {
        private String datasetId;
        private String name;
        private int priority = 50;
        private List<String> primaryKeyFields = new ArrayList<>();
        private String dateField;
        private String dateFormat;
        private Integer maxAgeHours;

        public String getDatasetId() { return datasetId; }
        public void setDatasetId(String datasetId) { this.datasetId = datasetId; }

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public int getPriority() { return priority; }
        public void setPriority(int priority) { this.priority = priority; }

        public List<String> getPrimaryKeyFields() { return primaryKeyFields; }
        public void setPrimaryKeyFields(List<String> primaryKeyFields) { this.primaryKeyFields = primaryKeyFields; }

        public String getDateField() { return dateField; }
        public void setDateField(String dateField) { this.dateField = dateField; }

        public String getDateFormat() { return dateFormat; }
        public void setDateFormat(String dateFormat) { this.dateFormat = dateFormat; }

        public Integer getMaxAgeHours() { return maxAgeHours; }
        public void setMaxAgeHours(Integer maxAgeHours) { this.maxAgeHours = maxAgeHours; }
    }
}
