package com.openrangelabs.nycdata.sync.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Health of the active datasets. Percentages run from 0 to 100.
 *
 * <p>{@code overallHealth} weighs average freshness at 40%, average sync success at 30%
 * and the share of healthy datasets at 30%.
 */
public record FreshnessHealth(
        int overallHealth,
        int totalDatasets,
        int healthyDatasets,
        int staleDatasets,
        int unverifiedDatasets,
        int failingDatasets,
        double averageFreshness,
        double averageSyncSuccess,
        long totalRecords,
        List<Concern> topConcerns,
        LocalDateTime generatedAt) {

    public enum Severity {
        HIGH,
        MEDIUM
    }

    public record Concern(String datasetId, String name, String issue, Severity severity, int priority) {
    }
}
