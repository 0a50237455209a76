package com.openrangelabs.nycdata.sync.dto;

/**
 * Aggregated runs for one dataset and status
 */
public record SyncLogStats(
        String datasetId,
        String status,
        long runs,
        long recordsProcessed,
        long recordsAdded,
        long recordsUpdated,
        long recordsFailed) {
}
