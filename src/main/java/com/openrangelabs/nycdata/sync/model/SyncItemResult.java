package com.openrangelabs.nycdata.sync.model;

/**
 * What happened to one queued dataset during an execution
 */
public record SyncItemResult(
        String datasetId,
        Outcome outcome,
        Long syncLogId,
        int recordsProcessed,
        int recordsAdded,
        long durationMillis,
        String message) {

    public enum Outcome {
        EXECUTED,
        FAILED,
        SKIPPED
    }

    public static SyncItemResult skipped(String datasetId, String reason) {
        return new SyncItemResult(datasetId, Outcome.SKIPPED, null, 0, 0, 0, reason);
    }
}
