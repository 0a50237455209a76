package com.openrangelabs.nycdata.sync.model;

import java.time.LocalDateTime;

public record SyncRecommendation(
        String datasetId,
        String name,
        int priority,
        SyncTier tier,
        SyncType syncType,
        String reason,
        Double freshnessScore,
        boolean verified,
        LocalDateTime lastSuccessfulSync,
        long estimatedDurationSeconds) {
}
