package com.openrangelabs.nycdata.sync.model;

import java.time.LocalDateTime;

public record StaleDataset(
        String datasetId,
        String name,
        int priority,
        Double freshnessScore,
        long recordGap,
        boolean verified,
        LocalDateTime lastChecked) {
}
