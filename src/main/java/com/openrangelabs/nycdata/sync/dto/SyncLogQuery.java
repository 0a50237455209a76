package com.openrangelabs.nycdata.sync.dto;

import java.time.LocalDateTime;

/**
 * Filters for the sync log listing. Date bounds apply to the run start time and are inclusive.
 */
public record SyncLogQuery(
        String datasetId,
        String status,
        LocalDateTime startDate,
        LocalDateTime endDate,
        int limit,
        int offset) {

    public static final int DEFAULT_LIMIT = 50;
    public static final int MAX_LIMIT = 500;

    public SyncLogQuery {
        limit = limit <= 0 ? DEFAULT_LIMIT : Math.min(limit, MAX_LIMIT);
        offset = Math.max(0, offset);
    }
}
