package com.openrangelabs.nycdata.sync.model;

import java.time.LocalDateTime;

/**
 * Options of a single ingestion run.
 *
 * @param fullSync    ignore the watermark and read the whole dataset
 * @param limit       cap on records fetched, null for no cap
 * @param fromDate    explicit watermark, overrides the one derived from the sync log
 * @param triggeredBy actor recorded on the sync log
 */
public record IngestOptions(boolean fullSync, Integer limit, LocalDateTime fromDate, String triggeredBy) {

    public static IngestOptions full(String triggeredBy) {
        return new IngestOptions(true, null, null, triggeredBy);
    }

    public static IngestOptions incremental(String triggeredBy) {
        return new IngestOptions(false, null, null, triggeredBy);
    }

    public SyncType requestedType() {
        return fullSync ? SyncType.FULL : SyncType.INCREMENTAL;
    }
}
