package com.openrangelabs.nycdata.sync.model;

/**
 * Lifecycle of a sync log entry. Stored lower-case.
 */
public enum SyncStatus {
    IN_PROGRESS,
    SUCCESS,
    PARTIAL,
    FAILED;

    public String value() {
        return name().toLowerCase();
    }

    public boolean isTerminal() {
        return this != IN_PROGRESS;
    }

    /** success and partial runs both advance the watermark */
    public boolean isCompleted() {
        return this == SUCCESS || this == PARTIAL;
    }

    public static SyncStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        return SyncStatus.valueOf(value.toUpperCase());
    }
}
