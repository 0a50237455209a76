package com.openrangelabs.nycdata.sync.model;

public enum SyncType {
    FULL,        // Re-read the whole dataset
    INCREMENTAL; // Only records past the last watermark

    public String value() {
        return name().toLowerCase();
    }

    public static SyncType fromValue(String value) {
        return value == null ? null : SyncType.valueOf(value.toUpperCase());
    }
}
