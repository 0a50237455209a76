package com.openrangelabs.nycdata.sync.model;

/**
 * Urgency buckets of the sync plan, most urgent first
 */
public enum SyncTier {
    IMMEDIATE,
    WITHIN_HOUR,
    TODAY,
    THIS_WEEK,
    NO_ACTION;

    /** Tiers the executor picks up on its own */
    public boolean isAutoExecutable() {
        return this == IMMEDIATE || this == WITHIN_HOUR || this == TODAY;
    }
}
