package com.openrangelabs.nycdata.sync.model;

import java.time.LocalDateTime;

/**
 * Point-in-time counters of the running (or last) execution
 */
public record ExecutionProgress(
        boolean running,
        int queued,
        int inFlight,
        int executed,
        int failed,
        int skipped,
        LocalDateTime startedAt,
        LocalDateTime deadline) {

    public static ExecutionProgress idle() {
        return new ExecutionProgress(false, 0, 0, 0, 0, 0, null, null);
    }

    public int remaining() {
        return queued - executed - failed - skipped - inFlight;
    }
}
