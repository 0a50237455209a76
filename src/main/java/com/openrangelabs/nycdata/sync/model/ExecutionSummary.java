package com.openrangelabs.nycdata.sync.model;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Aggregate result of a bounded execution. {@code executed + failed + skipped} equals the queue length.
 */
public record ExecutionSummary(
        int executed,
        int failed,
        int skipped,
        long totalDurationMillis,
        int successRate,
        List<SyncItemResult> results,
        LocalDateTime startedAt,
        LocalDateTime finishedAt) {

    public static int successRate(int executed, int failed) {
        int attempted = executed + failed;
        return attempted == 0 ? 0 : (int) Math.round(executed * 100.0 / attempted);
    }
}
