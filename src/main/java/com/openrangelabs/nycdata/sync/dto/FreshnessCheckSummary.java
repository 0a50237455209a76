package com.openrangelabs.nycdata.sync.dto;

import java.time.LocalDateTime;

/**
 * Outcome of checking a set of datasets against the source
 */
public record FreshnessCheckSummary(
        int checked,
        int stale,
        int fresh,
        int unverified,
        int failed,
        LocalDateTime checkedAt) {
}
