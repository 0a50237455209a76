package com.openrangelabs.nycdata.sync.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;

/**
 * Limits for executing the recommended syncs. Missing values fall back to the configured defaults.
 */
public class ExecuteRecommendedRequest {

    @Min(value = 1, message = "maxConcurrent must be between 1 and 10")
    @Max(value = 10, message = "maxConcurrent must be between 1 and 10")
    private Integer maxConcurrent;

    @Min(value = 0, message = "maxDuration must be between 0 and 86400 seconds")
    @Max(value = 86400, message = "maxDuration must be between 0 and 86400 seconds")
    private Long maxDuration;

    public ExecuteRecommendedRequest() {}

    public ExecuteRecommendedRequest(Integer maxConcurrent, Long maxDuration) {
        this.maxConcurrent = maxConcurrent;
        this.maxDuration = maxDuration;
    }

    public Integer getMaxConcurrent() { return maxConcurrent; }
    public void setMaxConcurrent(Integer maxConcurrent) { this.maxConcurrent = maxConcurrent; }

    public Long getMaxDuration() { return maxDuration; }
    public void setMaxDuration(Long maxDuration) { this.maxDuration = maxDuration; }
}
