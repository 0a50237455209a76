package com.openrangelabs.nycdata.sync.dto;

import com.openrangelabs.nycdata.sync.model.IngestOptions;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

import java.time.LocalDateTime;

/**
 * Request DTO for a manual ingestion of one dataset
 */
public class IngestRequest {

    @NotBlank(message = "Dataset id is required")
    private String datasetId;

    private Boolean fullSync = false;

    @Positive(message = "Limit must be positive")
    private Integer limit;

    private LocalDateTime fromDate;

    public IngestRequest() {}

    public IngestRequest(String datasetId, Boolean fullSync, Integer limit) {
        this.datasetId = datasetId;
        this.fullSync = fullSync;
        this.limit = limit;
    }

    public String getDatasetId() { return datasetId; }
    public void setDatasetId(String datasetId) { this.datasetId = datasetId; }

    public Boolean getFullSync() { return fullSync; }
    public void setFullSync(Boolean fullSync) { this.fullSync = fullSync; }

    public Integer getLimit() { return limit; }
    public void setLimit(Integer limit) { this.limit = limit; }

    public LocalDateTime getFromDate() { return fromDate; }
    public void setFromDate(LocalDateTime fromDate) { this.fromDate = fromDate; }

    public IngestOptions toOptions(String triggeredBy) {
        return new IngestOptions(Boolean.TRUE.equals(fullSync), limit, fromDate, triggeredBy);
    }

    @Override
    public String toString() {
        return "IngestRequest{" +
                "datasetId='" + datasetId + '\'' +
                ", fullSync=" + fullSync +
                ", limit=" + limit +
                ", fromDate=" + fromDate +
                '}';
    }
}
