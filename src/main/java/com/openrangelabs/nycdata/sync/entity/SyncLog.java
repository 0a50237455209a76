package com.openrangelabs.nycdata.sync.entity;

import com.openrangelabs.nycdata.sync.model.SyncStatus;
import com.openrangelabs.nycdata.sync.model.SyncType;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Entity representing one ingestion attempt for a dataset.
 * Written as {@code in_progress} when the run starts and finalized once when it ends.
 */
@Table("sync_log")
public class SyncLog {

    @Id
    private Long id;

    @Column("dataset_id")
    private String datasetId;

    @Column("sync_type")
    private String syncType;

    @Column("records_processed")
    private Integer recordsProcessed = 0;

    @Column("records_added")
    private Integer recordsAdded = 0;

    @Column("records_updated")
    private Integer recordsUpdated = 0;

    @Column("records_failed")
    private Integer recordsFailed = 0;

    @Column("start_time")
    private LocalDateTime startTime;

    @Column("end_time")
    private LocalDateTime endTime;

    private String status = SyncStatus.IN_PROGRESS.value();

    @Column("error_message")
    private String errorMessage;

    @Column("last_record_date")
    private LocalDateTime lastRecordDate;

    @Column("triggered_by")
    private String triggeredBy;

    // Constructors
    public SyncLog() {}

    public SyncLog(String datasetId, SyncType syncType, LocalDateTime startTime, String triggeredBy) {
        this.datasetId = datasetId;
        this.syncType = syncType.value();
        this.startTime = startTime;
        this.triggeredBy = triggeredBy;
    }

    // Business methods
    public SyncStatus getSyncStatus() {
        return SyncStatus.fromValue(status);
    }

    public boolean isInProgress() {
        return SyncStatus.IN_PROGRESS.value().equals(status);
    }

    public boolean isCompleted() {
        SyncStatus syncStatus = getSyncStatus();
        return syncStatus != null && syncStatus.isCompleted();
    }

    public boolean isFailed() {
        return SyncStatus.FAILED.value().equals(status);
    }

    public Duration getDuration() {
        if (startTime == null) return Duration.ZERO;
        LocalDateTime end = endTime != null ? endTime : startTime;
        return Duration.between(startTime, end);
    }

    public int getRecordsSucceeded() {
        return recordsProcessed - recordsFailed;
    }

    // Getters and Setters
    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getDatasetId() { return datasetId; }
    public void setDatasetId(String datasetId) { this.datasetId = datasetId; }

    public String getSyncType() { return syncType; }
    public void setSyncType(String syncType) { this.syncType = syncType; }

    public Integer getRecordsProcessed() { return recordsProcessed; }
    public void setRecordsProcessed(Integer recordsProcessed) { this.recordsProcessed = recordsProcessed; }

    public Integer getRecordsAdded() { return recordsAdded; }
    public void setRecordsAdded(Integer recordsAdded) { this.recordsAdded = recordsAdded; }

    public Integer getRecordsUpdated() { return recordsUpdated; }
    public void setRecordsUpdated(Integer recordsUpdated) { this.recordsUpdated = recordsUpdated; }

    public Integer getRecordsFailed() { return recordsFailed; }
    public void setRecordsFailed(Integer recordsFailed) { this.recordsFailed = recordsFailed; }

    public LocalDateTime getStartTime() { return startTime; }
    public void setStartTime(LocalDateTime startTime) { this.startTime = startTime; }

    public LocalDateTime getEndTime() { return endTime; }
    public void setEndTime(LocalDateTime endTime) { this.endTime = endTime; }

    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }

    public String getErrorMessage() { return errorMessage; }
    public void setErrorMessage(String errorMessage) { this.errorMessage = errorMessage; }

    public LocalDateTime getLastRecordDate() { return lastRecordDate; }
    public void setLastRecordDate(LocalDateTime lastRecordDate) { this.lastRecordDate = lastRecordDate; }

    public String getTriggeredBy() { return triggeredBy; }
    public void setTriggeredBy(String triggeredBy) { this.triggeredBy = triggeredBy; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SyncLog syncLog = (SyncLog) o;
        return Objects.equals(id, syncLog.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "SyncLog{" +
                "id=" + id +
                ", datasetId='" + datasetId + '\'' +
                ", syncType='" + syncType + '\'' +
                ", status='" + status + '\'' +
                ", recordsProcessed=" + recordsProcessed +
                ", recordsAdded=" + recordsAdded +
                ", recordsUpdated=" + recordsUpdated +
                ", recordsFailed=" + recordsFailed +
                ", startTime=" + startTime +
                ", endTime=" + endTime +
                '}';
    }
}
