package com.openrangelabs.nycdata.sync.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * A locally held source record, unique per dataset and natural key.
 * The payload is the transformed record as JSON.
 */
@Table("dataset_records")
public class DatasetRecord {

    @Id
    private Long id;

    @Column("dataset_id")
    private String datasetId;

    @Column("natural_key")
    private String naturalKey;

    @Column("record_date")
    private LocalDateTime recordDate;

    private String payload;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    public DatasetRecord() {}

    public DatasetRecord(String datasetId, String naturalKey, LocalDateTime recordDate, String payload) {
        this.datasetId = datasetId;
        this.naturalKey = naturalKey;
        this.recordDate = recordDate;
        this.payload = payload;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getDatasetId() { return datasetId; }
    public void setDatasetId(String datasetId) { this.datasetId = datasetId; }

    public String getNaturalKey() { return naturalKey; }
    public void setNaturalKey(String naturalKey) { this.naturalKey = naturalKey; }

    public LocalDateTime getRecordDate() { return recordDate; }
    public void setRecordDate(LocalDateTime recordDate) { this.recordDate = recordDate; }

    public String getPayload() { return payload; }
    public void setPayload(String payload) { this.payload = payload; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }
}
