package com.openrangelabs.nycdata.sync.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.Objects;

/**
 * Entity holding the latest freshness assessment of a dataset.
 * {@code verified} is false when the last remote count check failed and the score is carried over.
 */
@Table("data_freshness")
public class DataFreshness {

    @Id
    private Long id;

    @Column("dataset_id")
    private String datasetId;

    @Column("our_record_count")
    private Long ourRecordCount = 0L;

    @Column("remote_record_count")
    private Long remoteRecordCount;

    @Column("freshness_score")
    private Double freshnessScore;

    @Column("is_stale")
    private Boolean stale = false;

    @Column("recommend_sync")
    private Boolean recommendSync = false;

    private Boolean verified = false;

    @Column("last_checked")
    private LocalDateTime lastChecked;

    @Column("last_verified_at")
    private LocalDateTime lastVerifiedAt;

    // Constructors
    public DataFreshness() {}

    public DataFreshness(String datasetId) {
        this.datasetId = datasetId;
    }

    public DataFreshness copy() {
        DataFreshness copy = new DataFreshness(datasetId);
        copy.id = id;
        copy.ourRecordCount = ourRecordCount;
        copy.remoteRecordCount = remoteRecordCount;
        copy.freshnessScore = freshnessScore;
        copy.stale = stale;
        copy.recommendSync = recommendSync;
        copy.verified = verified;
        copy.lastChecked = lastChecked;
        copy.lastVerifiedAt = lastVerifiedAt;
        return copy;
    }

    // Business methods

    /** True once at least one remote count check has succeeded */
    public boolean hasBeenVerified() {
        return lastVerifiedAt != null;
    }

    public long getRecordGap() {
        if (remoteRecordCount == null || ourRecordCount == null) {
            return 0L;
        }
        return Math.max(0L, remoteRecordCount - ourRecordCount);
    }

    // Getters and Setters
    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getDatasetId() { return datasetId; }
    public void setDatasetId(String datasetId) { this.datasetId = datasetId; }

    public Long getOurRecordCount() { return ourRecordCount; }
    public void setOurRecordCount(Long ourRecordCount) { this.ourRecordCount = ourRecordCount; }

    public Long getRemoteRecordCount() { return remoteRecordCount; }
    public void setRemoteRecordCount(Long remoteRecordCount) { this.remoteRecordCount = remoteRecordCount; }

    public Double getFreshnessScore() { return freshnessScore; }
    public void setFreshnessScore(Double freshnessScore) { this.freshnessScore = freshnessScore; }

    public Boolean getStale() { return stale; }
    public void setStale(Boolean stale) { this.stale = stale; }

    public Boolean getRecommendSync() { return recommendSync; }
    public void setRecommendSync(Boolean recommendSync) { this.recommendSync = recommendSync; }

    public Boolean getVerified() { return verified; }
    public void setVerified(Boolean verified) { this.verified = verified; }

    public LocalDateTime getLastChecked() { return lastChecked; }
    public void setLastChecked(LocalDateTime lastChecked) { this.lastChecked = lastChecked; }

    public LocalDateTime getLastVerifiedAt() { return lastVerifiedAt; }
    public void setLastVerifiedAt(LocalDateTime lastVerifiedAt) { this.lastVerifiedAt = lastVerifiedAt; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DataFreshness that = (DataFreshness) o;
        return Objects.equals(datasetId, that.datasetId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(datasetId);
    }

    @Override
    public String toString() {
        return "DataFreshness{" +
                "datasetId='" + datasetId + '\'' +
                ", ourRecordCount=" + ourRecordCount +
                ", remoteRecordCount=" + remoteRecordCount +
                ", freshnessScore=" + freshnessScore +
                ", stale=" + stale +
                ", recommendSync=" + recommendSync +
                ", verified=" + verified +
                ", lastChecked=" + lastChecked +
                '}';
    }
}
