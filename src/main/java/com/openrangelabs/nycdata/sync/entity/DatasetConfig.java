package com.openrangelabs.nycdata.sync.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Entity representing the sync configuration of one external dataset
 */
@Table("dataset_config")
public class DatasetConfig {

    @Id
    private Long id;

    @Column("dataset_id")
    private String datasetId;

    private String name;

    private Integer priority = 50;

    @Column("is_active")
    private Boolean active = true;

    @Column("sync_enabled")
    private Boolean syncEnabled = true;

    @Column("is_built_in")
    private Boolean builtIn = false;

    // comma separated
    @Column("primary_key_fields")
    private String primaryKeyFields;

    @Column("date_field")
    private String dateField;

    @Column("date_format")
    private String dateFormat;

    @Column("api_endpoint")
    private String apiEndpoint;

    @Column("max_age_hours")
    private Integer maxAgeHours;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    @Column("created_by")
    private String createdBy;

    @Column("updated_by")
    private String updatedBy;

    // Constructors
    public DatasetConfig() {}

    public DatasetConfig(String datasetId, String name, Integer priority) {
        this.datasetId = datasetId;
        this.name = name;
        this.priority = priority;
    }

    // Business methods
    public boolean isEligibleForSync() {
        return Boolean.TRUE.equals(active) && Boolean.TRUE.equals(syncEnabled);
    }

    public boolean supportsIncrementalSync() {
        return dateField != null && !dateField.isBlank();
    }

    public void deactivate(String updatedBy) {
        this.active = false;
        this.syncEnabled = false;
        this.updatedBy = updatedBy;
    }

    public List<String> getPrimaryKeyFieldList() {
        if (primaryKeyFields == null || primaryKeyFields.isBlank()) {
            return List.of();
        }
        return Arrays.stream(primaryKeyFields.split(","))
                .map(String::trim)
                .filter(field -> !field.isEmpty())
                .collect(Collectors.toList());
    }

    public void setPrimaryKeyFieldList(List<String> fields) {
        this.primaryKeyFields = fields == null || fields.isEmpty() ? null : String.join(",", fields);
    }

    // Getters and Setters
    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getDatasetId() { return datasetId; }
    public void setDatasetId(String datasetId) { this.datasetId = datasetId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Integer getPriority() { return priority; }
    public void setPriority(Integer priority) { this.priority = priority; }

    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }

    public Boolean getSyncEnabled() { return syncEnabled; }
    public void setSyncEnabled(Boolean syncEnabled) { this.syncEnabled = syncEnabled; }

    public Boolean getBuiltIn() { return builtIn; }
    public void setBuiltIn(Boolean builtIn) { this.builtIn = builtIn; }

    public String getPrimaryKeyFields() { return primaryKeyFields; }
    public void setPrimaryKeyFields(String primaryKeyFields) { this.primaryKeyFields = primaryKeyFields; }

    public String getDateField() { return dateField; }
    public void setDateField(String dateField) { this.dateField = dateField; }

    public String getDateFormat() { return dateFormat; }
    public void setDateFormat(String dateFormat) { this.dateFormat = dateFormat; }

    public String getApiEndpoint() { return apiEndpoint; }
    public void setApiEndpoint(String apiEndpoint) { this.apiEndpoint = apiEndpoint; }

    public Integer getMaxAgeHours() { return maxAgeHours; }
    public void setMaxAgeHours(Integer maxAgeHours) { this.maxAgeHours = maxAgeHours; }

    public LocalDateTime getCreatedAt() { return createdAt; }
    public void setCreatedAt(LocalDateTime createdAt) { this.createdAt = createdAt; }

    public LocalDateTime getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(LocalDateTime updatedAt) { this.updatedAt = updatedAt; }

    public String getCreatedBy() { return createdBy; }
    public void setCreatedBy(String createdBy) { this.createdBy = createdBy; }

    public String getUpdatedBy() { return updatedBy; }
    public void setUpdatedBy(String updatedBy) { this.updatedBy = updatedBy; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DatasetConfig that = (DatasetConfig) o;
        return Objects.equals(datasetId, that.datasetId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(datasetId);
    }

    @Override
    public String toString() {
        return "DatasetConfig{" +
                "datasetId='" + datasetId + '\'' +
                ", name='" + name + '\'' +
                ", priority=" + priority +
                ", active=" + active +
                ", syncEnabled=" + syncEnabled +
                ", builtIn=" + builtIn +
                '}';
    }
}
