package com.openrangelabs.nycdata.sync.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * Optional overrides for registering a catalog dataset; anything left null is taken from detection
 */
public class RegisterDiscoveredRequest {

    @Min(value = 1, message = "Priority must be between 1 and 100")
    @Max(value = 100, message = "Priority must be between 1 and 100")
    private Integer priority;

    private Boolean syncEnabled;

    private List<String> primaryKeyFields;

    private String dateField;

    private String dateFormat;

    @Positive(message = "Max age must be positive")
    private Integer maxAgeHours;

    public RegisterDiscoveredRequest() {}

    public Integer getPriority() { return priority; }
    public void setPriority(Integer priority) { this.priority = priority; }

    public Boolean getSyncEnabled() { return syncEnabled; }
    public void setSyncEnabled(Boolean syncEnabled) { this.syncEnabled = syncEnabled; }

    public List<String> getPrimaryKeyFields() { return primaryKeyFields; }
    public void setPrimaryKeyFields(List<String> primaryKeyFields) { this.primaryKeyFields = primaryKeyFields; }

    public String getDateField() { return dateField; }
    public void setDateField(String dateField) { this.dateField = dateField; }

    public String getDateFormat() { return dateFormat; }
    public void setDateFormat(String dateFormat) { this.dateFormat = dateFormat; }

    public Integer getMaxAgeHours() { return maxAgeHours; }
    public void setMaxAgeHours(Integer maxAgeHours) { this.maxAgeHours = maxAgeHours; }
}
