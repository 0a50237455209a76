package com.openrangelabs.nycdata.sync.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request DTO for updating a dataset. Null fields are left unchanged.
 */
public class UpdateDatasetRequest {

    @Size(min = 1, max = 255, message = "Name must be between 1 and 255 characters")
    private String name;

    @Min(value = 1, message = "Priority must be between 1 and 100")
    @Max(value = 100, message = "Priority must be between 1 and 100")
    private Integer priority;

    private Boolean active;

    private Boolean syncEnabled;

    @Size(min = 1, message = "Primary key fields cannot be empty")
    private List<String> primaryKeyFields;

    private String dateField;

    private String dateFormat;

    @Pattern(regexp = "^https?://.+", message = "API endpoint must be an http(s) URL")
    private String apiEndpoint;

    @Positive(message = "Max age must be positive")
    private Integer maxAgeHours;

    public UpdateDatasetRequest() {}

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public Integer getPriority() { return priority; }
    public void setPriority(Integer priority) { this.priority = priority; }

    public Boolean getActive() { return active; }
    public void setActive(Boolean active) { this.active = active; }

    public Boolean getSyncEnabled() { return syncEnabled; }
    public void setSyncEnabled(Boolean syncEnabled) { this.syncEnabled = syncEnabled; }

    public List<String> getPrimaryKeyFields() { return primaryKeyFields; }
    public void setPrimaryKeyFields(List<String> primaryKeyFields) { this.primaryKeyFields = primaryKeyFields; }

    public String getDateField() { return dateField; }
    public void setDateField(String dateField) { this.dateField = dateField; }

    public String getDateFormat() { return dateFormat; }
    public void setDateFormat(String dateFormat) { this.dateFormat = dateFormat; }

    public String getApiEndpoint() { return apiEndpoint; }
    public void setApiEndpoint(String apiEndpoint) { this.apiEndpoint = apiEndpoint; }

    public Integer getMaxAgeHours() { return maxAgeHours; }
    public void setMaxAgeHours(Integer maxAgeHours) { this.maxAgeHours = maxAgeHours; }
}
