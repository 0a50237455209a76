package com.openrangelabs.nycdata.sync.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

import java.util.List;

/**
 * Request DTO for registering a custom dataset
 */
public class CreateDatasetRequest {

    @NotBlank(message = "Dataset id is required")
    @Pattern(regexp = "^[a-z0-9]{4}-[a-z0-9]{4}$",
            message = "Dataset id must look like abcd-1234")
    private String datasetId;

    @NotBlank(message = "Name is required")
    @Size(max = 255, message = "Name must be at most 255 characters")
    private String name;

    @Min(value = 1, message = "Priority must be between 1 and 100")
    @Max(value = 100, message = "Priority must be between 1 and 100")
    private Integer priority = 50;

    private Boolean syncEnabled = true;

    @NotEmpty(message = "At least one primary key field is required")
    private List<String> primaryKeyFields;

    private String dateField;

    private String dateFormat;

    @Pattern(regexp = "^https?://.+", message = "API endpoint must be an http(s) URL")
    private String apiEndpoint;

    @Positive(message = "Max age must be positive")
    private Integer maxAgeHours;

    // Constructors
    public CreateDatasetRequest() {}

    public CreateDatasetRequest(String datasetId, String name, Integer priority, List<String> primaryKeyFields) {
        this.datasetId = datasetId;
        this.name = name;
        this.priority = priority;
        this.primaryKeyFields = primaryKeyFields;
    }

    // Getters and Setters
    public String getDatasetId() { return datasetId; }
    public void setDatasetId(String datasetId) { this.datasetId = datasetId; }

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

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

    public String getApiEndpoint() { return apiEndpoint; }
    public void setApiEndpoint(String apiEndpoint) { this.apiEndpoint = apiEndpoint; }

    public Integer getMaxAgeHours() { return maxAgeHours; }
    public void setMaxAgeHours(Integer maxAgeHours) { this.maxAgeHours = maxAgeHours; }
}
