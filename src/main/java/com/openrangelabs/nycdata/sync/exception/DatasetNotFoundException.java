package com.openrangelabs.nycdata.sync.exception;

/**
 * Exception thrown when a dataset id is not present in the registry.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class DatasetNotFoundException extends DatasetConfigurationException {

    private final String datasetId;

    public DatasetNotFoundException(String datasetId) {
        super(String.format("Dataset not found: %s", datasetId));
        this.datasetId = datasetId;
    }

    public String getDatasetId() {
        return datasetId;
    }
}
