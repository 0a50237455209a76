package com.openrangelabs.nycdata.sync.exception;

/**
 * Exception thrown when registering a dataset id that is already configured.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class DatasetAlreadyExistsException extends DatasetConfigurationException {

    private final String datasetId;

    public DatasetAlreadyExistsException(String datasetId) {
        super(String.format("Dataset already configured: %s", datasetId));
        this.datasetId = datasetId;
    }

    public String getDatasetId() {
        return datasetId;
    }
}
