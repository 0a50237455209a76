package com.openrangelabs.nycdata.sync.exception;

/**
 * Exception thrown when an operation reserved for custom datasets targets a built-in one.
 * Built-in datasets can be disabled through an update but never removed.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class BuiltInDatasetException extends DatasetConfigurationException {

    private final String datasetId;

    public BuiltInDatasetException(String datasetId) {
        super(String.format("Built-in dataset %s cannot be removed; disable sync instead", datasetId));
        this.datasetId = datasetId;
    }

    public String getDatasetId() {
        return datasetId;
    }
}
