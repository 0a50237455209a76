package com.openrangelabs.nycdata.sync.exception;

/**
 * Base exception for failures talking to the external open data source.
 */
public class OpenDataSourceException extends RuntimeException {

    private final String datasetId;

    public OpenDataSourceException(String datasetId, String message) {
        super(message);
        this.datasetId = datasetId;
    }

    public OpenDataSourceException(String datasetId, String message, Throwable cause) {
        super(message, cause);
        this.datasetId = datasetId;
    }

    public String getDatasetId() {
        return datasetId;
    }
}
