package com.openrangelabs.nycdata.sync.exception;

/**
 * Transient source failure (timeout, connection error, 5xx, throttling). Safe to retry.
 */
public class SourceUnavailableException extends OpenDataSourceException {

    public SourceUnavailableException(String datasetId, String message) {
        super(datasetId, message);
    }

    public SourceUnavailableException(String datasetId, String message, Throwable cause) {
        super(datasetId, message, cause);
    }
}
