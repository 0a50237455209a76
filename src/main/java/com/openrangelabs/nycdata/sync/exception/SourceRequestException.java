package com.openrangelabs.nycdata.sync.exception;

/**
 * The source rejected the request (4xx other than throttling). Retrying will not help.
 */
public class SourceRequestException extends OpenDataSourceException {

    private final int statusCode;

    public SourceRequestException(String datasetId, int statusCode, String message) {
        super(datasetId, message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
