package com.openrangelabs.nycdata.sync.exception;

/**
 * A single source record could not be mapped to a local record.
 */
public class RecordTransformException extends RuntimeException {

    public RecordTransformException(String message) {
        super(message);
    }

    public RecordTransformException(String message, Throwable cause) {
        super(message, cause);
    }
}
