package com.openrangelabs.nycdata.sync.exception;

/**
 * Base exception for dataset configuration operations.
 *
 * <p>Represents errors raised while registering, updating or removing
 * datasets in the registry.
 *
 * @author OpenRange Labs
 * @version 1.0
 * @since 2025-01
 */
public class DatasetConfigurationException extends RuntimeException {

    /**
     * Constructs a new dataset configuration exception with the specified detail message.
     *
     * @param message the detail message
     */
    public DatasetConfigurationException(String message) {
        super(message);
    }

    /**
     * Constructs a new dataset configuration exception with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause
     */
    public DatasetConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
