package com.z254.verity.exception;

/**
 * Source could not be reached or answered with a server error. Transient; retried.
 */
public class DataSourceUnavailableException extends DataSourceException {

    public DataSourceUnavailableException(String source, String message) {
        super(source, message);
    }

    public DataSourceUnavailableException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
