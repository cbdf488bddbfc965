package com.z254.verity.exception;

/**
 * Source rejected the query. Never retried.
 */
public class InvalidQueryException extends DataSourceException {

    public InvalidQueryException(String source, String message) {
        super(source, message);
    }

    public InvalidQueryException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
