package com.z254.verity.exception;

public class QueryTimeoutException extends DataSourceException {

    public QueryTimeoutException(String source, String message) {
        super(source, message);
    }

    public QueryTimeoutException(String source, String message, Throwable cause) {
        super(source, message, cause);
    }
}
