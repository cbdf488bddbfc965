package com.z254.verity.exception;

/**
 * Failure reported by a data source connector.
 */
public class DataSourceException extends VerityException {

    private final String source;

    public DataSourceException(String source, String message) {
        super(message);
        this.source = source;
    }

    public DataSourceException(String source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
