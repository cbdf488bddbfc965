package com.z254.verity.exception;

/**
 * Base class for analysis failures.
 */
public class VerityException extends RuntimeException {

    public VerityException(String message) {
        super(message);
    }

    public VerityException(String message, Throwable cause) {
        super(message, cause);
    }
}
