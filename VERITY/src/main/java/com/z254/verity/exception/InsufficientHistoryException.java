package com.z254.verity.exception;

/**
 * Series is too short to build a baseline; detection is skipped for it.
 */
public class InsufficientHistoryException extends VerityException {

    private final String seriesId;
    private final int available;
    private final int required;

    public InsufficientHistoryException(String seriesId, int available, int required) {
        super("Insufficient history for " + seriesId + ": " + available + " point(s), need " + required);
        this.seriesId = seriesId;
        this.available = available;
        this.required = required;
    }

    public String getSeriesId() {
        return seriesId;
    }

    public int getAvailable() {
        return available;
    }

    public int getRequired() {
        return required;
    }
}
