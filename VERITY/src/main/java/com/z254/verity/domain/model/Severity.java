package com.z254.verity.domain.model;

/**
 * Severity band of a piece of evidence, with the weight used in confidence blending.
 */
public enum Severity {
    LOW(1),
    MEDIUM(2),
    HIGH(4),
    CRITICAL(8);

    private final int defaultWeight;

    Severity(int defaultWeight) {
        this.defaultWeight = defaultWeight;
    }

    public int getDefaultWeight() {
        return defaultWeight;
    }

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    public static Severity max(Severity a, Severity b) {
        return a.compareTo(b) >= 0 ? a : b;
    }

    /**
     * Maps a normalized score in {@code [0, 1]} to a band: 0.75 critical, 0.5 high, 0.25 medium.
     */
    public static Severity fromScore(double score) {
        if (score >= 0.75) {
            return CRITICAL;
        }
        if (score >= 0.5) {
            return HIGH;
        }
        if (score >= 0.25) {
            return MEDIUM;
        }
        return LOW;
    }
}
