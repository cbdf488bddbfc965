package com.z254.verity.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Normal operating band of a series: {@code mean ± k·stddev}.
 */
@Value
@Builder
public class Baseline {
    String seriesId;
    int window;
    int sampleCount;
    double mean;
    double stddev;
    double k;
    double bandLow;
    double bandHigh;
    /** True when blended with a historical seed */
    boolean seeded;

    public boolean isFlat() {
        return stddev == 0.0;
    }

    public boolean isOutsideBand(double value) {
        return value < bandLow || value > bandHigh;
    }

    /**
     * Standard score of {@code value}. A flat baseline yields signed infinity for any
     * deviation and zero for the mean itself.
     */
    public double zScore(double value) {
        double deviation = value - mean;
        if (stddev == 0.0) {
            return deviation == 0.0 ? 0.0 : Math.copySign(Double.POSITIVE_INFINITY, deviation);
        }
        return deviation / stddev;
    }
}
