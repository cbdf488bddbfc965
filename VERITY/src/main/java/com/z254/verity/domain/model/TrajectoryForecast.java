package com.z254.verity.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Linear projection of a series towards a breach threshold.
 */
@Value
@Builder
public class TrajectoryForecast {
    String seriesId;
    String service;
    /** Fitted value at the last sample */
    double currentValue;
    double slopePerSecond;
    double predictedValueAtHorizon;
    /** Seconds until the fit crosses the threshold; null when it moves away from it */
    Double timeToThresholdSeconds;
    double breachThreshold;
    double confidence;
    Severity severity;

    public boolean willBreach(double horizonSeconds) {
        return timeToThresholdSeconds != null && timeToThresholdSeconds <= horizonSeconds;
    }
}
