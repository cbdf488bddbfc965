package com.z254.verity.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

/**
 * Sustained drift of a series relative to its own magnitude.
 */
@Value
@Builder
public class DegradationSignal {
    String seriesId;
    String service;
    /** |slope| of the smoothed series over the window, relative to its mean magnitude */
    double degradationRate;
    /** Coefficient of variation of the raw values */
    double volatility;
    Trend trend;
    Duration window;
    Severity severity;
    /** Rising faster in the second half of the window than in the first */
    boolean accelerating;

    public enum Trend {
        DEGRADING,
        RECOVERING
    }
}
