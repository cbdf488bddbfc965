package com.z254.verity.domain.model;

import java.time.Instant;

/**
 * A single observation in a time series.
 */
public record Sample(Instant timestamp, double value) {
}
