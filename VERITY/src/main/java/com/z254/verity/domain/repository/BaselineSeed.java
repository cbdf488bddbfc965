package com.z254.verity.domain.repository;

import java.time.Instant;

/**
 * Historical baseline statistics persisted for a series.
 */
public record BaselineSeed(double mean, double stddev, int sampleCount, Instant updatedAt) {
}
