package com.z254.verity.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Structural level shift flagged by the CUSUM detector.
 */
@Value
@Builder
public class ChangepointEvent implements EvidenceSignal {
    String id;
    String seriesId;
    String service;
    Instant timestamp;
    /** Sample index at which the cumulative sum crossed the threshold */
    int index;
    Direction direction;
    /** Absolute shift of the mean, in series units */
    double magnitude;
    /** Value of the cumulative sum at detection */
    double cusumStatistic;
    double valueBefore;
    double valueAfter;
    Severity severity;

    @Override
    public String getSignalId() {
        return seriesId;
    }

    @Override
    public EvidenceKind getKind() {
        return EvidenceKind.CHANGEPOINT;
    }

    @Override
    public TimeInterval getInterval() {
        return TimeInterval.at(timestamp);
    }

    public enum Direction {
        UP,
        DOWN
    }
}
