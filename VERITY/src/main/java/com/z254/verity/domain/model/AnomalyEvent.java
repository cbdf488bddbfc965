package com.z254.verity.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Statistically anomalous interval of one metric series.
 */
@Value
@Builder
public class AnomalyEvent implements EvidenceSignal {
    String id;
    String seriesId;
    String service;
    TimeInterval interval;
    Severity severity;
    ChangeType changeType;
    /** Max |z-score| in the interval */
    double score;
    /** Value furthest from the baseline mean */
    double peakValue;
    int pointCount;

    @Override
    public String getSignalId() {
        return seriesId;
    }

    @Override
    public EvidenceKind getKind() {
        return EvidenceKind.ANOMALY;
    }
}
