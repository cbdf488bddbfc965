package com.z254.verity.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Latency or error-rate degradation of one traced service operation.
 */
@Value
@Builder
public class TraceDegradation implements EvidenceSignal {
    String id;
    String signalId;
    String service;
    String operation;
    TimeInterval interval;
    int spanCount;
    double errorRate;
    double p99Ms;
    double apdex;
    Severity severity;
    /** p99 at or above the medium latency threshold */
    boolean latencyDegraded;
    /** Error rate at or above the error threshold */
    boolean errorDegraded;

    @Override
    public EvidenceKind getKind() {
        return EvidenceKind.TRACE_DEGRADATION;
    }
}
