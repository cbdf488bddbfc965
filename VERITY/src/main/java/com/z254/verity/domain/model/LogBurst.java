package com.z254.verity.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Window in which a log selector emitted lines well above its baseline rate.
 */
@Value
@Builder
public class LogBurst implements EvidenceSignal {
    String id;
    String signalId;
    String service;
    TimeInterval interval;
    int lineCount;
    double ratePerSecond;
    double baselineRate;
    double ratio;
    Severity severity;

    @Override
    public EvidenceKind getKind() {
        return EvidenceKind.LOG_BURST;
    }
}
