package com.z254.verity.domain.model;

/**
 * Kind of evidence that can be grouped into a bundle.
 */
public enum EvidenceKind {
    ANOMALY(SignalType.METRICS),
    CHANGEPOINT(SignalType.METRICS),
    LOG_BURST(SignalType.LOGS),
    TRACE_DEGRADATION(SignalType.TRACES);

    private final SignalType signalType;

    EvidenceKind(SignalType signalType) {
        this.signalType = signalType;
    }

    public SignalType getSignalType() {
        return signalType;
    }
}
