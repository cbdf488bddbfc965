package com.z254.verity.domain.model;

import java.time.Instant;

/**
 * Common view over anomalies, changepoints, log bursts and trace degradations.
 * <p>
 * {@link #getId()} identifies the individual event and is kept on every downstream entity;
 * {@link #getSignalId()} identifies the underlying signal (series, log selector, trace operation)
 * and becomes a node in the causal graph.
 */
public interface EvidenceSignal {

    String getId();

    String getSignalId();

    String getService();

    EvidenceKind getKind();

    TimeInterval getInterval();

    Severity getSeverity();

    default SignalType getSignalType() {
        return getKind().getSignalType();
    }

    default Instant getOnset() {
        return getInterval().start();
    }
}
