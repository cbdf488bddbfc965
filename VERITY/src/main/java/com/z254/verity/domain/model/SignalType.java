package com.z254.verity.domain.model;

/**
 * Telemetry family a signal belongs to. Adaptive weights are kept per tenant and signal type.
 */
public enum SignalType {
    METRICS,
    LOGS,
    TRACES
}
