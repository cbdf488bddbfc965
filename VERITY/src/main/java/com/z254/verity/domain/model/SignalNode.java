package com.z254.verity.domain.model;

import java.time.Instant;

/**
 * Causal graph node: one signal and its earliest evidence onset in the analysis window.
 */
public record SignalNode(String signalId, String service, Instant onset) {
}
