package com.z254.verity.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Proposed weight deltas, handed to the weight store after a report is built.
 */
@Value
@Builder
public class WeightProposal {
    String tenant;
    Map<SignalType, Double> deltas;
    /** Hypothesis the proposal reinforces */
    String basedOnHypothesis;

    public boolean isEmpty() {
        return deltas == null || deltas.isEmpty();
    }
}
