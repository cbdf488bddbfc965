package com.z254.verity.domain.model;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * Directed lead/lag relation between two signals.
 */
@Value
@Builder
public class CausalEdge {
    String from;
    String to;
    /** Lag in steps at which the cause best predicts the effect */
    int lag;
    Duration lagDuration;
    /** Normalized reduction in prediction error, in {@code [0, 1]} */
    double strength;
    /** Granger p-value; null for temporal edges */
    Double significance;
    EdgeType type;
    Direction direction;
    /** Bundles in which both endpoints co-occur */
    List<String> bundleIds;

    public enum EdgeType {
        /** Lagged-regression test on aligned series */
        GRANGER,
        /** Onset precedence when series are too short to test */
        TEMPORAL
    }

    public enum Direction {
        /** Only {@code from} leads {@code to} */
        LEADS,
        /** Both directions are credible; a feedback loop */
        MUTUAL
    }
}
