package com.z254.verity.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Ranked explanation of an incident rooted at one signal.
 */
@Value
@Builder(toBuilder = true)
public class Hypothesis {
    String id;
    int rank;
    String rootSignal;
    String service;
    Instant onset;
    @Singular
    List<String> supportingBundles;
    /** Anomaly and changepoint ids backing the hypothesis */
    @Singular
    List<String> evidenceIds;
    /** Signals reachable from the root over credible edges */
    @Singular
    List<String> affectedSignals;
    double evidenceWeight;
    double causalStrength;
    /** Hop distance to the target service; null when no topology is supplied */
    Integer topologyDistance;
    double rankScore;
    RcaCategory category;
    @Singular("posteriorEntry")
    Map<RcaCategory, Double> posterior;
    /** False for evidence-only hypotheses built from bundles with no causal node */
    boolean causalRoot;
    String summary;
}
