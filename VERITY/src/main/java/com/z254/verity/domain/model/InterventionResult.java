package com.z254.verity.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Expected downstream effect of acting on one signal.
 */
@Value
@Builder
public class InterventionResult {
    String target;
    /** Strongest path product reaching each affected signal, in discovery order */
    @Singular("expectedEffect")
    Map<String, Double> expectedEffects;
    /** Affected signals in breadth-first discovery order */
    @Singular("pathStep")
    List<String> causalPath;
    double totalEffect;
}
