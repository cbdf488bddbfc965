package com.z254.verity.domain.repository;

import com.z254.verity.domain.model.SignalType;

import java.util.Map;

/**
 * Registry of adaptive signal-type weights per tenant.
 */
public interface WeightStore {

    /**
     * Current weights of a tenant; empty when the tenant has none yet.
     */
    Map<SignalType, Double> getWeights(String tenant);

    /**
     * Apply proposed deltas. Called after an analysis completes, never during one.
     */
    void proposeUpdate(String tenant, Map<SignalType, Double> deltas);
}
