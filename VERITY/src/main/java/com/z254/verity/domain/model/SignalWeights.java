package com.z254.verity.domain.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Immutable per-request snapshot of adaptive signal-type weights for one tenant.
 */
public final class SignalWeights {

    private final String tenant;
    private final Map<SignalType, Double> weights;

    public SignalWeights(String tenant, Map<SignalType, Double> weights) {
        this.tenant = tenant;
        EnumMap<SignalType, Double> copy = new EnumMap<>(SignalType.class);
        weights.forEach((type, weight) -> copy.put(type, clamp(weight)));
        this.weights = Collections.unmodifiableMap(copy);
    }

    public String getTenant() {
        return tenant;
    }

    public Map<SignalType, Double> asMap() {
        return weights;
    }

    public double weight(SignalType type) {
        return weights.getOrDefault(type, 0.0);
    }

    /**
     * Returns a new snapshot with {@code overrides} replacing the matching entries.
     */
    public SignalWeights withOverrides(Map<SignalType, Double> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            return this;
        }
        EnumMap<SignalType, Double> merged = new EnumMap<>(SignalType.class);
        merged.putAll(weights);
        merged.putAll(overrides);
        return new SignalWeights(tenant, merged);
    }

    private static double clamp(Double value) {
        if (value == null || value.isNaN()) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, value));
    }

    @Override
    public String toString() {
        return "SignalWeights{tenant=" + tenant + ", weights=" + weights + "}";
    }
}
