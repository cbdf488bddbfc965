package com.z254.verity.domain.repository;

import com.z254.verity.config.VerityProperties;
import com.z254.verity.domain.model.SignalType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory weight registry. A tenant's first update starts from the configured weights.
 * Updates replace the tenant's map atomically so readers
 * always see a complete snapshot.
 */
@Slf4j
@Repository
public class InMemoryWeightStore implements WeightStore {

    private final Map<String, Map<SignalType, Double>> store = new ConcurrentHashMap<>();
    private final Map<SignalType, Double> defaults;

    public InMemoryWeightStore(VerityProperties properties) {
        this.defaults = Map.copyOf(properties.getCorrelation().getSignalWeights());
    }

    @Override
    public Map<SignalType, Double> getWeights(String tenant) {
        Map<SignalType, Double> weights = store.get(tenant);
        return weights != null ? weights : Map.of();
    }

    @Override
    public void proposeUpdate(String tenant, Map<SignalType, Double> deltas) {
        store.compute(tenant, (key, current) -> {
            EnumMap<SignalType, Double> next = new EnumMap<>(SignalType.class);
            next.putAll(current != null ? current : defaults);
            deltas.forEach((type, delta) ->
                    next.merge(type, delta, (a, b) -> clamp(a + b)));
            next.replaceAll((type, value) -> clamp(value));
            return Map.copyOf(next);
        });
        log.debug("Applied weight update for tenant {}: {}", tenant, deltas);
    }

    public void put(String tenant, Map<SignalType, Double> weights) {
        store.put(tenant, Map.copyOf(weights));
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
