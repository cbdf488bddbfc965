package com.z254.verity.causal;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Binary observations fed to the category model.
 */
public record EvidenceFeatures(boolean deployment,
                               boolean metricSpike,
                               boolean logBurst,
                               boolean latencySpike,
                               boolean errorPropagation) {

    public static final String HAS_DEPLOYMENT_EVENT = "has_deployment_event";
    public static final String HAS_METRIC_SPIKE = "has_metric_spike";
    public static final String HAS_LOG_BURST = "has_log_burst";
    public static final String HAS_LATENCY_SPIKE = "has_latency_spike";
    public static final String HAS_ERROR_PROPAGATION = "has_error_propagation";

    public static EvidenceFeatures none() {
        return new EvidenceFeatures(false, false, false, false, false);
    }

    public EvidenceFeatures or(EvidenceFeatures other) {
        return new EvidenceFeatures(
                deployment || other.deployment,
                metricSpike || other.metricSpike,
                logBurst || other.logBurst,
                latencySpike || other.latencySpike,
                errorPropagation || other.errorPropagation);
    }

    /**
     * Features keyed by their likelihood-table names, in table order.
     */
    public Map<String, Boolean> asMap() {
        Map<String, Boolean> map = new LinkedHashMap<>();
        map.put(HAS_DEPLOYMENT_EVENT, deployment);
        map.put(HAS_METRIC_SPIKE, metricSpike);
        map.put(HAS_LOG_BURST, logBurst);
        map.put(HAS_LATENCY_SPIKE, latencySpike);
        map.put(HAS_ERROR_PROPAGATION, errorPropagation);
        return map;
    }
}
