package com.z254.verity.domain.model;

/**
 * Root-cause categories scored by the Bayesian model.
 */
public enum RcaCategory {
    DEPLOYMENT("deployment"),
    RESOURCE_EXHAUSTION("resource_exhaustion"),
    DEPENDENCY_FAILURE("dependency_failure"),
    TRAFFIC_SURGE("traffic_surge"),
    ERROR_PROPAGATION("error_propagation"),
    UNKNOWN("unknown");

    private final String key;

    RcaCategory(String key) {
        this.key = key;
    }

    public String getKey() {
        return key;
    }

    public static RcaCategory fromKey(String key) {
        for (RcaCategory category : values()) {
            if (category.key.equalsIgnoreCase(key) || category.name().equalsIgnoreCase(key)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown RCA category: " + key);
    }
}
