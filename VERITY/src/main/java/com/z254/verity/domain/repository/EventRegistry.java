package com.z254.verity.domain.repository;

import com.z254.verity.domain.model.DeploymentEvent;

import java.time.Instant;
import java.util.List;

/**
 * Read-only lookup of deployment and change events used as causal priors.
 */
public interface EventRegistry {

    /**
     * Events with {@code start <= timestamp <= end}, oldest first.
     */
    List<DeploymentEvent> inWindow(Instant start, Instant end);

    /**
     * Events of one service with {@code start <= timestamp <= end}, oldest first.
     */
    default List<DeploymentEvent> forService(String service, Instant start, Instant end) {
        return inWindow(start, end).stream()
                .filter(e -> e.getService().equals(service))
                .toList();
    }
}
