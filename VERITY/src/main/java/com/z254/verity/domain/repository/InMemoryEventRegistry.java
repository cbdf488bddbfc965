package com.z254.verity.domain.repository;

import com.z254.verity.domain.model.DeploymentEvent;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory event registry fed by deployment hooks.
 */
@Repository
public class InMemoryEventRegistry implements EventRegistry {

    private final List<DeploymentEvent> events = new CopyOnWriteArrayList<>();

    public void register(DeploymentEvent event) {
        events.add(event);
    }

    @Override
    public List<DeploymentEvent> inWindow(Instant start, Instant end) {
        return events.stream()
                .filter(e -> !e.getTimestamp().isBefore(start) && !e.getTimestamp().isAfter(end))
                .sorted(Comparator.comparing(DeploymentEvent::getTimestamp))
                .toList();
    }

    public void clear() {
        events.clear();
    }
}
