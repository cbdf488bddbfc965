package com.z254.verity.correlation;

import com.z254.verity.config.VerityProperties;
import com.z254.verity.domain.model.AnomalyEvent;
import com.z254.verity.domain.model.AnomalyGroup;
import com.z254.verity.domain.model.EvidenceSignal;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Collapses repeated anomalies into groups led by their most severe member.
 * <p>
 * Anomalies are swept in onset order. One joins the open group when it is within the
 * dedup window of the group's representative and, when grouping by series, belongs to the
 * same series; otherwise it opens a new group.
 */
@Component
public class AnomalyGrouper {

    private static final Comparator<AnomalyEvent> ONSET_ORDER = Comparator
            .<AnomalyEvent, Instant>comparing(EvidenceSignal::getOnset)
            .thenComparing(AnomalyEvent::getId);

    private final VerityProperties properties;

    public AnomalyGrouper(VerityProperties properties) {
        this.properties = properties;
    }

    public List<AnomalyGroup> group(Collection<AnomalyEvent> anomalies) {
        VerityProperties.Grouping config = properties.getGrouping();
        return group(anomalies, config.getDedupWindow(), config.isBySeries());
    }

    public List<AnomalyGroup> group(Collection<AnomalyEvent> anomalies, Duration window, boolean bySeries) {
        if (anomalies.isEmpty()) {
            return List.of();
        }
        List<AnomalyEvent> sorted = anomalies.stream().sorted(ONSET_ORDER).toList();

        List<AnomalyGroup> groups = new ArrayList<>();
        AnomalyEvent representative = sorted.get(0);
        List<AnomalyEvent> members = new ArrayList<>(List.of(representative));
        for (AnomalyEvent anomaly : sorted.subList(1, sorted.size())) {
            boolean sameSeries = !bySeries || anomaly.getSeriesId().equals(representative.getSeriesId());
            Duration gap = Duration.between(representative.getOnset(), anomaly.getOnset()).abs();
            if (sameSeries && gap.compareTo(window) <= 0) {
                members.add(anomaly);
                if (anomaly.getSeverity().compareTo(representative.getSeverity()) > 0) {
                    representative = anomaly;
                }
            } else {
                groups.add(toGroup(representative, members));
                representative = anomaly;
                members = new ArrayList<>(List.of(anomaly));
            }
        }
        groups.add(toGroup(representative, members));
        return groups;
    }

    private static AnomalyGroup toGroup(AnomalyEvent representative, List<AnomalyEvent> members) {
        return AnomalyGroup.builder()
                .representative(representative)
                .members(members)
                .build();
    }
}
