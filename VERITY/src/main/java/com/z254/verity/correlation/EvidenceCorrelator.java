package com.z254.verity.correlation;

import com.z254.verity.config.AnalysisSettings;
import com.z254.verity.config.VerityProperties;
import com.z254.verity.domain.model.EvidenceBundle;
import com.z254.verity.domain.model.EvidenceKind;
import com.z254.verity.domain.model.EvidenceSignal;
import com.z254.verity.domain.model.Severity;
import com.z254.verity.domain.model.SignalWeights;
import com.z254.verity.domain.model.TimeInterval;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups evidence from every detector into temporally adjacent bundles.
 * <p>
 * Events are swept in onset order; an event joins the open bundle when it starts no later
 * than {@code window} after the bundle's current end, so grouping is transitive. Bundle
 * confidence blends:
 * <ul>
 *     <li>Evidence kind diversity (anomaly, changepoint, log burst, trace degradation)</li>
 *     <li>Highest member severity</li>
 *     <li>Noisy-or of the adaptive weights of the signal types present</li>
 * </ul>
 * Each term is non-decreasing in added evidence, so confidence is monotonic.
 */
@Slf4j
@Component
public class EvidenceCorrelator {

    static final Comparator<EvidenceSignal> EVENT_ORDER = Comparator
            .comparing(EvidenceSignal::getOnset)
            .thenComparing(e -> e.getInterval().end())
            .thenComparing(EvidenceSignal::getId);

    static final Comparator<EvidenceBundle> BUNDLE_ORDER = Comparator
            .comparing(EvidenceBundle::getStart)
            .thenComparing(Comparator.comparingDouble(EvidenceBundle::getConfidence).reversed())
            .thenComparing(EvidenceBundle::getId);

    private final VerityProperties properties;

    public EvidenceCorrelator(VerityProperties properties) {
        this.properties = properties;
    }

    /**
     * Correlate with the configured signal weights.
     */
    public List<EvidenceBundle> correlate(Collection<? extends EvidenceSignal> events, Duration window) {
        AnalysisSettings settings = AnalysisSettings.defaults(properties).toBuilder()
                .correlationWindow(window)
                .build();
        SignalWeights weights = new SignalWeights(null, properties.getCorrelation().getSignalWeights());
        return correlate(events, weights, settings);
    }

    /**
     * Correlate events into bundles sorted by start, then descending confidence, then id.
     */
    public List<EvidenceBundle> correlate(Collection<? extends EvidenceSignal> events,
                                         SignalWeights weights, AnalysisSettings settings) {
        if (events.isEmpty()) {
            return List.of();
        }
        Duration window = settings.getCorrelationWindow();

        // Duplicate ids collapse to the first in event order
        Map<String, EvidenceSignal> unique = new LinkedHashMap<>();
        events.stream().sorted(EVENT_ORDER).forEach(e -> unique.putIfAbsent(e.getId(), e));

        List<List<EvidenceSignal>> groups = new ArrayList<>();
        List<EvidenceSignal> current = new ArrayList<>();
        Instant currentEnd = null;
        for (EvidenceSignal event : unique.values()) {
            if (currentEnd != null && event.getOnset().isAfter(currentEnd.plus(window))) {
                groups.add(current);
                current = new ArrayList<>();
                currentEnd = null;
            }
            current.add(event);
            Instant end = event.getInterval().end();
            currentEnd = currentEnd == null || end.isAfter(currentEnd) ? end : currentEnd;
        }
        groups.add(current);

        List<EvidenceBundle> bundles = new ArrayList<>(groups.size());
        for (List<EvidenceSignal> members : groups) {
            bundles.add(toBundle(members, weights, settings));
        }
        bundles.sort(BUNDLE_ORDER);

        log.debug("Correlated {} events into {} bundles (window={})", unique.size(), bundles.size(), window);
        return bundles;
    }

    /**
     * Confidence of a group of signals in {@code [0, 1]}.
     */
    public double confidence(List<? extends EvidenceSignal> members, SignalWeights weights, AnalysisSettings settings) {
        if (members.isEmpty()) {
            return 0.0;
        }
        // Factor 1: kind diversity
        long kinds = members.stream().map(EvidenceSignal::getKind).distinct().count();
        double kindTerm = (double) kinds / EvidenceKind.values().length;

        // Factor 2: highest severity relative to critical
        Severity maxSeverity = members.stream()
                .map(EvidenceSignal::getSeverity)
                .reduce(Severity.LOW, Severity::max);
        double severityTerm = severityWeight(maxSeverity, settings) / severityWeight(Severity.CRITICAL, settings);

        // Factor 3: noisy-or of adaptive signal-type weights
        double miss = members.stream()
                .map(EvidenceSignal::getSignalType)
                .distinct()
                .mapToDouble(type -> 1.0 - weights.weight(type))
                .reduce(1.0, (a, b) -> a * b);
        double weightTerm = 1.0 - miss;

        double total = settings.getKindFactor() + settings.getSeverityFactor() + settings.getWeightFactor();
        if (total <= 0) {
            return 0.0;
        }
        double blended = (settings.getKindFactor() * kindTerm
                + settings.getSeverityFactor() * severityTerm
                + settings.getWeightFactor() * weightTerm) / total;
        return Math.max(0.0, Math.min(1.0, blended));
    }

    // ========== Private Helper Methods ==========

    private EvidenceBundle toBundle(List<EvidenceSignal> members, SignalWeights weights, AnalysisSettings settings) {
        TimeInterval interval = members.get(0).getInterval();
        for (EvidenceSignal member : members) {
            interval = interval.span(member.getInterval());
        }
        return EvidenceBundle.builder()
                .id("bundle@" + interval.start().toEpochMilli() + "-" + interval.end().toEpochMilli())
                .interval(interval)
                .signals(members)
                .confidence(confidence(members, weights, settings))
                .build();
    }

    private static double severityWeight(Severity severity, AnalysisSettings settings) {
        Map<Severity, Integer> table = settings.getSeverityWeights();
        Integer weight = table != null ? table.get(severity) : null;
        return weight != null ? weight : severity.getDefaultWeight();
    }
}
