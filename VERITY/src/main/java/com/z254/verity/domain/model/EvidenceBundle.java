package com.z254.verity.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

/**
 * Temporally grouped evidence treated as one unit of proof.
 */
@Value
@Builder
public class EvidenceBundle {
    String id;
    TimeInterval interval;
    /** Members sorted by onset, then id */
    @Singular
    List<EvidenceSignal> signals;
    double confidence;

    public Instant getStart() {
        return interval.start();
    }

    public Set<EvidenceKind> kinds() {
        Set<EvidenceKind> kinds = EnumSet.noneOf(EvidenceKind.class);
        signals.forEach(s -> kinds.add(s.getKind()));
        return kinds;
    }

    public Set<SignalType> signalTypes() {
        Set<SignalType> types = EnumSet.noneOf(SignalType.class);
        signals.forEach(s -> types.add(s.getSignalType()));
        return types;
    }

    public Severity maxSeverity() {
        return signals.stream()
                .map(EvidenceSignal::getSeverity)
                .reduce(Severity.LOW, Severity::max);
    }

    /**
     * Distinct signal ids present in the bundle, lexically sorted.
     */
    public Set<String> signalIds() {
        return signals.stream()
                .map(EvidenceSignal::getSignalId)
                .collect(Collectors.toCollection(TreeSet::new));
    }

    public List<String> eventIds() {
        return signals.stream().map(EvidenceSignal::getId).toList();
    }

    public boolean containsSignal(String signalId) {
        return signals.stream().anyMatch(s -> s.getSignalId().equals(signalId));
    }

    /**
     * Earliest onset of the given signal inside this bundle, or {@code null} when absent.
     */
    public Instant onsetOf(String signalId) {
        return signals.stream()
                .filter(s -> s.getSignalId().equals(signalId))
                .map(EvidenceSignal::getOnset)
                .min(Instant::compareTo)
                .orElse(null);
    }
}
