package com.z254.verity.rca;

import com.z254.verity.config.AnalysisSettings;
import com.z254.verity.config.VerityProperties;
import com.z254.verity.domain.model.CausalGraph;
import com.z254.verity.domain.model.EvidenceBundle;
import com.z254.verity.domain.model.EvidenceSignal;
import com.z254.verity.domain.model.Hypothesis;
import com.z254.verity.domain.model.RcaCategory;
import com.z254.verity.domain.model.Severity;
import com.z254.verity.domain.model.SignalNode;
import com.z254.verity.domain.repository.TopologyProvider;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns causal roots and orphan bundles into ranked hypotheses.
 * <p>
 * Each candidate aggregates:
 * <ul>
 *     <li>Evidence weight: confidence of each bundle containing the root, scaled by the root's
 *     share of that bundle's strongest causal-node evidence</li>
 *     <li>Causal strength: strongest outgoing edge of the root</li>
 *     <li>Topology distance: hops to the target service, when topology is known</li>
 * </ul>
 * {@code rankScore = w1 * evidence + w2 * causal - w3 * hops}. The distance penalty is waived
 * when the causal strength reaches the root threshold. Output is ordered by descending score,
 * then earliest onset, then root id.
 */
@Slf4j
@Component
public class HypothesisRanker {

    static final Comparator<Hypothesis> RANK_ORDER = Comparator
            .comparingDouble(Hypothesis::getRankScore).reversed()
            .thenComparing(Hypothesis::getOnset)
            .thenComparing(Hypothesis::getRootSignal);

    private final VerityProperties properties;

    public HypothesisRanker(VerityProperties properties) {
        this.properties = properties;
    }

    /**
     * Rank with configured weights and no topology.
     */
    public List<Hypothesis> rank(CausalGraph graph, List<EvidenceBundle> bundles) {
        return rank(graph, bundles, AnalysisSettings.defaults(properties), null, null);
    }

    /**
     * Rank hypotheses; {@code topology} may be null, in which case no distance penalty applies.
     */
    public List<Hypothesis> rank(CausalGraph graph, List<EvidenceBundle> bundles, AnalysisSettings settings,
                                 String targetService, TopologyProvider topology) {
        if (bundles.isEmpty() && graph.isEmpty()) {
            return List.of();
        }

        List<Hypothesis> candidates = new ArrayList<>();
        for (String root : graph.getRoots()) {
            SignalNode node = graph.getNodes().get(root);
            List<EvidenceBundle> supporting = bundles.stream()
                    .filter(b -> b.containsSignal(root))
                    .toList();
            candidates.add(build(root, node.service(), node.onset(), supporting, graph,
                    graph.findDownstream(root, settings.getMinCausalStrength()),
                    graph.maxOutgoingStrength(root), true, settings, targetService, topology));
        }

        // Bundles with no metric node still explain something: root them at their earliest signal
        Map<String, List<EvidenceBundle>> orphans = new TreeMap<>();
        Map<String, EvidenceSignal> orphanRoots = new TreeMap<>();
        for (EvidenceBundle bundle : bundles) {
            boolean hasNode = bundle.signalIds().stream().anyMatch(graph.getNodes()::containsKey);
            if (hasNode || bundle.getSignals().isEmpty()) {
                continue;
            }
            EvidenceSignal first = bundle.getSignals().stream()
                    .min(Comparator.comparing(EvidenceSignal::getOnset).thenComparing(EvidenceSignal::getSignalId))
                    .orElseThrow();
            orphans.computeIfAbsent(first.getSignalId(), k -> new ArrayList<>()).add(bundle);
            orphanRoots.merge(first.getSignalId(), first,
                    (a, b) -> b.getOnset().isBefore(a.getOnset()) ? b : a);
        }
        orphans.forEach((signalId, supporting) -> {
            EvidenceSignal first = orphanRoots.get(signalId);
            candidates.add(build(signalId, first.getService(), first.getOnset(), supporting, graph,
                    List.of(), 0.0, false, settings, targetService, topology));
        });

        candidates.sort(RANK_ORDER);
        List<Hypothesis> ranked = new ArrayList<>();
        int limit = Math.min(candidates.size(), settings.getMaxHypotheses());
        for (int i = 0; i < limit; i++) {
            ranked.add(candidates.get(i).toBuilder().rank(i + 1).build());
        }

        log.debug("Ranked {} hypotheses from {} roots and {} orphan groups",
                ranked.size(), graph.getRoots().size(), orphans.size());
        return ranked;
    }

    // ========== Private Helper Methods ==========

    private Hypothesis build(String root, String service, Instant onset, List<EvidenceBundle> supporting,
                             CausalGraph graph, List<String> affected, double causalStrength, boolean causalRoot,
                             AnalysisSettings settings, String targetService, TopologyProvider topology) {
        double evidenceWeight = supporting.stream()
                .mapToDouble(b -> b.getConfidence() * share(b, root, graph, settings))
                .sum();

        Integer hops = null;
        if (topology != null && targetService != null && service != null) {
            OptionalInt distance = topology.distance(service, targetService);
            hops = distance.isPresent() ? distance.getAsInt() : null;
        }
        boolean stronglyLinked = causalStrength >= settings.getRootThreshold();
        double penalty = hops == null || stronglyLinked ? 0.0 : settings.getTopologyWeight() * hops;
        double rankScore = settings.getEvidenceWeight() * evidenceWeight
                + settings.getCausalWeight() * causalStrength
                - penalty;

        Map<RcaCategory, Double> posterior = posteriorFor(supporting, graph);
        RcaCategory category = graph.topCategory(posterior);

        Set<String> evidenceIds = new LinkedHashSet<>();
        supporting.forEach(b -> evidenceIds.addAll(b.eventIds()));

        return Hypothesis.builder()
                .id("hyp@" + root)
                .rootSignal(root)
                .service(service)
                .onset(onset)
                .supportingBundles(supporting.stream().map(EvidenceBundle::getId).toList())
                .evidenceIds(evidenceIds)
                .affectedSignals(affected)
                .evidenceWeight(evidenceWeight)
                .causalStrength(causalStrength)
                .topologyDistance(hops)
                .rankScore(rankScore)
                .category(category)
                .posterior(posterior)
                .causalRoot(causalRoot)
                .summary(String.format("[%s] %s leads %d signal(s) across %d bundle(s)",
                        category.getKey(), root, affected.size(), supporting.size()))
                .build();
    }

    /**
     * Root's strongest severity weight over the strongest among the bundle's causal nodes.
     * Bundles with no causal node belong to their root entirely.
     */
    private static double share(EvidenceBundle bundle, String root, CausalGraph graph, AnalysisSettings settings) {
        double strongest = bundle.getSignals().stream()
                .filter(s -> graph.getNodes().containsKey(s.getSignalId()))
                .mapToDouble(s -> severityWeight(s.getSeverity(), settings))
                .max()
                .orElse(0.0);
        if (strongest <= 0.0) {
            return 1.0;
        }
        double own = bundle.getSignals().stream()
                .filter(s -> s.getSignalId().equals(root))
                .mapToDouble(s -> severityWeight(s.getSeverity(), settings))
                .max()
                .orElse(0.0);
        return Math.min(1.0, own / strongest);
    }

    private static double severityWeight(Severity severity, AnalysisSettings settings) {
        Map<Severity, Integer> table = settings.getSeverityWeights();
        Integer weight = table != null ? table.get(severity) : null;
        return weight != null ? weight : severity.getDefaultWeight();
    }

    /**
     * Posterior of the most confident supporting bundle, or the graph posterior.
     */
    private static Map<RcaCategory, Double> posteriorFor(List<EvidenceBundle> supporting, CausalGraph graph) {
        return supporting.stream()
                .max(Comparator.comparingDouble(EvidenceBundle::getConfidence)
                        .thenComparing(EvidenceBundle::getId, Comparator.reverseOrder()))
                .map(b -> graph.getBundlePosteriors().get(b.getId()))
                .map(p -> (Map<RcaCategory, Double>) new LinkedHashMap<>(p))
                .orElseGet(() -> new LinkedHashMap<>(graph.getPosterior()));
    }
}
