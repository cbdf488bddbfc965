package com.z254.verity.causal;

import com.z254.verity.config.AnalysisSettings;
import com.z254.verity.config.VerityProperties;
import com.z254.verity.domain.model.CausalEdge;
import com.z254.verity.domain.model.CausalGraph;
import com.z254.verity.domain.model.DeploymentEvent;
import com.z254.verity.domain.model.EvidenceBundle;
import com.z254.verity.domain.model.EvidenceSignal;
import com.z254.verity.domain.model.RcaCategory;
import com.z254.verity.domain.model.SignalNode;
import com.z254.verity.domain.model.SignalType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * Builds the causal graph over metric signals that co-occur in evidence bundles.
 * <p>
 * The graph is constructed in steps:
 * <ul>
 *     <li>Nodes: every metric signal found in a bundle, with its earliest onset</li>
 *     <li>Edges: Granger tests per co-occurring pair, or onset precedence when the series are too short</li>
 *     <li>Posterior: category distribution per bundle and over the whole graph</li>
 *     <li>Roots: one per strongly connected component without a credible parent outside it</li>
 * </ul>
 * Cycles are kept; a feedback loop yields {@link CausalEdge.Direction#MUTUAL} edges and its
 * earliest member becomes the root.
 */
@Slf4j
@Component
public class CausalInferenceEngine {

    private final GrangerAnalyzer grangerAnalyzer;
    private final BayesianCategoryModel categoryModel;
    private final VerityProperties properties;

    public CausalInferenceEngine(GrangerAnalyzer grangerAnalyzer,
                                 BayesianCategoryModel categoryModel,
                                 VerityProperties properties) {
        this.grangerAnalyzer = grangerAnalyzer;
        this.categoryModel = categoryModel;
        this.properties = properties;
    }

    /**
     * Infer with configured defaults, no aligned series and no deployment context.
     */
    public CausalGraph infer(List<EvidenceBundle> bundles) {
        return infer(bundles, AlignedSignals.empty(), AnalysisSettings.defaults(properties), List.of());
    }

    /**
     * Infer the causal graph for {@code bundles}. Returns an empty graph for empty input.
     */
    public CausalGraph infer(List<EvidenceBundle> bundles, AlignedSignals aligned,
                             AnalysisSettings settings, Collection<DeploymentEvent> deployments) {
        if (bundles.isEmpty()) {
            return CausalGraph.empty();
        }

        // Step 1: nodes
        Map<String, SignalNode> nodes = new TreeMap<>();
        for (EvidenceBundle bundle : bundles) {
            for (EvidenceSignal signal : bundle.getSignals()) {
                if (signal.getSignalType() != SignalType.METRICS) {
                    continue;
                }
                nodes.merge(signal.getSignalId(),
                        new SignalNode(signal.getSignalId(), signal.getService(), signal.getOnset()),
                        (a, b) -> b.onset().isBefore(a.onset()) ? b : a);
            }
        }

        // Step 2: edges
        Map<String, EdgeBuilder> edges = new TreeMap<>();
        Map<String, Optional<GrangerResult>> grangerCache = new HashMap<>();
        for (EvidenceBundle bundle : bundles) {
            List<String> members = bundle.signalIds().stream().filter(nodes::containsKey).toList();
            for (int i = 0; i < members.size(); i++) {
                for (int j = i + 1; j < members.size(); j++) {
                    relate(members.get(i), members.get(j), bundle, aligned, settings, grangerCache, edges);
                }
            }
        }
        List<CausalEdge> edgeList = finish(edges);

        // Step 3: posterior
        Map<String, Map<RcaCategory, Double>> bundlePosteriors = new TreeMap<>();
        EvidenceFeatures graphFeatures = EvidenceFeatures.none();
        for (EvidenceBundle bundle : bundles) {
            EvidenceFeatures features = categoryModel.extract(bundle, deployments, settings);
            graphFeatures = graphFeatures.or(features);
            bundlePosteriors.put(bundle.getId(), categoryModel.posterior(features, settings));
        }
        Map<RcaCategory, Double> posterior = categoryModel.posterior(graphFeatures, settings);

        // Step 4: roots
        List<String> roots = findRoots(nodes, edgeList, settings.getRootThreshold());

        log.debug("Causal graph: {} nodes, {} edges, roots={}", nodes.size(), edgeList.size(), roots);
        return CausalGraph.builder()
                .nodes(nodes)
                .edges(edgeList)
                .roots(roots)
                .posterior(posterior)
                .bundlePosteriors(bundlePosteriors)
                .build();
    }

    // ========== Private Helper Methods ==========

    private void relate(String a, String b, EvidenceBundle bundle, AlignedSignals aligned,
                        AnalysisSettings settings, Map<String, Optional<GrangerResult>> cache,
                        Map<String, EdgeBuilder> edges) {
        Optional<double[][]> pair = aligned.pair(a, b);
        boolean testable = pair.isPresent() && pair.get()[0].length >= settings.getMinAlignedPoints();

        if (testable) {
            double[] seriesA = pair.get()[0];
            double[] seriesB = pair.get()[1];
            Optional<GrangerResult> aToB = cache.computeIfAbsent(key(a, b),
                    k -> grangerAnalyzer.test(seriesA, seriesB, settings.getMaxLag()));
            Optional<GrangerResult> bToA = cache.computeIfAbsent(key(b, a),
                    k -> grangerAnalyzer.test(seriesB, seriesA, settings.getMaxLag()));
            aToB.filter(r -> r.isCredible(settings.getPValueThreshold(), settings.getMinCausalStrength()))
                    .ifPresent(r -> granger(edges, a, b, r, aligned.getStep(), bundle));
            bToA.filter(r -> r.isCredible(settings.getPValueThreshold(), settings.getMinCausalStrength()))
                    .ifPresent(r -> granger(edges, b, a, r, aligned.getStep(), bundle));
            return;
        }

        // Too short to test: the earlier onset leads
        double weight = settings.getTemporalFallbackWeight();
        if (weight < settings.getMinCausalStrength()) {
            return;
        }
        Instant onsetA = bundle.onsetOf(a);
        Instant onsetB = bundle.onsetOf(b);
        int order = onsetA.compareTo(onsetB);
        if (order == 0) {
            return;
        }
        String from = order < 0 ? a : b;
        String to = order < 0 ? b : a;
        Duration lead = Duration.between(order < 0 ? onsetA : onsetB, order < 0 ? onsetB : onsetA);
        edges.computeIfAbsent(key(from, to), k -> new EdgeBuilder(from, to))
                .temporal(weight, lead, bundle.getId());
    }

    private static void granger(Map<String, EdgeBuilder> edges, String from, String to,
                                GrangerResult result, Duration step, EvidenceBundle bundle) {
        edges.computeIfAbsent(key(from, to), k -> new EdgeBuilder(from, to))
                .granger(result, step, bundle.getId());
    }

    private static List<CausalEdge> finish(Map<String, EdgeBuilder> edges) {
        List<CausalEdge> result = new ArrayList<>(edges.size());
        for (EdgeBuilder edge : edges.values()) {
            boolean mutual = edges.containsKey(key(edge.to, edge.from));
            result.add(edge.build(mutual ? CausalEdge.Direction.MUTUAL : CausalEdge.Direction.LEADS));
        }
        return result;
    }

    /**
     * Roots of the condensation: for every strongly connected component with no credible
     * edge entering from outside, its member with the earliest onset, then lowest id.
     */
    static List<String> findRoots(Map<String, SignalNode> nodes, List<CausalEdge> edges, double rootThreshold) {
        Map<String, List<String>> adjacency = new TreeMap<>();
        nodes.keySet().forEach(id -> adjacency.put(id, new ArrayList<>()));
        List<CausalEdge> credible = edges.stream()
                .filter(e -> e.getStrength() >= rootThreshold)
                .filter(e -> nodes.containsKey(e.getFrom()) && nodes.containsKey(e.getTo()))
                .toList();
        credible.forEach(e -> adjacency.get(e.getFrom()).add(e.getTo()));
        adjacency.values().forEach(targets -> targets.sort(Comparator.naturalOrder()));

        Map<String, Integer> component = new Tarjan(adjacency).run();

        Set<Integer> entered = new HashSet<>();
        for (CausalEdge edge : credible) {
            int fromComponent = component.get(edge.getFrom());
            int toComponent = component.get(edge.getTo());
            if (fromComponent != toComponent) {
                entered.add(toComponent);
            }
        }

        Comparator<SignalNode> earliest = Comparator.comparing(SignalNode::onset)
                .thenComparing(SignalNode::signalId);
        Map<Integer, SignalNode> representative = new TreeMap<>();
        for (SignalNode node : nodes.values()) {
            int c = component.get(node.signalId());
            if (entered.contains(c)) {
                continue;
            }
            representative.merge(c, node, (a, b) -> earliest.compare(a, b) <= 0 ? a : b);
        }
        return representative.values().stream()
                .sorted(earliest)
                .map(SignalNode::signalId)
                .toList();
    }

    private static String key(String from, String to) {
        return from + "\u0000" + to;
    }

    private static final class EdgeBuilder {
        private final String from;
        private final String to;
        private final Set<String> bundleIds = new TreeSet<>();
        private CausalEdge.EdgeType type;
        private int lag;
        private Duration lagDuration = Duration.ZERO;
        private double strength;
        private Double significance;

        EdgeBuilder(String from, String to) {
            this.from = from;
            this.to = to;
        }

        void granger(GrangerResult result, Duration step, String bundleId) {
            type = CausalEdge.EdgeType.GRANGER;
            lag = result.lag();
            lagDuration = step.multipliedBy(result.lag());
            strength = result.strength();
            significance = result.pValue();
            bundleIds.add(bundleId);
        }

        void temporal(double weight, Duration lead, String bundleId) {
            if (type == null) {
                type = CausalEdge.EdgeType.TEMPORAL;
                strength = weight;
                lagDuration = lead;
            } else if (type == CausalEdge.EdgeType.TEMPORAL && lead.compareTo(lagDuration) < 0) {
                lagDuration = lead;
            }
            bundleIds.add(bundleId);
        }

        CausalEdge build(CausalEdge.Direction direction) {
            return CausalEdge.builder()
                    .from(from)
                    .to(to)
                    .lag(lag)
                    .lagDuration(lagDuration)
                    .strength(strength)
                    .significance(significance)
                    .type(type)
                    .direction(direction)
                    .bundleIds(List.copyOf(bundleIds))
                    .build();
        }
    }

    /**
     * Tarjan's strongly connected components, visiting nodes and successors in lexical order.
     */
    private static final class Tarjan {
        private final Map<String, List<String>> adjacency;
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Map<String, Integer> component = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new HashSet<>();
        private int counter;
        private int components;

        Tarjan(Map<String, List<String>> adjacency) {
            this.adjacency = adjacency;
        }

        Map<String, Integer> run() {
            for (String node : adjacency.keySet()) {
                if (!index.containsKey(node)) {
                    connect(node);
                }
            }
            return component;
        }

        private void connect(String node) {
            index.put(node, counter);
            lowLink.put(node, counter);
            counter++;
            stack.push(node);
            onStack.add(node);

            for (String next : adjacency.get(node)) {
                if (!index.containsKey(next)) {
                    connect(next);
                    lowLink.put(node, Math.min(lowLink.get(node), lowLink.get(next)));
                } else if (onStack.contains(next)) {
                    lowLink.put(node, Math.min(lowLink.get(node), index.get(next)));
                }
            }

            if (lowLink.get(node).equals(index.get(node))) {
                String member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    component.put(member, components);
                } while (!member.equals(node));
                components++;
            }
        }
    }
}
