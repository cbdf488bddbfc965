package com.z254.verity.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Directed weighted graph of signals. Cycles are allowed.
 * <p>
 * Nodes are keyed by signal id; {@link #getRoots()} lists root candidates ordered by
 * earliest onset, then signal id.
 */
@Value
@Builder(toBuilder = true)
public class CausalGraph {

    /** Nodes keyed by signal id, lexically ordered */
    @Singular
    Map<String, SignalNode> nodes;
    @Singular
    List<CausalEdge> edges;
    @Singular
    List<String> roots;
    /** Graph-level category posterior */
    @Singular("posteriorEntry")
    Map<RcaCategory, Double> posterior;
    /** Category posterior per bundle id */
    @Singular
    Map<String, Map<RcaCategory, Double>> bundlePosteriors;

    public static CausalGraph empty() {
        return CausalGraph.builder().build();
    }

    public boolean isEmpty() {
        return nodes.isEmpty();
    }

    public Optional<SignalNode> node(String signalId) {
        return Optional.ofNullable(nodes.get(signalId));
    }

    public List<CausalEdge> outgoing(String signalId) {
        return edges.stream().filter(e -> e.getFrom().equals(signalId)).toList();
    }

    public List<CausalEdge> incoming(String signalId) {
        return edges.stream().filter(e -> e.getTo().equals(signalId)).toList();
    }

    public boolean hasEdge(String from, String to) {
        return edges.stream().anyMatch(e -> e.getFrom().equals(from) && e.getTo().equals(to));
    }

    public double maxOutgoingStrength(String signalId) {
        return outgoing(signalId).stream()
                .mapToDouble(CausalEdge::getStrength)
                .max()
                .orElse(0.0);
    }

    /**
     * Signals reachable from {@code signalId} over edges of at least {@code minStrength},
     * in breadth-first order with lexical order among siblings.
     */
    public List<String> findDownstream(String signalId, double minStrength) {
        Set<String> visited = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(signalId);
        Set<String> seen = new TreeSet<>();
        seen.add(signalId);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            List<String> next = outgoing(current).stream()
                    .filter(e -> e.getStrength() >= minStrength)
                    .map(CausalEdge::getTo)
                    .sorted()
                    .toList();
            for (String target : next) {
                if (seen.add(target)) {
                    visited.add(target);
                    queue.add(target);
                }
            }
        }
        return new ArrayList<>(visited);
    }

    /**
     * Propagate an intervention on {@code target} along outgoing edges.
     * <p>
     * Each affected signal keeps the strongest product of edge strengths over the paths
     * reaching it within {@code maxDepth} hops. Paths back into the target are ignored.
     */
    public InterventionResult simulateIntervention(String target, int maxDepth) {
        Map<String, Double> effects = new LinkedHashMap<>();
        List<String> path = new ArrayList<>();
        Deque<Propagation> queue = new ArrayDeque<>();
        queue.add(new Propagation(target, 1.0, 0));

        while (!queue.isEmpty()) {
            Propagation current = queue.poll();
            if (current.depth() >= maxDepth) {
                continue;
            }
            List<CausalEdge> next = outgoing(current.signalId()).stream()
                    .filter(e -> !e.getTo().equals(target))
                    .sorted(Comparator.comparing(CausalEdge::getTo))
                    .toList();
            for (CausalEdge edge : next) {
                double effect = current.strength() * edge.getStrength();
                if (!effects.containsKey(edge.getTo())) {
                    path.add(edge.getTo());
                }
                effects.merge(edge.getTo(), effect, Math::max);
                queue.add(new Propagation(edge.getTo(), effect, current.depth() + 1));
            }
        }

        return InterventionResult.builder()
                .target(target)
                .expectedEffects(effects)
                .causalPath(path)
                .totalEffect(effects.values().stream().mapToDouble(Double::doubleValue).sum())
                .build();
    }

    /**
     * Signals with a directed path to both {@code a} and {@code b}, lexically sorted.
     */
    public List<String> findCommonCauses(String a, String b) {
        Set<String> common = new TreeSet<>(ancestors(a));
        common.retainAll(ancestors(b));
        return new ArrayList<>(common);
    }

    /**
     * Category with the highest posterior; ties resolve to declaration order.
     */
    public RcaCategory topCategory(Map<RcaCategory, Double> distribution) {
        return distribution.entrySet().stream()
                .max(Comparator.<Map.Entry<RcaCategory, Double>>comparingDouble(Map.Entry::getValue)
                        .thenComparing(Map.Entry::getKey, Comparator.reverseOrder()))
                .map(Map.Entry::getKey)
                .orElse(RcaCategory.UNKNOWN);
    }

    private Set<String> ancestors(String signalId) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>();
        queue.add(signalId);
        while (!queue.isEmpty()) {
            for (CausalEdge edge : incoming(queue.poll())) {
                if (seen.add(edge.getFrom())) {
                    queue.add(edge.getFrom());
                }
            }
        }
        return seen;
    }

    private record Propagation(String signalId, double strength, int depth) {
    }
}
