package com.z254.verity.domain.repository;

import org.springframework.stereotype.Repository;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dependency graph held in memory. Distance is a breadth-first search over the
 * undirected edge set.
 */
@Repository
public class InMemoryTopologyProvider implements TopologyProvider {

    private final Map<String, Set<String>> adjacency = new ConcurrentHashMap<>();

    /**
     * Record that {@code caller} depends on {@code callee}.
     */
    public void addDependency(String caller, String callee) {
        adjacency.computeIfAbsent(caller, k -> ConcurrentHashMap.newKeySet()).add(callee);
        adjacency.computeIfAbsent(callee, k -> ConcurrentHashMap.newKeySet()).add(caller);
    }

    public boolean isEmpty() {
        return adjacency.isEmpty();
    }

    @Override
    public OptionalInt distance(String from, String to) {
        if (from == null || to == null) {
            return OptionalInt.empty();
        }
        if (from.equals(to)) {
            return OptionalInt.of(0);
        }
        if (!adjacency.containsKey(from) || !adjacency.containsKey(to)) {
            return OptionalInt.empty();
        }

        Map<String, Integer> depth = new HashMap<>();
        Deque<String> queue = new ArrayDeque<>();
        depth.put(from, 0);
        queue.add(from);

        while (!queue.isEmpty()) {
            String current = queue.poll();
            for (String next : adjacency.getOrDefault(current, Set.of())) {
                if (!depth.containsKey(next)) {
                    int d = depth.get(current) + 1;
                    if (next.equals(to)) {
                        return OptionalInt.of(d);
                    }
                    depth.put(next, d);
                    queue.add(next);
                }
            }
        }
        return OptionalInt.empty();
    }
}
