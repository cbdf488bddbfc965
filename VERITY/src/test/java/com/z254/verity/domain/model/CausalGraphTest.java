package com.z254.verity.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link CausalGraph} traversal.
 */
class CausalGraphTest {

    @Nested
    @DisplayName("Intervention simulation")
    class InterventionTests {

        @Test
        @DisplayName("should keep the strongest path product per affected signal")
        void strongestPath() {
            CausalGraph graph = chain().edge(edge("d", "a", 0.4)).build();

            InterventionResult result = graph.simulateIntervention("a", 5);

            assertThat(result.getTarget()).isEqualTo("a");
            assertThat(result.getCausalPath()).containsExactly("b", "c", "d");
            assertThat(result.getExpectedEffects()).containsOnlyKeys("b", "c", "d");
            assertThat(result.getExpectedEffects().get("b")).isCloseTo(0.8, within(1e-9));
            assertThat(result.getExpectedEffects().get("c")).isCloseTo(0.72, within(1e-9));
            assertThat(result.getExpectedEffects().get("d")).isCloseTo(0.36, within(1e-9));
            assertThat(result.getTotalEffect()).isCloseTo(1.88, within(1e-9));
        }

        @Test
        @DisplayName("should stop at the depth limit")
        void depthLimit() {
            InterventionResult result = chain().build().simulateIntervention("a", 1);

            assertThat(result.getCausalPath()).containsExactly("b", "c");
            assertThat(result.getExpectedEffects().get("c")).isCloseTo(0.5, within(1e-9));
            assertThat(result.getTotalEffect()).isCloseTo(1.3, within(1e-9));
        }

        @Test
        @DisplayName("should report no effect for a leaf")
        void leaf() {
            InterventionResult result = chain().build().simulateIntervention("d", 5);

            assertThat(result.getExpectedEffects()).isEmpty();
            assertThat(result.getCausalPath()).isEmpty();
            assertThat(result.getTotalEffect()).isZero();
        }
    }

    @Test
    @DisplayName("should list shared ancestors in lexical order")
    void commonCauses() {
        CausalGraph graph = chain().build();

        assertThat(graph.findCommonCauses("b", "c")).containsExactly("a");
        assertThat(graph.findCommonCauses("c", "d")).containsExactly("a", "b");
        assertThat(graph.findCommonCauses("a", "d")).isEmpty();
    }

    /**
     * a -> b (0.8), a -> c (0.5), b -> c (0.9), c -> d (0.5).
     */
    private static CausalGraph.CausalGraphBuilder chain() {
        return CausalGraph.builder()
                .edge(edge("a", "b", 0.8))
                .edge(edge("a", "c", 0.5))
                .edge(edge("b", "c", 0.9))
                .edge(edge("c", "d", 0.5));
    }

    private static CausalEdge edge(String from, String to, double strength) {
        return CausalEdge.builder()
                .from(from)
                .to(to)
                .lag(1)
                .lagDuration(Duration.ofSeconds(15))
                .strength(strength)
                .type(CausalEdge.EdgeType.GRANGER)
                .direction(CausalEdge.Direction.LEADS)
                .build();
    }
}
