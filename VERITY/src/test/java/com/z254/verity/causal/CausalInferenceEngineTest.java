package com.z254.verity.causal;

import com.z254.verity.config.AnalysisSettings;
import com.z254.verity.config.VerityProperties;
import com.z254.verity.domain.model.CausalEdge;
import com.z254.verity.domain.model.CausalGraph;
import com.z254.verity.domain.model.EvidenceBundle;
import com.z254.verity.domain.model.EvidenceSignal;
import com.z254.verity.domain.model.RcaCategory;
import com.z254.verity.domain.model.Severity;
import com.z254.verity.domain.model.SignalNode;
import com.z254.verity.domain.model.TimeInterval;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.TreeMap;

import static com.z254.verity.TestSignals.T0;
import static com.z254.verity.TestSignals.anomaly;
import static com.z254.verity.TestSignals.at;
import static com.z254.verity.TestSignals.logBurst;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link CausalInferenceEngine}.
 */
class CausalInferenceEngineTest {

    private CausalInferenceEngine engine;
    private AnalysisSettings settings;

    @BeforeEach
    void setUp() {
        VerityProperties properties = new VerityProperties();
        engine = new CausalInferenceEngine(new GrangerAnalyzer(), new BayesianCategoryModel(), properties);
        settings = AnalysisSettings.defaults(properties);
    }

    @Nested
    @DisplayName("Graph construction")
    class GraphTests {

        @Test
        @DisplayName("should return an empty graph for no bundles")
        void empty() {
            CausalGraph graph = engine.infer(List.of());

            assertThat(graph.isEmpty()).isTrue();
            assertThat(graph.getRoots()).isEmpty();
        }

        @Test
        @DisplayName("should fall back to onset precedence for untestable series")
        void temporalFallback() {
            EvidenceBundle bundle = bundle(
                    anomaly("db_latency", 0, 5, Severity.HIGH),
                    anomaly("api_latency", 10, 15, Severity.HIGH),
                    logBurst("logs:errors", 12, 20, Severity.MEDIUM));

            CausalGraph graph = engine.infer(List.of(bundle));

            assertThat(graph.getNodes()).containsOnlyKeys("api_latency", "db_latency");
            assertThat(graph.getEdges()).singleElement().satisfies(edge -> {
                assertThat(edge.getFrom()).isEqualTo("db_latency");
                assertThat(edge.getTo()).isEqualTo("api_latency");
                assertThat(edge.getType()).isEqualTo(CausalEdge.EdgeType.TEMPORAL);
                assertThat(edge.getStrength()).isEqualTo(0.3);
                assertThat(edge.getSignificance()).isNull();
                assertThat(edge.getLagDuration()).isEqualTo(Duration.ofSeconds(10));
                assertThat(edge.getBundleIds()).containsExactly("b1");
            });
            assertThat(graph.getRoots()).containsExactly("db_latency");
        }

        @Test
        @DisplayName("should add no edge between simultaneous onsets")
        void simultaneousOnsets() {
            EvidenceBundle bundle = bundle(
                    anomaly("a", 0, 5, Severity.HIGH),
                    anomaly("b", 0, 5, Severity.HIGH));

            CausalGraph graph = engine.infer(List.of(bundle));

            assertThat(graph.getEdges()).isEmpty();
            assertThat(graph.getRoots()).containsExactly("a", "b");
        }

        @Test
        @DisplayName("should use Granger tests when aligned series are long enough")
        void grangerEdges() {
            Random random = new Random(42L);
            double[] cause = new double[200];
            double[] effect = new double[200];
            for (int t = 0; t < 200; t++) {
                cause[t] = random.nextGaussian();
                effect[t] = (t > 0 ? 0.8 * cause[t - 1] : 0.0) + 0.1 * random.nextGaussian();
            }
            Map<String, double[]> values = new TreeMap<>();
            values.put("cause", cause);
            values.put("effect", effect);
            AlignedSignals aligned = new AlignedSignals(T0, Duration.ofSeconds(15), values);
            EvidenceBundle bundle = bundle(
                    anomaly("effect", 0, 5, Severity.HIGH),
                    anomaly("cause", 2, 5, Severity.HIGH));

            CausalGraph graph = engine.infer(List.of(bundle), aligned, settings, List.of());

            assertThat(graph.getEdges()).singleElement().satisfies(edge -> {
                assertThat(edge.getFrom()).isEqualTo("cause");
                assertThat(edge.getTo()).isEqualTo("effect");
                assertThat(edge.getType()).isEqualTo(CausalEdge.EdgeType.GRANGER);
                assertThat(edge.getLag()).isEqualTo(1);
                assertThat(edge.getLagDuration()).isEqualTo(Duration.ofSeconds(15));
                assertThat(edge.getDirection()).isEqualTo(CausalEdge.Direction.LEADS);
                assertThat(edge.getSignificance()).isLessThan(0.01);
            });
            assertThat(graph.getRoots()).containsExactly("cause");
        }

        @Test
        @DisplayName("should attach normalized posteriors per bundle and for the graph")
        void posteriors() {
            CausalGraph graph = engine.infer(List.of(bundle(anomaly("a", 0, 5, Severity.HIGH))));

            assertThat(graph.getBundlePosteriors()).containsOnlyKeys("b1");
            double total = graph.getPosterior().values().stream().mapToDouble(Double::doubleValue).sum();
            assertThat(total).isCloseTo(1.0, within(1e-9));
            assertThat(graph.getPosterior()).containsOnlyKeys(RcaCategory.values());
        }
    }

    @Nested
    @DisplayName("Root selection")
    class RootTests {

        private final Map<String, SignalNode> nodes = new TreeMap<>(Map.of(
                "a", new SignalNode("a", "checkout", at(0)),
                "b", new SignalNode("b", "checkout", at(1)),
                "c", new SignalNode("c", "checkout", at(2))));

        @Test
        @DisplayName("should pick the head of a chain")
        void chain() {
            List<CausalEdge> edges = List.of(edge("a", "b", 0.5), edge("b", "c", 0.5));

            assertThat(CausalInferenceEngine.findRoots(nodes, edges, 0.3)).containsExactly("a");
        }

        @Test
        @DisplayName("should pick the earliest member of an unentered cycle")
        void cycle() {
            List<CausalEdge> edges = List.of(edge("b", "a", 0.5), edge("a", "b", 0.5), edge("b", "c", 0.5));

            assertThat(CausalInferenceEngine.findRoots(nodes, edges, 0.3)).containsExactly("a");
        }

        @Test
        @DisplayName("should skip a cycle entered from outside")
        void enteredCycle() {
            List<CausalEdge> edges = List.of(edge("a", "b", 0.5), edge("b", "a", 0.5), edge("c", "a", 0.5));

            assertThat(CausalInferenceEngine.findRoots(nodes, edges, 0.3)).containsExactly("c");
        }

        @Test
        @DisplayName("should ignore edges below the root threshold")
        void weakEdge() {
            List<CausalEdge> edges = List.of(edge("a", "b", 0.2), edge("b", "c", 0.5));

            assertThat(CausalInferenceEngine.findRoots(nodes, edges, 0.3)).containsExactly("a", "b");
        }
    }

    private static EvidenceBundle bundle(EvidenceSignal... signals) {
        EvidenceBundle.EvidenceBundleBuilder builder = EvidenceBundle.builder()
                .id("b1")
                .interval(new TimeInterval(at(0), at(20)))
                .confidence(0.5);
        for (EvidenceSignal signal : signals) {
            builder.signal(signal);
        }
        return builder.build();
    }

    private static CausalEdge edge(String from, String to, double strength) {
        return CausalEdge.builder()
                .from(from)
                .to(to)
                .strength(strength)
                .lagDuration(Duration.ZERO)
                .type(CausalEdge.EdgeType.TEMPORAL)
                .direction(CausalEdge.Direction.LEADS)
                .bundleIds(List.of("b1"))
                .build();
    }
}
