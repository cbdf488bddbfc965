package com.z254.verity.correlation;

import com.z254.verity.config.AnalysisSettings;
import com.z254.verity.config.VerityProperties;
import com.z254.verity.domain.model.AnomalyEvent;
import com.z254.verity.domain.model.EvidenceBundle;
import com.z254.verity.domain.model.EvidenceSignal;
import com.z254.verity.domain.model.Severity;
import com.z254.verity.domain.model.SignalType;
import com.z254.verity.domain.model.SignalWeights;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static com.z254.verity.TestSignals.anomaly;
import static com.z254.verity.TestSignals.at;
import static com.z254.verity.TestSignals.logBurst;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link EvidenceCorrelator}.
 */
class EvidenceCorrelatorTest {

    private VerityProperties properties;
    private EvidenceCorrelator correlator;
    private AnalysisSettings settings;
    private SignalWeights weights;

    @BeforeEach
    void setUp() {
        properties = new VerityProperties();
        correlator = new EvidenceCorrelator(properties);
        settings = AnalysisSettings.defaults(properties);
        weights = new SignalWeights("acme", properties.getCorrelation().getSignalWeights());
    }

    @Nested
    @DisplayName("Grouping")
    class GroupingTests {

        @Test
        @DisplayName("should group events within the window and split distant ones")
        void groupsByWindow() {
            List<EvidenceSignal> events = List.of(
                    anomaly("latency", 0, 5, Severity.HIGH),
                    anomaly("errors", 30, 40, Severity.MEDIUM),
                    anomaly("cpu", 300, 310, Severity.LOW));

            List<EvidenceBundle> bundles = correlator.correlate(events, Duration.ofSeconds(60));

            assertThat(bundles).hasSize(2);
            assertThat(bundles.get(0).signalIds()).containsExactly("errors", "latency");
            assertThat(bundles.get(0).getId())
                    .isEqualTo("bundle@" + at(0).toEpochMilli() + "-" + at(40).toEpochMilli());
            assertThat(bundles.get(1).signalIds()).containsExactly("cpu");
        }

        @Test
        @DisplayName("should measure the gap from the furthest end seen so far")
        void chainsFromFurthestEnd() {
            List<EvidenceSignal> events = List.of(
                    anomaly("long", 0, 100, Severity.LOW),
                    anomaly("short", 10, 12, Severity.LOW),
                    anomaly("late", 150, 151, Severity.LOW));

            assertThat(correlator.correlate(events, Duration.ofSeconds(60))).hasSize(1);
        }

        @Test
        @DisplayName("should collapse duplicate event ids")
        void collapsesDuplicates() {
            AnomalyEvent event = anomaly("latency", 0, 5, Severity.HIGH);

            List<EvidenceBundle> bundles = correlator.correlate(List.of(event, event), Duration.ofSeconds(60));

            assertThat(bundles).singleElement()
                    .satisfies(b -> assertThat(b.getSignals()).hasSize(1));
        }

        @Test
        @DisplayName("should produce the same bundles regardless of input order")
        void orderIndependent() {
            List<EvidenceSignal> forward = List.of(
                    anomaly("a", 0, 5, Severity.HIGH),
                    logBurst("logs:x", 3, 13, Severity.CRITICAL),
                    anomaly("b", 500, 505, Severity.LOW));
            List<EvidenceSignal> reversed = List.of(forward.get(2), forward.get(1), forward.get(0));

            assertThat(correlator.correlate(reversed, weights, settings))
                    .usingRecursiveComparison()
                    .isEqualTo(correlator.correlate(forward, weights, settings));
        }

        @Test
        @DisplayName("should return no bundles for no events")
        void empty() {
            assertThat(correlator.correlate(List.of(), Duration.ofSeconds(60))).isEmpty();
        }
    }

    @Nested
    @DisplayName("Confidence")
    class ConfidenceTests {

        @Test
        @DisplayName("should blend kind diversity, severity and signal weights")
        void singleMetric() {
            double confidence = correlator.confidence(List.of(anomaly("a", 0, 1, Severity.MEDIUM)), weights, settings);

            // 0.40 * 1/4 + 0.35 * 2/8 + 0.25 * 0.30
            assertThat(confidence).isCloseTo(0.2625, within(1e-9));
        }

        @Test
        @DisplayName("should reward corroborating evidence kinds")
        void metricAndLogs() {
            double confidence = correlator.confidence(List.of(
                    anomaly("a", 0, 1, Severity.CRITICAL),
                    logBurst("logs:x", 0, 10, Severity.HIGH)), weights, settings);

            // 0.40 * 2/4 + 0.35 * 8/8 + 0.25 * (1 - 0.70 * 0.65)
            assertThat(confidence).isCloseTo(0.68625, within(1e-9));
        }

        @Test
        @DisplayName("should follow the adaptive weight snapshot")
        void followsWeights() {
            SignalWeights boosted = weights.withOverrides(Map.of(SignalType.METRICS, 1.0));
            List<AnomalyEvent> members = List.of(anomaly("a", 0, 1, Severity.MEDIUM));

            assertThat(correlator.confidence(members, boosted, settings))
                    .isGreaterThan(correlator.confidence(members, weights, settings));
        }

        @Test
        @DisplayName("should order same-start bundles by descending confidence")
        void bundleOrder() {
            List<EvidenceBundle> bundles = correlator.correlate(List.of(
                    anomaly("a", 0, 1, Severity.LOW),
                    anomaly("b", 1000, 1001, Severity.CRITICAL)), weights, settings);

            assertThat(bundles).extracting(EvidenceBundle::getStart).isSorted();
            assertThat(bundles).allSatisfy(b -> assertThat(b.getConfidence()).isBetween(0.0, 1.0));
        }
    }
}
