package com.z254.verity.correlation;

import com.z254.verity.config.VerityProperties;
import com.z254.verity.domain.model.AnomalyCluster;
import com.z254.verity.domain.model.AnomalyEvent;
import com.z254.verity.domain.model.ChangeType;
import com.z254.verity.domain.model.Severity;
import com.z254.verity.domain.model.TimeInterval;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.z254.verity.TestSignals.at;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link AnomalyClusterer}.
 */
class AnomalyClustererTest {

    private AnomalyClusterer clusterer;

    @BeforeEach
    void setUp() {
        clusterer = new AnomalyClusterer(new VerityProperties());
    }

    @Test
    @DisplayName("should separate dense groups from an isolated anomaly")
    void densityClusters() {
        AnomalyEvent a0 = peak("a", 0, 10.0);
        AnomalyEvent a5 = peak("a", 5, 10.5);
        AnomalyEvent b6 = peak("b", 6, 10.2);
        AnomalyEvent lone = peak("d", 50, 30.0);
        AnomalyEvent c100 = peak("c", 100, 50.0);
        AnomalyEvent c102 = peak("c", 102, 51.0);

        List<AnomalyCluster> clusters = clusterer.cluster(List.of(c102, lone, a5, c100, b6, a0));

        assertThat(clusters).extracting(AnomalyCluster::getSize).containsExactly(3, 2, 1);
        assertThat(clusters).extracting(AnomalyCluster::isNoise).containsExactly(false, false, true);

        AnomalyCluster early = clusters.get(0);
        assertThat(early.getClusterId()).isZero();
        assertThat(early.getMembers()).containsExactlyInAnyOrder(a0, a5, b6);
        assertThat(early.getSeriesIds()).containsExactly("a", "b");
        assertThat(early.getCentroidTimestamp()).isEqualTo(at(0).plusMillis(3667));
        assertThat(early.getCentroidValue()).isCloseTo(10.2333, within(1e-3));

        assertThat(clusters.get(1).getMembers()).containsExactlyInAnyOrder(c100, c102);
        assertThat(clusters.get(2).getClusterId()).isEqualTo(AnomalyCluster.NOISE_ID);
        assertThat(clusters.get(2).getMembers()).containsExactly(lone);
    }

    @Test
    @DisplayName("should report everything as noise when nothing is dense enough")
    void allNoise() {
        List<AnomalyCluster> clusters = clusterer.cluster(
                List.of(peak("a", 0, 1.0), peak("a", 50, 5.0), peak("a", 100, 9.0)), 0.05, 2);

        assertThat(clusters).singleElement().satisfies(cluster -> {
            assertThat(cluster.isNoise()).isTrue();
            assertThat(cluster.getSize()).isEqualTo(3);
        });
    }

    @Test
    @DisplayName("should need at least the minimum sample count")
    void tooFew() {
        assertThat(clusterer.cluster(List.of(peak("a", 0, 1.0)))).isEmpty();
        assertThat(clusterer.cluster(List.of())).isEmpty();
    }

    private static AnomalyEvent peak(String seriesId, long seconds, double value) {
        return AnomalyEvent.builder()
                .id(seriesId + "@" + at(seconds).toEpochMilli())
                .seriesId(seriesId)
                .service("checkout")
                .interval(TimeInterval.at(at(seconds)))
                .severity(Severity.MEDIUM)
                .changeType(ChangeType.SPIKE)
                .score(3.5)
                .peakValue(value)
                .pointCount(1)
                .build();
    }
}
