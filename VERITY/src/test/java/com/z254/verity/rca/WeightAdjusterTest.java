package com.z254.verity.rca;

import com.z254.verity.config.VerityProperties;
import com.z254.verity.domain.model.EvidenceBundle;
import com.z254.verity.domain.model.Hypothesis;
import com.z254.verity.domain.model.Severity;
import com.z254.verity.domain.model.SignalType;
import com.z254.verity.domain.model.SignalWeights;
import com.z254.verity.domain.model.TimeInterval;
import com.z254.verity.domain.model.WeightProposal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.z254.verity.TestSignals.anomaly;
import static com.z254.verity.TestSignals.at;
import static com.z254.verity.TestSignals.logBurst;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link WeightAdjuster}.
 */
class WeightAdjusterTest {

    private WeightAdjuster adjuster;
    private SignalWeights snapshot;
    private List<EvidenceBundle> bundles;

    @BeforeEach
    void setUp() {
        adjuster = new WeightAdjuster();
        snapshot = new SignalWeights("acme", new VerityProperties().getCorrelation().getSignalWeights());
        bundles = List.of(
                EvidenceBundle.builder()
                        .id("b1")
                        .interval(new TimeInterval(at(0), at(10)))
                        .signal(anomaly("db_latency", 0, 4, Severity.HIGH))
                        .signal(logBurst("logs:errors", 2, 10, Severity.HIGH))
                        .confidence(0.6)
                        .build(),
                EvidenceBundle.builder()
                        .id("b2")
                        .interval(new TimeInterval(at(600), at(601)))
                        .signal(anomaly("cpu", 600, 601, Severity.LOW))
                        .confidence(0.2)
                        .build());
    }

    @Test
    void nudgesContributingTypes() {
        Hypothesis top = Hypothesis.builder().id("hyp@db_latency").supportingBundle("b1").build();

        WeightProposal proposal = adjuster.propose(top, bundles, snapshot, 0.2);

        assertThat(proposal.getTenant()).isEqualTo("acme");
        assertThat(proposal.getBasedOnHypothesis()).isEqualTo("hyp@db_latency");
        assertThat(proposal.getDeltas()).containsOnlyKeys(SignalType.METRICS, SignalType.LOGS);
        assertThat(proposal.getDeltas().get(SignalType.METRICS)).isCloseTo(0.14, within(1e-9));
        assertThat(proposal.getDeltas().get(SignalType.LOGS)).isCloseTo(0.13, within(1e-9));
    }

    @Test
    void leavesSnapshotUntouched() {
        Hypothesis top = Hypothesis.builder().id("hyp@db_latency").supportingBundle("b1").build();

        adjuster.propose(top, bundles, snapshot, 0.2);

        assertThat(snapshot.weight(SignalType.METRICS)).isEqualTo(0.30);
    }

    @Test
    void emptyWithoutHypothesis() {
        WeightProposal proposal = adjuster.propose(null, bundles, snapshot, 0.2);

        assertThat(proposal.isEmpty()).isTrue();
        assertThat(proposal.getTenant()).isEqualTo("acme");
    }

    @Test
    void skipsSaturatedWeights() {
        SignalWeights saturated = snapshot.withOverrides(Map.of(SignalType.METRICS, 1.0));
        Hypothesis top = Hypothesis.builder().id("hyp@cpu").supportingBundle("b2").build();

        assertThat(adjuster.propose(top, bundles, saturated, 0.2).isEmpty()).isTrue();
    }
}
