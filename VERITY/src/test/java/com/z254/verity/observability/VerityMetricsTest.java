package com.z254.verity.observability;

import com.z254.verity.domain.model.FetchErrorKind;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link VerityMetrics}.
 */
class VerityMetricsTest {

    private SimpleMeterRegistry registry;
    private VerityMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new VerityMetrics(registry);
    }

    @Test
    void recordsAnalysisLifecycle() {
        Timer.Sample ok = metrics.startAnalysisTimer();
        metrics.recordAnalysisCompleted(ok, 3, 1.2);
        Timer.Sample failed = metrics.startAnalysisTimer();
        metrics.recordAnalysisFailed(failed, "AllSourcesFailedException");

        assertThat(metrics.getAnalysisStarted().count()).isEqualTo(2.0);
        assertThat(metrics.getAnalysisCompleted().count()).isEqualTo(1.0);
        assertThat(metrics.getAnalysisFailed().count()).isEqualTo(1.0);
        assertThat(registry.get("verity.analysis.latency").timer().count()).isEqualTo(2);
        assertThat(registry.get("verity.analysis.failed.by_reason")
                .tag("reason", "AllSourcesFailedException").counter().count()).isEqualTo(1.0);
        assertThat(registry.get("verity.analysis.hypotheses.count").summary().totalAmount()).isEqualTo(3.0);
    }

    @Test
    void recordsFetchOutcomesByKind() {
        metrics.recordFetchSuccess(false);
        metrics.recordFetchSuccess(true);
        metrics.recordFetchFailure(FetchErrorKind.TIMEOUT);
        metrics.recordFetchFailure(FetchErrorKind.TIMEOUT);
        metrics.recordFetchFailure(FetchErrorKind.NO_DATA);

        assertThat(metrics.getFetchSucceeded().count()).isEqualTo(2.0);
        assertThat(metrics.getFallbackActivations().count()).isEqualTo(1.0);
        assertThat(registry.get("verity.fetch.failed").tag("kind", "timeout").counter().count()).isEqualTo(2.0);
        assertThat(registry.get("verity.fetch.failed").tag("kind", "no_data").counter().count()).isEqualTo(1.0);
    }

    @Test
    void recordsDetectionSkips() {
        metrics.recordSeriesSkipped();
        metrics.recordPartialFailure();

        assertThat(metrics.getSeriesSkipped().count()).isEqualTo(1.0);
        assertThat(metrics.getPartialFailures().count()).isEqualTo(1.0);
    }
}
