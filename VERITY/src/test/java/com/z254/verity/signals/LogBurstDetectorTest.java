package com.z254.verity.signals;

import com.z254.verity.config.VerityProperties;
import com.z254.verity.domain.model.LogBurst;
import com.z254.verity.domain.model.LogLine;
import com.z254.verity.domain.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.z254.verity.TestSignals.T0;
import static com.z254.verity.TestSignals.at;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link LogBurstDetector}.
 */
class LogBurstDetectorTest {

    private VerityProperties properties;
    private LogBurstDetector detector;

    @BeforeEach
    void setUp() {
        properties = new VerityProperties();
        detector = new LogBurstDetector(properties);
    }

    @Test
    void detectsBurstAgainstSparseBackground() {
        List<LogLine> lines = new ArrayList<>();
        for (long t : new long[]{0, 20, 40, 60, 80, 120, 140, 160, 180}) {
            lines.add(line(t * 1000));
        }
        for (int i = 0; i < 50; i++) {
            lines.add(line(95_000 + i * 200L));
        }

        List<LogBurst> bursts = detector.detect("logs:error_logs", "checkout", lines);

        assertThat(bursts).hasSize(1);
        LogBurst burst = bursts.get(0);
        assertThat(burst.getLineCount()).isEqualTo(50);
        assertThat(burst.getInterval().start()).isEqualTo(at(95));
        assertThat(burst.getInterval().end()).isEqualTo(at(105));
        assertThat(burst.getBaselineRate()).isCloseTo(59 / 180.0, within(1e-9));
        assertThat(burst.getSeverity()).isEqualTo(Severity.CRITICAL);
        assertThat(burst.getId()).isEqualTo("logs:error_logs@" + at(95).toEpochMilli());
        assertThat(burst.getService()).isEqualTo("checkout");
    }

    @Test
    void ignoresSteadyRate() {
        List<LogLine> lines = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            lines.add(line(i * 1000L));
        }

        assertThat(detector.detect("logs:steady", "checkout", lines)).isEmpty();
    }

    @Test
    void needsAtLeastTwoLines() {
        assertThat(detector.detect("logs:one", "checkout", List.of(line(0)))).isEmpty();
        assertThat(detector.detect("logs:none", "checkout", List.of())).isEmpty();
    }

    @Test
    void respectsConfiguredRatios() {
        List<LogLine> lines = new ArrayList<>();
        for (long t : new long[]{0, 20, 40, 60, 80, 120, 140, 160, 180}) {
            lines.add(line(t * 1000));
        }
        for (int i = 0; i < 50; i++) {
            lines.add(line(95_000 + i * 200L));
        }
        VerityProperties.Logs strict = new VerityProperties.Logs();
        strict.setMediumRatio(20.0);
        strict.setHighRatio(30.0);
        strict.setCriticalRatio(40.0);

        assertThat(detector.detect("logs:error_logs", "checkout", lines, strict)).isEmpty();
    }

    private static LogLine line(long offsetMillis) {
        return new LogLine(T0.plusMillis(offsetMillis), "ERROR upstream reset", Map.of("service", "checkout"));
    }
}
