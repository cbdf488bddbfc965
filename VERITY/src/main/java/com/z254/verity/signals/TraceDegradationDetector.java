package com.z254.verity.signals;

import com.z254.verity.config.VerityProperties;
import com.z254.verity.domain.model.Severity;
import com.z254.verity.domain.model.Span;
import com.z254.verity.domain.model.TimeInterval;
import com.z254.verity.domain.model.TraceDegradation;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.stat.descriptive.rank.Percentile;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Scores latency and error degradation per traced service operation.
 * <p>
 * The score adds a p99 term (0.2 / 0.35 / 0.5), an error-rate term (0.1 / 0.25 / 0.4) and
 * an Apdex term (0.05 marginal, 0.1 poor), capped at 1.
 */
@Slf4j
@Component
public class TraceDegradationDetector {

    private final VerityProperties properties;

    public TraceDegradationDetector(VerityProperties properties) {
        this.properties = properties;
    }

    public List<TraceDegradation> detect(List<Span> spans) {
        return detect(spans, properties.getTraces());
    }

    public List<TraceDegradation> detect(List<Span> spans, VerityProperties.Traces config) {
        Map<String, List<Span>> byOperation = new TreeMap<>();
        for (Span span : spans) {
            String key = "traces:" + nullToUnknown(span.getService()) + "::" + nullToUnknown(span.getOperation());
            byOperation.computeIfAbsent(key, k -> new ArrayList<>()).add(span);
        }

        List<TraceDegradation> degradations = new ArrayList<>();
        byOperation.forEach((signalId, group) -> {
            double[] durations = group.stream().mapToDouble(Span::getDurationMs).sorted().toArray();
            long errors = group.stream().filter(Span::isError).count();
            double errorRate = (double) errors / group.size();
            double p99 = percentile(durations, 0.99);
            double apdex = apdex(durations, config.getApdexTargetMs());

            boolean latencyDegraded = p99 >= config.getP99MediumMs();
            boolean errorDegraded = errorRate >= config.getErrorRateThreshold();
            if (!latencyDegraded && !errorDegraded) {
                return;
            }

            Instant start = group.stream().map(Span::getStart).min(Instant::compareTo).orElseThrow();
            Instant end = group.stream()
                    .map(s -> s.getStart().plusMillis(Math.round(s.getDurationMs())))
                    .max(Instant::compareTo)
                    .orElse(start);
            Span first = group.get(0);

            degradations.add(TraceDegradation.builder()
                    .id(signalId + "@" + start.toEpochMilli())
                    .signalId(signalId)
                    .service(first.getService())
                    .operation(first.getOperation())
                    .interval(new TimeInterval(start, end.isBefore(start) ? start : end))
                    .spanCount(group.size())
                    .errorRate(errorRate)
                    .p99Ms(p99)
                    .apdex(apdex)
                    .severity(Severity.fromScore(score(p99, errorRate, apdex, config)))
                    .latencyDegraded(latencyDegraded)
                    .errorDegraded(errorDegraded)
                    .build());
        });

        log.debug("Trace analysis: {} operation(s), {} degraded", byOperation.size(), degradations.size());
        return degradations;
    }

    static double score(double p99, double errorRate, double apdex, VerityProperties.Traces config) {
        double score = 0.0;
        if (p99 >= config.getP99CriticalMs()) {
            score += 0.5;
        } else if (p99 >= config.getP99HighMs()) {
            score += 0.35;
        } else if (p99 >= config.getP99MediumMs()) {
            score += 0.2;
        }

        if (errorRate >= config.getErrorRateCritical()) {
            score += 0.4;
        } else if (errorRate >= config.getErrorRateHigh()) {
            score += 0.25;
        } else if (errorRate >= config.getErrorRateThreshold()) {
            score += 0.1;
        }

        if (apdex < config.getApdexPoor()) {
            score += 0.1;
        } else if (apdex < config.getApdexMarginal()) {
            score += 0.05;
        }
        return Math.min(score, 1.0);
    }

    /**
     * Nearest-rank percentile of sorted values.
     */
    static double percentile(double[] sorted, double quantile) {
        if (sorted.length == 0) {
            return 0.0;
        }
        return new Percentile()
                .withEstimationType(Percentile.EstimationType.R_1)
                .evaluate(sorted, quantile * 100.0);
    }

    static double apdex(double[] durations, double targetMs) {
        if (durations.length == 0) {
            return 1.0;
        }
        long satisfied = Arrays.stream(durations).filter(d -> d <= targetMs).count();
        long tolerating = Arrays.stream(durations).filter(d -> d > targetMs && d <= 4 * targetMs).count();
        return (satisfied + 0.5 * tolerating) / durations.length;
    }

    private static String nullToUnknown(String value) {
        return value == null || value.isBlank() ? "unknown" : value;
    }
}
