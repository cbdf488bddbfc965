package com.z254.verity.signals;

import com.z254.verity.config.VerityProperties;
import com.z254.verity.domain.model.LogBurst;
import com.z254.verity.domain.model.LogLine;
import com.z254.verity.domain.model.Severity;
import com.z254.verity.domain.model.TimeInterval;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Finds windows in which a log selector emits lines far above its average rate.
 * <p>
 * Windows start at the first unconsumed line and span {@code burstWindow}. The baseline
 * rate is the line count over the whole observed span.
 */
@Slf4j
@Component
public class LogBurstDetector {

    private final VerityProperties properties;

    public LogBurstDetector(VerityProperties properties) {
        this.properties = properties;
    }

    public List<LogBurst> detect(String signalId, String service, List<LogLine> lines) {
        return detect(signalId, service, lines, properties.getLogs());
    }

    public List<LogBurst> detect(String signalId, String service, List<LogLine> lines, VerityProperties.Logs config) {
        List<Instant> timestamps = lines.stream()
                .map(LogLine::timestamp)
                .sorted(Comparator.naturalOrder())
                .toList();
        if (timestamps.size() < 2) {
            return List.of();
        }

        double totalSeconds = seconds(Duration.between(timestamps.get(0), timestamps.get(timestamps.size() - 1)));
        if (totalSeconds <= 0) {
            return List.of();
        }
        double baselineRate = timestamps.size() / totalSeconds;
        Duration window = config.getBurstWindow();
        double windowSeconds = seconds(window);

        List<LogBurst> bursts = new ArrayList<>();
        int i = 0;
        while (i < timestamps.size()) {
            Instant windowStart = timestamps.get(i);
            Instant windowEnd = windowStart.plus(window);
            int j = i;
            while (j < timestamps.size() && timestamps.get(j).isBefore(windowEnd)) {
                j++;
            }
            int count = j - i;
            double rate = count / windowSeconds;
            double ratio = rate / baselineRate;
            Severity severity = classify(ratio, config);
            if (severity != null) {
                bursts.add(LogBurst.builder()
                        .id(signalId + "@" + windowStart.toEpochMilli())
                        .signalId(signalId)
                        .service(service)
                        .interval(new TimeInterval(windowStart, windowEnd))
                        .lineCount(count)
                        .ratePerSecond(rate)
                        .baselineRate(baselineRate)
                        .ratio(ratio)
                        .severity(severity)
                        .build());
            }
            i = j;
        }

        if (!bursts.isEmpty()) {
            log.debug("Found {} log burst(s) for {} (baseline {}/s)", bursts.size(), signalId, baselineRate);
        }
        return bursts;
    }

    private static Severity classify(double ratio, VerityProperties.Logs config) {
        if (ratio >= config.getCriticalRatio()) {
            return Severity.CRITICAL;
        }
        if (ratio >= config.getHighRatio()) {
            return Severity.HIGH;
        }
        if (ratio >= config.getMediumRatio()) {
            return Severity.MEDIUM;
        }
        return null;
    }

    private static double seconds(Duration duration) {
        return duration.toMillis() / 1000.0;
    }
}
