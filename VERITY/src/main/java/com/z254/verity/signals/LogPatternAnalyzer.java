package com.z254.verity.signals;

import com.z254.verity.config.VerityProperties;
import com.z254.verity.domain.model.LogLine;
import com.z254.verity.domain.model.LogPattern;
import com.z254.verity.domain.model.Severity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Collapses log lines into templates and scores each template.
 * <p>
 * Variable tokens are masked before grouping:
 * <ul>
 *     <li>UUIDs and ISO timestamps</li>
 *     <li>IPv4 addresses with optional port</li>
 *     <li>Durations such as {@code 350ms}, hex literals and numbers of four or more digits</li>
 * </ul>
 * A template takes the most severe keyword class of any of its lines.
 */
@Slf4j
@Component
public class LogPatternAnalyzer {

    static final String PLACEHOLDER = "<_>";

    private static final Pattern VARIABLE = Pattern.compile(
            "\\b(?:"
                    + "[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}"
                    + "|\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}:\\d{2}(?:\\.\\d+)?(?:Z|[+-]\\d{2}:\\d{2})?"
                    + "|(?:\\d{1,3}\\.){3}\\d{1,3}(?::\\d+)?"
                    + "|\\d+\\.?\\d*(?:ms|s|m|h|us|ns)\\b"
                    + "|0x[0-9a-f]+"
                    + "|\\b\\d{4,}\\b"
                    + ")\\b",
            Pattern.CASE_INSENSITIVE);

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Map<Severity, Pattern> KEYWORDS = keywords();

    private static final int MAX_TEMPLATE_LENGTH = 180;
    private static final int MAX_SAMPLE_LENGTH = 300;
    private static final int MAX_ENTROPY_TOKENS = 500;

    private final VerityProperties properties;

    public LogPatternAnalyzer(VerityProperties properties) {
        this.properties = properties;
    }

    /**
     * Templates of {@code lines}, most severe first, then most frequent, capped at the configured count.
     */
    public List<LogPattern> analyze(String signalId, List<LogLine> lines) {
        Map<String, Accumulator> templates = new LinkedHashMap<>();
        for (LogLine line : lines) {
            if (line.line() == null) {
                continue;
            }
            String template = normalize(line.line());
            templates.computeIfAbsent(template, Accumulator::new).add(line);
        }

        List<LogPattern> patterns = new ArrayList<>(templates.size());
        for (Accumulator accumulator : templates.values()) {
            patterns.add(accumulator.toPattern(signalId));
        }
        patterns.sort(Comparator.comparingInt((LogPattern p) -> p.getSeverity().getDefaultWeight())
                .thenComparingInt(LogPattern::getCount)
                .reversed()
                .thenComparing(LogPattern::getPattern));

        int limit = properties.getLogs().getMaxPatterns();
        if (patterns.size() > limit) {
            log.debug("Keeping {} of {} templates for {}", limit, patterns.size(), signalId);
            return List.copyOf(patterns.subList(0, limit));
        }
        return patterns;
    }

    static String normalize(String line) {
        String masked = VARIABLE.matcher(line).replaceAll(PLACEHOLDER);
        String collapsed = WHITESPACE.matcher(masked).replaceAll(" ").strip();
        return collapsed.length() > MAX_TEMPLATE_LENGTH ? collapsed.substring(0, MAX_TEMPLATE_LENGTH) : collapsed;
    }

    static Severity classify(String line) {
        for (Map.Entry<Severity, Pattern> entry : KEYWORDS.entrySet()) {
            if (entry.getValue().matcher(line).find()) {
                return entry.getKey();
            }
        }
        return Severity.LOW;
    }

    /**
     * Shannon entropy in bits of the token distribution.
     */
    static double entropy(List<String> tokens) {
        if (tokens.isEmpty()) {
            return 0.0;
        }
        Map<String, Integer> counts = new HashMap<>();
        tokens.forEach(t -> counts.merge(t, 1, Integer::sum));
        double total = tokens.size();
        double entropy = 0.0;
        for (int count : counts.values()) {
            double p = count / total;
            entropy -= p * (Math.log(p) / Math.log(2));
        }
        return entropy;
    }

    // ========== Private Helper Methods ==========

    private static Map<Severity, Pattern> keywords() {
        Map<Severity, Pattern> keywords = new LinkedHashMap<>();
        keywords.put(Severity.CRITICAL, Pattern.compile(
                "\\b(fatal|panic|oom|killed|segfault|out of memory)\\b", Pattern.CASE_INSENSITIVE));
        keywords.put(Severity.HIGH, Pattern.compile(
                "\\b(error|err|exception|failed|failure|crash|timeout|unavailable|refused)\\b",
                Pattern.CASE_INSENSITIVE));
        keywords.put(Severity.MEDIUM, Pattern.compile(
                "\\b(warn|warning|slow|retry|retrying|degraded|circuit)\\b", Pattern.CASE_INSENSITIVE));
        return keywords;
    }

    private static final class Accumulator {
        private final String template;
        private final List<String> tokens = new ArrayList<>();
        private int count;
        private Instant first;
        private Instant last;
        private Severity severity = Severity.LOW;
        private String sample;

        Accumulator(String template) {
            this.template = template;
        }

        void add(LogLine line) {
            count++;
            Instant at = line.timestamp();
            first = first == null || at.isBefore(first) ? at : first;
            last = last == null || at.isAfter(last) ? at : last;
            if (sample == null) {
                String raw = line.line();
                sample = raw.length() > MAX_SAMPLE_LENGTH ? raw.substring(0, MAX_SAMPLE_LENGTH) : raw;
            }
            severity = Severity.max(severity, classify(line.line()));
            if (tokens.size() < MAX_ENTROPY_TOKENS && !template.isEmpty()) {
                tokens.addAll(Arrays.asList(template.split(" ")));
            }
        }

        LogPattern toPattern(String signalId) {
            double seconds = Math.max(Duration.between(first, last).toMillis() / 1000.0, 1.0);
            return LogPattern.builder()
                    .signalId(signalId)
                    .pattern(template)
                    .count(count)
                    .firstSeen(first)
                    .lastSeen(last)
                    .ratePerMinute(count / (seconds / 60.0))
                    .entropy(entropy(tokens))
                    .severity(severity)
                    .sample(sample)
                    .build();
        }
    }
}
