package com.z254.verity.domain.model;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Request to explain what went wrong with a service over a time window.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisRequest {

    @NotBlank
    private String tenant;

    @NotBlank
    private String service;

    @NotNull
    private Instant start;

    @NotNull
    private Instant end;

    /** Query resolution; defaults to the configured step */
    private Duration step;

    /** Overall deadline; defaults to the configured deadline */
    private Duration deadline;

    /** Explicit queries; when empty the default query set for the service is used */
    @Valid
    @Builder.Default
    private List<QuerySpec> queries = new ArrayList<>();

    private Thresholds thresholds;

    @Builder.Default
    private Map<SignalType, Double> weightsOverride = new EnumMap<>(SignalType.class);

    /**
     * Query as supplied by the caller; the time range comes from the request.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class QuerySpec {
        @NotBlank
        private String id;
        @NotNull
        private QueryKind kind;
        @NotBlank
        private String expression;
        /** Data source name; defaults to the first source serving the kind */
        private String source;
        private Integer limit;
    }

    /**
     * Per-request overrides of detection, correlation, causal and ranking settings.
     * Null fields keep the configured defaults.
     */
    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Thresholds {
        private Double zscoreMultiplier;
        private Integer baselineWindow;
        private Double baselineK;
        private Integer minHistory;
        private Double cusumDrift;
        private Double cusumThreshold;
        private Duration correlationWindow;
        private Integer maxLag;
        private Double minCausalStrength;
        private Double rootThreshold;
        private Integer concurrencyLimit;
        private Double evidenceWeight;
        private Double causalWeight;
        private Double topologyWeight;
        private Integer maxHypotheses;
    }
}
