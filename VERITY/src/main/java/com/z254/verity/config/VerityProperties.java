package com.z254.verity.config;

import com.z254.verity.domain.model.QueryKind;
import com.z254.verity.domain.model.RcaCategory;
import com.z254.verity.domain.model.Severity;
import com.z254.verity.domain.model.SignalType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Configuration properties for the VERITY analysis pipeline.
 * <p>
 * Provides centralized configuration for:
 * <ul>
 *     <li>Fetch concurrency, timeouts and retry policy</li>
 *     <li>Baseline, anomaly and changepoint detection parameters</li>
 *     <li>Evidence correlation and adaptive signal weights</li>
 *     <li>Causal inference and Bayesian category tables</li>
 *     <li>Hypothesis ranking weights</li>
 *     <li>Trajectory forecasting, degradation and anomaly grouping</li>
 *     <li>Data source connectors and the default query set</li>
 * </ul>
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "verity")
public class VerityProperties {

    @Valid
    private final Fetch fetch = new Fetch();
    @Valid
    private final Detection detection = new Detection();
    @Valid
    private final SeverityBands severity = new SeverityBands();
    @Valid
    private final Baseline baseline = new Baseline();
    @Valid
    private final Changepoint changepoint = new Changepoint();
    @Valid
    private final Correlation correlation = new Correlation();
    @Valid
    private final Causal causal = new Causal();
    @Valid
    private final Ranking ranking = new Ranking();
    @Valid
    private final Logs logs = new Logs();
    @Valid
    private final Traces traces = new Traces();
    @Valid
    private final Forecast forecast = new Forecast();
    @Valid
    private final Grouping grouping = new Grouping();

    /** Configured telemetry backends */
    @Valid
    private List<DataSourceConfig> datasources = new ArrayList<>();

    /** Queries issued when a request names none; {service} is substituted */
    @Valid
    private List<DefaultQuery> defaultQueries = new ArrayList<>(DefaultQuery.defaults());

    /**
     * Fetch layer configuration.
     */
    @Data
    public static class Fetch {
        /** Maximum queries in flight per request */
        @Positive
        private int concurrencyLimit = 8;

        /** Timeout of a single query attempt */
        private Duration queryTimeout = Duration.ofSeconds(10);

        /** Overall deadline of an analysis request */
        private Duration deadline = Duration.ofSeconds(30);

        /** Default query resolution */
        private Duration defaultStep = Duration.ofSeconds(15);

        /** Attempts including the first one */
        @Positive
        private int maxAttempts = 3;

        private Duration initialBackoff = Duration.ofMillis(200);

        private Duration maxBackoff = Duration.ofSeconds(2);

        private double jitter = 0.35;

        /** Parallelism of per-series detection */
        @Positive
        private int analysisParallelism = 4;
    }

    /**
     * Series normalization and anomaly detection.
     */
    @Data
    public static class Detection {
        /** Minimum |z| for a point outside the band to become a candidate */
        private double zscoreMultiplier = 2.0;

        /** Gaps up to this many steps are linearly interpolated */
        private int maxGapSteps = 3;

        /** Longest interval that may still be a spike or drop */
        private int spikeMaxSteps = 3;

        /** Distance in steps between an interval start and a changepoint that confirms a shift */
        private int changepointToleranceSteps = 2;

        /** Score assigned to any deviation from a flat baseline */
        private double flatSeriesScore = 10.0;

        /** Minimum sign changes for an oscillation */
        private int oscillationMinSignChanges = 2;

        /** Fraction of each series used as history when no explicit split exists */
        @DecimalMin("0.1")
        @DecimalMax("0.95")
        private double historyFraction = 0.5;
    }

    /**
     * Minimum |z| per severity band.
     */
    @Data
    public static class SeverityBands {
        private double low = 2.0;
        private double medium = 3.0;
        private double high = 4.0;
        private double critical = 6.0;

        public Severity classify(double absZ) {
            if (absZ >= critical) {
                return Severity.CRITICAL;
            }
            if (absZ >= high) {
                return Severity.HIGH;
            }
            if (absZ >= medium) {
                return Severity.MEDIUM;
            }
            return Severity.LOW;
        }
    }

    /**
     * Baseline band computation.
     */
    @Data
    public static class Baseline {
        /** Upper bound on the leading history samples used for mean and stddev */
        @Positive
        private int window = 60;

        /** Band half-width in standard deviations */
        private double k = 2.5;

        /** Minimum history points before detection runs */
        @Positive
        private int minHistory = 10;

        /** Weight of a stored seed when blending */
        private double seedAlpha = 0.3;

        /** Seeds with fewer samples are ignored */
        private int seedMinSamples = 20;
    }

    /**
     * CUSUM changepoint detection, in standard deviations.
     */
    @Data
    public static class Changepoint {
        private double drift = 0.5;
        private double threshold = 5.0;
        /** Points averaged to re-anchor the target after a detection */
        @Positive
        private int reanchorPoints = 5;
    }

    /**
     * Evidence correlation.
     */
    @Data
    public static class Correlation {
        /** Events within this distance of a bundle join it */
        private Duration window = Duration.ofSeconds(60);

        /** Share of confidence from distinct evidence kinds */
        private double kindFactor = 0.40;

        /** Share of confidence from the strongest severity */
        private double severityFactor = 0.35;

        /** Share of confidence from adaptive signal weights */
        private double weightFactor = 0.25;

        /** Default adaptive weights, used when the store has none for a tenant */
        private Map<SignalType, Double> signalWeights = defaultSignalWeights();

        /** Blend weight per severity band */
        private Map<Severity, Integer> severityWeights = defaultSeverityWeights();

        private static Map<SignalType, Double> defaultSignalWeights() {
            Map<SignalType, Double> weights = new EnumMap<>(SignalType.class);
            weights.put(SignalType.METRICS, 0.30);
            weights.put(SignalType.LOGS, 0.35);
            weights.put(SignalType.TRACES, 0.35);
            return weights;
        }

        private static Map<Severity, Integer> defaultSeverityWeights() {
            Map<Severity, Integer> weights = new EnumMap<>(Severity.class);
            for (Severity severity : Severity.values()) {
                weights.put(severity, severity.getDefaultWeight());
            }
            return weights;
        }
    }

    /**
     * Causal inference: Granger testing, graph roots and Bayesian categories.
     */
    @Data
    public static class Causal {
        @Positive
        private int maxLag = 3;

        private double grangerPValue = 0.05;

        /** Noise floor; weaker edges are dropped */
        private double minStrength = 0.1;

        /** Incoming edges at or above this strength disqualify a root */
        private double rootThreshold = 0.3;

        /** Minimum aligned points for a Granger test */
        private int minAlignedPoints = 8;

        /** Strength of an onset-precedence edge */
        private double temporalFallbackWeight = 0.3;

        /** Deployments this long before a bundle count as evidence */
        private Duration deploymentLookback = Duration.ofSeconds(300);

        /** Hops followed when propagating an intervention from a root */
        @Positive
        private int interventionDepth = 5;

        private double defaultFeatureProbability = 0.5;

        private Map<RcaCategory, Double> priors = defaultPriors();

        /** Per category, probability of each feature being observed */
        private Map<RcaCategory, Map<String, Double>> likelihoods = defaultLikelihoods();

        private static Map<RcaCategory, Double> defaultPriors() {
            Map<RcaCategory, Double> priors = new EnumMap<>(RcaCategory.class);
            priors.put(RcaCategory.DEPLOYMENT, 0.35);
            priors.put(RcaCategory.RESOURCE_EXHAUSTION, 0.20);
            priors.put(RcaCategory.DEPENDENCY_FAILURE, 0.20);
            priors.put(RcaCategory.TRAFFIC_SURGE, 0.10);
            priors.put(RcaCategory.ERROR_PROPAGATION, 0.10);
            priors.put(RcaCategory.UNKNOWN, 0.02);
            return priors;
        }

        private static Map<RcaCategory, Map<String, Double>> defaultLikelihoods() {
            Map<RcaCategory, Map<String, Double>> table = new EnumMap<>(RcaCategory.class);
            table.put(RcaCategory.DEPLOYMENT, row(0.95, 0.70, 0.60, 0.50, 0.40));
            table.put(RcaCategory.RESOURCE_EXHAUSTION, row(0.15, 0.90, 0.50, 0.70, 0.30));
            table.put(RcaCategory.DEPENDENCY_FAILURE, row(0.10, 0.50, 0.70, 0.95, 0.80));
            table.put(RcaCategory.TRAFFIC_SURGE, row(0.05, 0.95, 0.60, 0.60, 0.20));
            table.put(RcaCategory.ERROR_PROPAGATION, row(0.10, 0.60, 0.80, 0.85, 0.99));
            table.put(RcaCategory.UNKNOWN, row(0.05, 0.30, 0.30, 0.30, 0.10));
            return table;
        }

        private static Map<String, Double> row(double deployment, double metricSpike, double logBurst,
                                               double latencySpike, double errorPropagation) {
            Map<String, Double> row = new LinkedHashMap<>();
            row.put("has_deployment_event", deployment);
            row.put("has_metric_spike", metricSpike);
            row.put("has_log_burst", logBurst);
            row.put("has_latency_spike", latencySpike);
            row.put("has_error_propagation", errorPropagation);
            return row;
        }
    }

    /**
     * Hypothesis ranking.
     */
    @Data
    public static class Ranking {
        /** w1: weight of summed bundle confidence, scaled by the root's share of each bundle */
        private double evidenceWeight = 1.0;

        /** w2: weight of max outgoing causal strength */
        private double causalWeight = 1.0;

        /** w3: penalty per topology hop, waived when causal strength reaches the root threshold */
        private double topologyWeight = 0.2;

        @Positive
        private int maxHypotheses = 10;

        /** Smoothing of proposed weight updates */
        private double weightUpdateAlpha = 0.2;

        /** Top rank below this is logged as low confidence */
        private double lowRankThreshold = 0.5;
    }

    /**
     * Log burst detection.
     */
    @Data
    public static class Logs {
        private Duration burstWindow = Duration.ofSeconds(10);
        private double mediumRatio = 2.5;
        private double highRatio = 5.0;
        private double criticalRatio = 10.0;

        /** Templates kept per selector, most severe and most frequent first */
        @Positive
        private int maxPatterns = 100;
    }

    /**
     * Trace degradation scoring.
     */
    @Data
    public static class Traces {
        private double errorRateThreshold = 0.05;
        private double errorRateHigh = 0.10;
        private double errorRateCritical = 0.25;
        private double p99MediumMs = 500.0;
        private double p99HighMs = 2000.0;
        private double p99CriticalMs = 5000.0;
        private double apdexTargetMs = 500.0;
        private double apdexMarginal = 0.7;
        private double apdexPoor = 0.5;
    }

    /**
     * Trajectory forecasting and degradation trend detection.
     */
    @Data
    public static class Forecast {
        /** Minimum points before a trajectory is fitted */
        @Positive
        private int minLength = 8;

        /** Fits explaining less variance than this are discarded */
        private double r2Threshold = 0.2;

        /** Non-breaching forecasts further than this fraction from the threshold are discarded */
        private double ratioThreshold = 0.5;

        /** Time to breach below this is critical, below three times this is high */
        private Duration window = Duration.ofSeconds(300);

        /** How far ahead a breach is predicted */
        private Duration horizon = Duration.ofSeconds(300);

        /** Breach thresholds keyed by a fragment of the query expression */
        private Map<String, Double> thresholds = defaultThresholds();

        /** Minimum points before degradation is assessed */
        @Positive
        private int degradationMinLength = 10;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double emaAlpha = 0.3;

        /** Relative slope below which a series is stable */
        private double minDegradationRate = 0.01;

        private double degradationMedium = 0.1;
        private double degradationHigh = 0.15;
        private double degradationCritical = 0.3;

        private static Map<String, Double> defaultThresholds() {
            Map<String, Double> thresholds = new LinkedHashMap<>();
            thresholds.put("system_memory_usage_bytes", 0.85);
            thresholds.put("system_filesystem_usage_bytes", 0.90);
            thresholds.put("traces_spanmetrics_latency", 2.0);
            thresholds.put("traces_service_graph_request_failed", 0.05);
            return thresholds;
        }
    }

    /**
     * Anomaly deduplication and clustering.
     */
    @Data
    public static class Grouping {
        /** Anomalies of one series closer than this collapse into a group */
        private Duration dedupWindow = Duration.ofSeconds(120);

        /** Only anomalies of the same series are grouped */
        private boolean bySeries = true;

        /** DBSCAN neighbourhood radius over normalized time and value */
        private double clusterEps = 0.1;

        @Positive
        private int clusterMinSamples = 2;
    }

    /**
     * One telemetry backend.
     */
    @Data
    public static class DataSourceConfig {
        @NotBlank
        private String name;

        @NotNull
        private BackendType type;

        @NotBlank
        private String url;

        /** Sent as X-Scope-OrgID; the request tenant is used when blank */
        private String tenantId;

        private Duration timeout = Duration.ofSeconds(10);

        private final CircuitBreaker circuitBreaker = new CircuitBreaker();

        @Data
        public static class CircuitBreaker {
            private boolean enabled = true;
            private int failureRateThreshold = 50;
            private Duration waitDurationInOpenState = Duration.ofSeconds(30);
            private int minimumNumberOfCalls = 10;
            private int slidingWindowSize = 20;
        }
    }

    /**
     * Query issued for a service when the request names no queries.
     */
    @Data
    public static class DefaultQuery {
        @NotBlank
        private String id;
        @NotNull
        private QueryKind kind = QueryKind.METRIC;
        /** Expression with a {service} placeholder */
        @NotBlank
        private String expression;

        public DefaultQuery() {
        }

        public DefaultQuery(String id, QueryKind kind, String expression) {
            this.id = id;
            this.kind = kind;
            this.expression = expression;
        }

        static List<DefaultQuery> defaults() {
            return List.of(
                    new DefaultQuery("request_rate", QueryKind.METRIC,
                            "sum(rate(http_requests_total{service=\"{service}\"}[1m]))"),
                    new DefaultQuery("error_rate", QueryKind.METRIC,
                            "sum(rate(http_requests_total{service=\"{service}\",status=~\"5..\"}[1m]))"),
                    new DefaultQuery("latency_p99", QueryKind.METRIC,
                            "histogram_quantile(0.99, sum by (le) (rate(http_request_duration_seconds_bucket{service=\"{service}\"}[5m])))"),
                    new DefaultQuery("cpu_usage", QueryKind.METRIC,
                            "sum(rate(container_cpu_usage_seconds_total{service=\"{service}\"}[1m]))"),
                    new DefaultQuery("memory_usage", QueryKind.METRIC,
                            "sum(container_memory_working_set_bytes{service=\"{service}\"})"),
                    new DefaultQuery("error_logs", QueryKind.LOG,
                            "{service=\"{service}\"} |~ \"(?i)error|exception|fatal\""),
                    new DefaultQuery("service_traces", QueryKind.TRACE,
                            "{ resource.service.name = \"{service}\" }"));
        }
    }

    /**
     * Supported backends.
     */
    public enum BackendType {
        MIMIR(QueryKind.METRIC),
        VICTORIA_METRICS(QueryKind.METRIC),
        LOKI(QueryKind.LOG),
        TEMPO(QueryKind.TRACE);

        private final QueryKind serves;

        BackendType(QueryKind serves) {
            this.serves = serves;
        }

        public QueryKind getServes() {
            return serves;
        }
    }
}
