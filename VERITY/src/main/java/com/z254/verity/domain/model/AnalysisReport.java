package com.z254.verity.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one analysis request.
 */
@Value
@Builder
public class AnalysisReport {
    String analysisId;
    String tenant;
    String service;
    TimeInterval window;
    @Singular("hypothesis")
    List<Hypothesis> hypotheses;
    @Singular
    List<EvidenceBundle> bundles;
    @Singular
    List<CausalEdge> edges;
    @Singular
    List<String> roots;
    @Singular("posteriorEntry")
    Map<RcaCategory, Double> posterior;
    @Singular
    List<ReportAnnotation> annotations;
    @Singular
    List<FetchError> fetchErrors;
    /** Set when any data source or query slot failed */
    boolean partialFailure;
    WeightProposal weightProposal;
    /** Threshold breaches projected from series trends */
    @Singular
    List<TrajectoryForecast> forecasts;
    @Singular
    List<DegradationSignal> degradations;
    /** Log templates per selector, most severe first */
    @Singular
    List<LogPattern> logPatterns;
    /** Anomalies deduplicated into repeat groups */
    @Singular
    List<AnomalyGroup> anomalyGroups;
    @Singular
    List<AnomalyCluster> anomalyClusters;
    /** Expected downstream effect of acting on each causal root */
    @Singular
    Map<String, InterventionResult> interventions;
    int seriesAnalyzed;
    Instant generatedAt;
    Duration elapsed;

    public Hypothesis topHypothesis() {
        return hypotheses.isEmpty() ? null : hypotheses.get(0);
    }
}
