package com.z254.verity.config;

import com.z254.verity.domain.model.AnalysisRequest;
import com.z254.verity.domain.model.RcaCategory;
import com.z254.verity.domain.model.Severity;
import com.z254.verity.exception.InvalidConfigurationException;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Effective settings of one analysis request: configured defaults overlaid with the
 * request's threshold overrides. Immutable and shared by every stage of the request.
 */
@Value
@Builder(toBuilder = true)
public class AnalysisSettings {

    // Fetch
    int concurrencyLimit;
    Duration queryTimeout;
    Duration deadline;
    int maxAttempts;
    Duration initialBackoff;
    Duration maxBackoff;
    double jitter;
    int analysisParallelism;

    // Detection
    double zscoreMultiplier;
    int maxGapSteps;
    int spikeMaxSteps;
    int changepointToleranceSteps;
    double flatSeriesScore;
    int oscillationMinSignChanges;
    double historyFraction;
    VerityProperties.SeverityBands severityBands;

    // Baseline
    int baselineWindow;
    double baselineK;
    int minHistory;
    double seedAlpha;
    int seedMinSamples;

    // Changepoint
    double cusumDrift;
    double cusumThreshold;
    int reanchorPoints;

    // Correlation
    Duration correlationWindow;
    double kindFactor;
    double severityFactor;
    double weightFactor;
    Map<Severity, Integer> severityWeights;

    // Causal
    int maxLag;
    double pValueThreshold;
    double minCausalStrength;
    double rootThreshold;
    int minAlignedPoints;
    double temporalFallbackWeight;
    Duration deploymentLookback;
    double defaultFeatureProbability;
    Map<RcaCategory, Double> priors;
    Map<RcaCategory, Map<String, Double>> likelihoods;

    // Ranking
    double evidenceWeight;
    double causalWeight;
    double topologyWeight;
    int maxHypotheses;
    double weightUpdateAlpha;
    double lowRankThreshold;

    /**
     * Settings built from configuration alone.
     */
    public static AnalysisSettings defaults(VerityProperties properties) {
        return resolve(properties, null);
    }

    /**
     * Overlays {@code overrides} on the configured defaults. Does not validate.
     */
    public static AnalysisSettings resolve(VerityProperties properties, AnalysisRequest.Thresholds overrides) {
        AnalysisRequest.Thresholds o = overrides != null ? overrides : new AnalysisRequest.Thresholds();
        VerityProperties.Fetch fetch = properties.getFetch();
        VerityProperties.Detection detection = properties.getDetection();
        VerityProperties.Baseline baseline = properties.getBaseline();
        VerityProperties.Changepoint changepoint = properties.getChangepoint();
        VerityProperties.Correlation correlation = properties.getCorrelation();
        VerityProperties.Causal causal = properties.getCausal();
        VerityProperties.Ranking ranking = properties.getRanking();

        return AnalysisSettings.builder()
                .concurrencyLimit(pick(o.getConcurrencyLimit(), fetch.getConcurrencyLimit()))
                .queryTimeout(fetch.getQueryTimeout())
                .deadline(fetch.getDeadline())
                .maxAttempts(fetch.getMaxAttempts())
                .initialBackoff(fetch.getInitialBackoff())
                .maxBackoff(fetch.getMaxBackoff())
                .jitter(fetch.getJitter())
                .analysisParallelism(fetch.getAnalysisParallelism())
                .zscoreMultiplier(pick(o.getZscoreMultiplier(), detection.getZscoreMultiplier()))
                .maxGapSteps(detection.getMaxGapSteps())
                .spikeMaxSteps(detection.getSpikeMaxSteps())
                .changepointToleranceSteps(detection.getChangepointToleranceSteps())
                .flatSeriesScore(detection.getFlatSeriesScore())
                .oscillationMinSignChanges(detection.getOscillationMinSignChanges())
                .historyFraction(detection.getHistoryFraction())
                .severityBands(properties.getSeverity())
                .baselineWindow(pick(o.getBaselineWindow(), baseline.getWindow()))
                .baselineK(pick(o.getBaselineK(), baseline.getK()))
                .minHistory(pick(o.getMinHistory(), baseline.getMinHistory()))
                .seedAlpha(baseline.getSeedAlpha())
                .seedMinSamples(baseline.getSeedMinSamples())
                .cusumDrift(pick(o.getCusumDrift(), changepoint.getDrift()))
                .cusumThreshold(pick(o.getCusumThreshold(), changepoint.getThreshold()))
                .reanchorPoints(changepoint.getReanchorPoints())
                .correlationWindow(pick(o.getCorrelationWindow(), correlation.getWindow()))
                .kindFactor(correlation.getKindFactor())
                .severityFactor(correlation.getSeverityFactor())
                .weightFactor(correlation.getWeightFactor())
                .severityWeights(Map.copyOf(correlation.getSeverityWeights()))
                .maxLag(pick(o.getMaxLag(), causal.getMaxLag()))
                .pValueThreshold(causal.getGrangerPValue())
                .minCausalStrength(pick(o.getMinCausalStrength(), causal.getMinStrength()))
                .rootThreshold(pick(o.getRootThreshold(), causal.getRootThreshold()))
                .minAlignedPoints(causal.getMinAlignedPoints())
                .temporalFallbackWeight(causal.getTemporalFallbackWeight())
                .deploymentLookback(causal.getDeploymentLookback())
                .defaultFeatureProbability(causal.getDefaultFeatureProbability())
                .priors(Map.copyOf(causal.getPriors()))
                .likelihoods(Map.copyOf(causal.getLikelihoods()))
                .evidenceWeight(pick(o.getEvidenceWeight(), ranking.getEvidenceWeight()))
                .causalWeight(pick(o.getCausalWeight(), ranking.getCausalWeight()))
                .topologyWeight(pick(o.getTopologyWeight(), ranking.getTopologyWeight()))
                .maxHypotheses(pick(o.getMaxHypotheses(), ranking.getMaxHypotheses()))
                .weightUpdateAlpha(ranking.getWeightUpdateAlpha())
                .lowRankThreshold(ranking.getLowRankThreshold())
                .build();
    }

    /**
     * Returns this instance, or throws listing every violated constraint.
     */
    public AnalysisSettings validate() {
        List<String> violations = new ArrayList<>();
        positive(violations, "concurrencyLimit", concurrencyLimit);
        positive(violations, "maxAttempts", maxAttempts);
        positive(violations, "baselineWindow", baselineWindow);
        positive(violations, "minHistory", minHistory);
        positive(violations, "baselineK", baselineK);
        positive(violations, "zscoreMultiplier", zscoreMultiplier);
        positive(violations, "cusumThreshold", cusumThreshold);
        positive(violations, "maxLag", maxLag);
        positive(violations, "maxHypotheses", maxHypotheses);
        positive(violations, "reanchorPoints", reanchorPoints);
        if (cusumDrift < 0) {
            violations.add("cusumDrift must not be negative, got " + cusumDrift);
        }
        positive(violations, "correlationWindow", correlationWindow, Duration::toMillis);
        positive(violations, "queryTimeout", queryTimeout, Duration::toMillis);
        positive(violations, "deadline", deadline, Duration::toMillis);
        unit(violations, "minCausalStrength", minCausalStrength);
        unit(violations, "rootThreshold", rootThreshold);
        unit(violations, "pValueThreshold", pValueThreshold);
        unit(violations, "defaultFeatureProbability", defaultFeatureProbability);
        if (evidenceWeight < 0 || causalWeight < 0 || topologyWeight < 0) {
            violations.add("ranking weights must not be negative");
        }
        if (!violations.isEmpty()) {
            throw new InvalidConfigurationException(violations);
        }
        return this;
    }

    private static <T> T pick(T override, T fallback) {
        return override != null ? override : fallback;
    }

    private static void positive(List<String> violations, String name, double value) {
        if (!(value > 0)) {
            violations.add(name + " must be positive, got " + value);
        }
    }

    private static <T> void positive(List<String> violations, String name, T value, Function<T, Long> measure) {
        if (value == null || measure.apply(value) <= 0) {
            violations.add(name + " must be positive, got " + value);
        }
    }

    private static void unit(List<String> violations, String name, double value) {
        if (value < 0 || value > 1) {
            violations.add(name + " must be within [0, 1], got " + value);
        }
    }
}
