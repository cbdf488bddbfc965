package com.z254.verity.causal;

import com.z254.verity.config.AnalysisSettings;
import com.z254.verity.domain.model.AnomalyEvent;
import com.z254.verity.domain.model.ChangeType;
import com.z254.verity.domain.model.DeploymentEvent;
import com.z254.verity.domain.model.EvidenceBundle;
import com.z254.verity.domain.model.EvidenceKind;
import com.z254.verity.domain.model.EvidenceSignal;
import com.z254.verity.domain.model.RcaCategory;
import com.z254.verity.domain.model.TraceDegradation;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;

/**
 * Naive Bayes scoring of root-cause categories.
 * <p>
 * Each category's prior is multiplied by {@code p} for every observed feature and by
 * {@code 1 - p} for every absent one, using the configured likelihood table; the products are
 * then normalized. Categories are iterated in declaration order so results are reproducible.
 */
@Component
public class BayesianCategoryModel {

    /**
     * Posterior over every category. Falls back to certainty in {@link RcaCategory#UNKNOWN}
     * when every product is zero.
     */
    public Map<RcaCategory, Double> posterior(EvidenceFeatures features, AnalysisSettings settings) {
        Map<RcaCategory, Double> priors = settings.getPriors();
        Map<RcaCategory, Map<String, Double>> likelihoods = settings.getLikelihoods();
        Map<String, Boolean> observed = features.asMap();

        Map<RcaCategory, Double> raw = new EnumMap<>(RcaCategory.class);
        double total = 0.0;
        for (RcaCategory category : RcaCategory.values()) {
            double value = priors.getOrDefault(category, 0.0);
            Map<String, Double> row = likelihoods.getOrDefault(category, Map.of());
            for (Map.Entry<String, Boolean> feature : observed.entrySet()) {
                double p = row.getOrDefault(feature.getKey(), settings.getDefaultFeatureProbability());
                value *= feature.getValue() ? p : 1.0 - p;
            }
            raw.put(category, value);
            total += value;
        }

        Map<RcaCategory, Double> posterior = new EnumMap<>(RcaCategory.class);
        for (RcaCategory category : RcaCategory.values()) {
            if (total > 0) {
                posterior.put(category, raw.get(category) / total);
            } else {
                posterior.put(category, category == RcaCategory.UNKNOWN ? 1.0 : 0.0);
            }
        }
        return posterior;
    }

    /**
     * Features observed in one bundle, with deployments counted from {@code lookback} before
     * the bundle start through its end.
     */
    public EvidenceFeatures extract(EvidenceBundle bundle, Collection<DeploymentEvent> deployments,
                                    AnalysisSettings settings) {
        Instant from = bundle.getStart().minus(settings.getDeploymentLookback());
        Instant to = bundle.getInterval().end();
        boolean deployment = deployments.stream()
                .map(DeploymentEvent::getTimestamp)
                .anyMatch(ts -> !ts.isBefore(from) && !ts.isAfter(to));

        boolean metricSpike = false;
        boolean logBurst = false;
        boolean latencySpike = false;
        boolean errorPropagation = false;
        for (EvidenceSignal signal : bundle.getSignals()) {
            EvidenceKind kind = signal.getKind();
            if (kind == EvidenceKind.ANOMALY || kind == EvidenceKind.CHANGEPOINT) {
                metricSpike = true;
            }
            if (kind == EvidenceKind.LOG_BURST) {
                logBurst = true;
            }
            if (signal instanceof TraceDegradation trace) {
                latencySpike |= trace.isLatencyDegraded();
                errorPropagation |= trace.isErrorDegraded();
            }
            if (signal instanceof AnomalyEvent anomaly && anomaly.getChangeType() != ChangeType.DROP) {
                String id = anomaly.getSeriesId().toLowerCase(Locale.ROOT);
                latencySpike |= id.contains("latency") || id.contains("duration");
                errorPropagation |= id.contains("error");
            }
        }
        return new EvidenceFeatures(deployment, metricSpike, logBurst, latencySpike, errorPropagation);
    }
}
