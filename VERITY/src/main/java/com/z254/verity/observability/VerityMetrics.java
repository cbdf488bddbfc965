package com.z254.verity.observability;

import com.z254.verity.domain.model.FetchErrorKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.Getter;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized metrics for the VERITY service.
 * <p>
 * Provides metrics for:
 * <ul>
 *     <li>Analysis lifecycle (started, completed, failed, latency)</li>
 *     <li>Fetch outcomes per error kind and fallback activations</li>
 *     <li>Ranking output (hypothesis count, top rank score)</li>
 *     <li>Per-series detection skips</li>
 * </ul>
 */
@Component
public class VerityMetrics {

    private final MeterRegistry meterRegistry;

    // Analysis metrics
    @Getter
    private final Counter analysisStarted;
    @Getter
    private final Counter analysisCompleted;
    @Getter
    private final Counter analysisFailed;
    private final Timer analysisLatency;
    private final DistributionSummary hypothesesGenerated;
    private final DistributionSummary topRankScore;

    // Fetch metrics
    @Getter
    private final Counter fetchSucceeded;
    @Getter
    private final Counter fallbackActivations;
    private final Map<FetchErrorKind, Counter> fetchFailuresByKind = new ConcurrentHashMap<>();

    // Detection metrics
    @Getter
    private final Counter seriesSkipped;
    @Getter
    private final Counter partialFailures;

    public VerityMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        // Initialize analysis metrics
        this.analysisStarted = Counter.builder("verity.analysis.started")
                .description("Analyses started")
                .register(meterRegistry);
        this.analysisCompleted = Counter.builder("verity.analysis.completed")
                .description("Analyses completed successfully")
                .register(meterRegistry);
        this.analysisFailed = Counter.builder("verity.analysis.failed")
                .description("Analyses failed")
                .register(meterRegistry);
        this.analysisLatency = Timer.builder("verity.analysis.latency")
                .description("End-to-end analysis latency")
                .publishPercentiles(0.5, 0.75, 0.95, 0.99)
                .register(meterRegistry);
        this.hypothesesGenerated = DistributionSummary.builder("verity.analysis.hypotheses.count")
                .description("Number of hypotheses per analysis")
                .register(meterRegistry);
        this.topRankScore = DistributionSummary.builder("verity.analysis.top_rank_score")
                .description("Rank score of the top hypothesis")
                .publishPercentiles(0.5, 0.75, 0.95)
                .register(meterRegistry);

        // Initialize fetch metrics
        this.fetchSucceeded = Counter.builder("verity.fetch.succeeded")
                .description("Query slots that returned data")
                .register(meterRegistry);
        this.fallbackActivations = Counter.builder("verity.fetch.fallback")
                .description("Empty range results recovered by an instant query")
                .register(meterRegistry);

        // Initialize detection metrics
        this.seriesSkipped = Counter.builder("verity.detection.series_skipped")
                .description("Series skipped for insufficient history")
                .register(meterRegistry);
        this.partialFailures = Counter.builder("verity.analysis.partial_failure")
                .description("Analyses completed with at least one failed slot")
                .register(meterRegistry);
    }

    // ========== Analysis Methods ==========

    public Timer.Sample startAnalysisTimer() {
        analysisStarted.increment();
        return Timer.start(meterRegistry);
    }

    public void recordAnalysisCompleted(Timer.Sample sample, int hypothesesCount, double topScore) {
        sample.stop(analysisLatency);
        analysisCompleted.increment();
        hypothesesGenerated.record(hypothesesCount);
        if (hypothesesCount > 0) {
            topRankScore.record(topScore);
        }
    }

    public void recordAnalysisFailed(Timer.Sample sample, String reason) {
        sample.stop(analysisLatency);
        analysisFailed.increment();
        Counter.builder("verity.analysis.failed.by_reason")
                .tag("reason", reason)
                .register(meterRegistry)
                .increment();
    }

    public void recordPartialFailure() {
        partialFailures.increment();
    }

    // ========== Fetch Methods ==========

    public void recordFetchSuccess(boolean fromFallback) {
        fetchSucceeded.increment();
        if (fromFallback) {
            fallbackActivations.increment();
        }
    }

    public void recordFetchFailure(FetchErrorKind kind) {
        fetchFailuresByKind.computeIfAbsent(kind, k ->
                Counter.builder("verity.fetch.failed")
                        .tag("kind", k.name().toLowerCase())
                        .description("Query slots that failed, by error kind")
                        .register(meterRegistry))
                .increment();
    }

    // ========== Detection Methods ==========

    public void recordSeriesSkipped() {
        seriesSkipped.increment();
    }
}
