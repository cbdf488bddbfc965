package com.z254.verity.analysis;

import com.z254.verity.causal.AlignedSignals;
import com.z254.verity.causal.CausalInferenceEngine;
import com.z254.verity.causal.SignalAligner;
import com.z254.verity.config.AnalysisSettings;
import com.z254.verity.config.VerityProperties;
import com.z254.verity.correlation.AnomalyClusterer;
import com.z254.verity.correlation.AnomalyGrouper;
import com.z254.verity.correlation.EvidenceCorrelator;
import com.z254.verity.detection.AnomalyDetector;
import com.z254.verity.detection.BaselineEngine;
import com.z254.verity.detection.ChangepointDetector;
import com.z254.verity.detection.NormalizedSeries;
import com.z254.verity.detection.SeriesNormalizer;
import com.z254.verity.domain.model.AnalysisReport;
import com.z254.verity.domain.model.AnalysisRequest;
import com.z254.verity.domain.model.AnomalyEvent;
import com.z254.verity.domain.model.Baseline;
import com.z254.verity.domain.model.CausalGraph;
import com.z254.verity.domain.model.ChangepointEvent;
import com.z254.verity.domain.model.DegradationSignal;
import com.z254.verity.domain.model.DeploymentEvent;
import com.z254.verity.domain.model.EvidenceBundle;
import com.z254.verity.domain.model.EvidenceSignal;
import com.z254.verity.domain.model.FetchError;
import com.z254.verity.domain.model.FetchErrorKind;
import com.z254.verity.domain.model.FetchResult;
import com.z254.verity.domain.model.Hypothesis;
import com.z254.verity.domain.model.InterventionResult;
import com.z254.verity.domain.model.LogLine;
import com.z254.verity.domain.model.LogPattern;
import com.z254.verity.domain.model.Query;
import com.z254.verity.domain.model.QueryKind;
import com.z254.verity.domain.model.ReportAnnotation;
import com.z254.verity.domain.model.Sample;
import com.z254.verity.domain.model.SignalType;
import com.z254.verity.domain.model.SignalWeights;
import com.z254.verity.domain.model.Span;
import com.z254.verity.domain.model.TimeInterval;
import com.z254.verity.domain.model.TimeSeries;
import com.z254.verity.domain.model.TrajectoryForecast;
import com.z254.verity.domain.model.WeightProposal;
import com.z254.verity.domain.repository.BaselineSeed;
import com.z254.verity.domain.repository.BaselineStore;
import com.z254.verity.domain.repository.EventRegistry;
import com.z254.verity.domain.repository.TopologyProvider;
import com.z254.verity.domain.repository.WeightStore;
import com.z254.verity.exception.AllSourcesFailedException;
import com.z254.verity.exception.InsufficientHistoryException;
import com.z254.verity.exception.InvalidConfigurationException;
import com.z254.verity.fetch.FetchPolicy;
import com.z254.verity.fetch.Fetcher;
import com.z254.verity.forecast.DegradationAnalyzer;
import com.z254.verity.forecast.TrajectoryForecaster;
import com.z254.verity.health.VerityHealthIndicator;
import com.z254.verity.observability.VerityMetrics;
import com.z254.verity.observability.VerityStructuredLogger;
import com.z254.verity.observability.VerityStructuredLogger.AnalysisEventType;
import com.z254.verity.rca.HypothesisRanker;
import com.z254.verity.rca.WeightAdjuster;
import com.z254.verity.signals.LogBurstDetector;
import com.z254.verity.signals.LogPatternAnalyzer;
import com.z254.verity.signals.TraceDegradationDetector;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Root cause analysis orchestrator.
 * <p>
 * Coordinates the pipeline for one request:
 * <ol>
 *     <li>Resolve and validate settings, snapshot adaptive weights</li>
 *     <li>Fetch metrics, logs and traces under one deadline</li>
 *     <li>Normalize each series, compute its baseline, run CUSUM and anomaly detection</li>
 *     <li>Detect log bursts and trace degradations</li>
 *     <li>Correlate evidence, infer causality and rank hypotheses</li>
 *     <li>Forecast trends, template logs, group anomalies and simulate interventions on roots</li>
 * </ol>
 * Per-series and per-slot failures become report annotations; the request only fails on
 * invalid settings or when no source returned anything.
 */
@Slf4j
@Service
public class AnalysisService {

    private final VerityProperties properties;
    private final Fetcher fetcher;
    private final SeriesNormalizer normalizer;
    private final BaselineEngine baselineEngine;
    private final ChangepointDetector changepointDetector;
    private final AnomalyDetector anomalyDetector;
    private final LogBurstDetector logBurstDetector;
    private final TraceDegradationDetector traceDegradationDetector;
    private final LogPatternAnalyzer logPatternAnalyzer;
    private final TrajectoryForecaster trajectoryForecaster;
    private final DegradationAnalyzer degradationAnalyzer;
    private final EvidenceCorrelator correlator;
    private final AnomalyGrouper anomalyGrouper;
    private final AnomalyClusterer anomalyClusterer;
    private final SignalAligner aligner;
    private final CausalInferenceEngine causalEngine;
    private final HypothesisRanker ranker;
    private final WeightAdjuster weightAdjuster;
    private final WeightStore weightStore;
    private final BaselineStore baselineStore;
    private final EventRegistry eventRegistry;
    private final TopologyProvider topologyProvider;
    private final VerityMetrics metrics;
    private final VerityStructuredLogger logger;
    private final VerityHealthIndicator healthIndicator;

    public AnalysisService(VerityProperties properties,
                           Fetcher fetcher,
                           SeriesNormalizer normalizer,
                           BaselineEngine baselineEngine,
                           ChangepointDetector changepointDetector,
                           AnomalyDetector anomalyDetector,
                           LogBurstDetector logBurstDetector,
                           TraceDegradationDetector traceDegradationDetector,
                           LogPatternAnalyzer logPatternAnalyzer,
                           TrajectoryForecaster trajectoryForecaster,
                           DegradationAnalyzer degradationAnalyzer,
                           EvidenceCorrelator correlator,
                           AnomalyGrouper anomalyGrouper,
                           AnomalyClusterer anomalyClusterer,
                           SignalAligner aligner,
                           CausalInferenceEngine causalEngine,
                           HypothesisRanker ranker,
                           WeightAdjuster weightAdjuster,
                           WeightStore weightStore,
                           BaselineStore baselineStore,
                           EventRegistry eventRegistry,
                           TopologyProvider topologyProvider,
                           VerityMetrics metrics,
                           VerityStructuredLogger logger,
                           VerityHealthIndicator healthIndicator) {
        this.properties = properties;
        this.fetcher = fetcher;
        this.normalizer = normalizer;
        this.baselineEngine = baselineEngine;
        this.changepointDetector = changepointDetector;
        this.anomalyDetector = anomalyDetector;
        this.logBurstDetector = logBurstDetector;
        this.traceDegradationDetector = traceDegradationDetector;
        this.logPatternAnalyzer = logPatternAnalyzer;
        this.trajectoryForecaster = trajectoryForecaster;
        this.degradationAnalyzer = degradationAnalyzer;
        this.correlator = correlator;
        this.anomalyGrouper = anomalyGrouper;
        this.anomalyClusterer = anomalyClusterer;
        this.aligner = aligner;
        this.causalEngine = causalEngine;
        this.ranker = ranker;
        this.weightAdjuster = weightAdjuster;
        this.weightStore = weightStore;
        this.baselineStore = baselineStore;
        this.eventRegistry = eventRegistry;
        this.topologyProvider = topologyProvider;
        this.metrics = metrics;
        this.logger = logger;
        this.healthIndicator = healthIndicator;
    }

    /**
     * Analyze a service over the request window.
     *
     * @return the report; errors with {@link InvalidConfigurationException} before any fetch when
     * the effective settings are unusable, and with {@link AllSourcesFailedException} when no
     * query slot returned data and at least one failed
     */
    public Mono<AnalysisReport> analyze(AnalysisRequest request) {
        return Mono.defer(() -> {
            String analysisId = UUID.randomUUID().toString();
            Instant startedAt = Instant.now();

            // Step 1: settings, validated before anything is fetched
            AnalysisSettings settings = resolveSettings(request);

            // Step 2: one weight snapshot for the whole request
            SignalWeights weights = snapshotWeights(request);

            // Step 3: queries
            List<Query> queries = buildQueries(request, settings);

            Timer.Sample timer = metrics.startAnalysisTimer();
            healthIndicator.incrementActiveAnalyses();
            logEvent(request, analysisId, AnalysisEventType.ANALYSIS_STARTED, "Starting analysis",
                    Map.of("queries", queries.size(),
                            "windowSeconds", Duration.between(request.getStart(), request.getEnd()).toSeconds()));

            return fetchAll(queries, settings)
                    .doOnNext(fetched -> logger.logPerformance("fetch", fetched.elapsed(),
                            Map.of("analysisId", analysisId, "queries", queries.size())))
                    .flatMap(fetched -> {
                        requireAnyData(fetched);
                        List<TimeSeries> series = metricSeries(fetched);
                        return analyzeSeries(request, settings, series)
                                .map(outcomes -> buildReport(request, analysisId, startedAt, settings,
                                        weights, fetched, series, outcomes));
                    })
                    .doOnSuccess(report -> completed(request, report, settings, timer))
                    .doOnError(error -> failed(request, analysisId, timer, error))
                    .doFinally(signal -> healthIndicator.decrementActiveAnalyses());
        });
    }

    // ========== Private Helper Methods ==========

    private AnalysisSettings resolveSettings(AnalysisRequest request) {
        List<String> violations = new ArrayList<>();
        if (request.getStart() == null || request.getEnd() == null) {
            violations.add("start and end are required");
        } else if (!request.getEnd().isAfter(request.getStart())) {
            violations.add("end must be after start, got [" + request.getStart() + ", " + request.getEnd() + "]");
        }
        if (request.getStep() != null && (request.getStep().isNegative() || request.getStep().isZero())) {
            violations.add("step must be positive, got " + request.getStep());
        }
        if (!violations.isEmpty()) {
            throw new InvalidConfigurationException(violations);
        }

        AnalysisSettings settings = AnalysisSettings.resolve(properties, request.getThresholds());
        if (request.getDeadline() != null) {
            settings = settings.toBuilder().deadline(request.getDeadline()).build();
        }
        return settings.validate();
    }

    private SignalWeights snapshotWeights(AnalysisRequest request) {
        Map<SignalType, Double> base = new EnumMap<>(SignalType.class);
        base.putAll(properties.getCorrelation().getSignalWeights());
        base.putAll(weightStore.getWeights(request.getTenant()));
        return new SignalWeights(request.getTenant(), base).withOverrides(request.getWeightsOverride());
    }

    private List<Query> buildQueries(AnalysisRequest request, AnalysisSettings settings) {
        Duration step = request.getStep() != null ? request.getStep() : properties.getFetch().getDefaultStep();
        List<Query> queries = new ArrayList<>();
        if (request.getQueries() != null && !request.getQueries().isEmpty()) {
            for (AnalysisRequest.QuerySpec spec : request.getQueries()) {
                queries.add(query(request, step, spec.getId(), spec.getKind(), spec.getExpression(),
                        spec.getSource(), spec.getLimit()));
            }
        } else {
            for (VerityProperties.DefaultQuery template : properties.getDefaultQueries()) {
                String expression = template.getExpression().replace("{service}", request.getService());
                queries.add(query(request, step, template.getId(), template.getKind(), expression, null, null));
            }
        }
        return queries;
    }

    private Query query(AnalysisRequest request, Duration step, String id, QueryKind kind,
                        String expression, String source, Integer limit) {
        return Query.builder()
                .id(id)
                .kind(kind)
                .expression(expression)
                .source(source)
                .tenant(request.getTenant())
                .service(request.getService())
                .start(request.getStart())
                .end(request.getEnd())
                .step(step)
                .limit(limit)
                .build();
    }

    private Mono<Fetched> fetchAll(List<Query> queries, AnalysisSettings settings) {
        FetchPolicy policy = FetchPolicy.from(settings);
        List<Query> metricQueries = ofKind(queries, QueryKind.METRIC);
        List<Query> logQueries = ofKind(queries, QueryKind.LOG);
        List<Query> traceQueries = ofKind(queries, QueryKind.TRACE);

        Instant fetchStart = Instant.now();
        return Mono.zip(
                        fetcher.fetchMetrics(metricQueries, policy),
                        fetcher.fetchLogs(logQueries, policy),
                        fetcher.fetchTraces(traceQueries, policy))
                .map(t -> new Fetched(t.getT1(), t.getT2(), t.getT3(),
                        Duration.between(fetchStart, Instant.now())));
    }

    private static List<Query> ofKind(List<Query> queries, QueryKind kind) {
        return queries.stream().filter(q -> q.getKind() == kind).toList();
    }

    /**
     * Fails when no slot returned data and at least one slot failed at the source.
     */
    private void requireAnyData(Fetched fetched) {
        List<FetchError> sourceErrors = fetched.allSlots().stream()
                .filter(slot -> !slot.isSuccess())
                .map(FetchResult::getError)
                .toList();
        if (!fetched.hasAnyData() && sourceErrors.stream().anyMatch(FetchError::isSourceFailure)) {
            throw new AllSourcesFailedException(sourceErrors);
        }
    }

    private static List<TimeSeries> metricSeries(Fetched fetched) {
        return fetched.metrics().stream()
                .flatMap(slot -> slot.getData().stream())
                .filter(s -> !s.isEmpty())
                .sorted(Comparator.comparing(TimeSeries::getId))
                .toList();
    }

    private AnalysisReport buildReport(AnalysisRequest request, String analysisId, Instant startedAt,
                                       AnalysisSettings settings, SignalWeights weights, Fetched fetched,
                                       List<TimeSeries> series, List<SeriesOutcome> outcomes) {
        // Step 4: slot bookkeeping
        List<FetchError> errors = new ArrayList<>();
        List<ReportAnnotation> annotations = new ArrayList<>();
        boolean deadlineHit = fetched.elapsed().compareTo(settings.getDeadline()) >= 0;
        for (FetchResult<?> slot : fetched.allSlots()) {
            recordSlot(slot, errors, annotations, deadlineHit);
        }
        boolean partialFailure = errors.stream().anyMatch(FetchError::isSourceFailure);
        if (partialFailure) {
            metrics.recordPartialFailure();
            logEvent(request, analysisId, AnalysisEventType.FETCH_DEGRADED, "Some query slots failed",
                    Map.of("failedSlots", errors.size(), "totalSlots", fetched.allSlots().size()));
        }

        // Step 5: per-series results, already joined by series id
        List<EvidenceSignal> evidence = new ArrayList<>();
        List<AnomalyEvent> anomalies = new ArrayList<>();
        List<TrajectoryForecast> forecasts = new ArrayList<>();
        List<DegradationSignal> degradations = new ArrayList<>();
        for (SeriesOutcome outcome : outcomes) {
            evidence.addAll(outcome.changepoints());
            evidence.addAll(outcome.anomalies());
            anomalies.addAll(outcome.anomalies());
            outcome.forecast().ifPresent(forecasts::add);
            outcome.degradation().ifPresent(degradations::add);
            annotations.addAll(outcome.annotations());
            if (outcome.skipped()) {
                metrics.recordSeriesSkipped();
                logEvent(request, analysisId, AnalysisEventType.SERIES_SKIPPED, "Series skipped",
                        Map.of("seriesId", outcome.seriesId()));
            }
        }

        // Step 6: log bursts, log templates and trace degradations
        List<LogPattern> logPatterns = new ArrayList<>();
        for (FetchResult<LogLine> slot : fetched.logs()) {
            if (slot.isSuccess() && !slot.getData().isEmpty()) {
                String signalId = "logs:" + slot.getQuery().getId();
                evidence.addAll(logBurstDetector.detect(signalId, request.getService(), slot.getData(),
                        properties.getLogs()));
                logPatterns.addAll(logPatternAnalyzer.analyze(signalId, slot.getData()));
            }
        }
        List<Span> spans = fetched.traces().stream()
                .filter(FetchResult::isSuccess)
                .flatMap(slot -> slot.getData().stream())
                .toList();
        evidence.addAll(traceDegradationDetector.detect(spans, properties.getTraces()));

        // Step 7: correlate, infer, rank
        List<EvidenceBundle> bundles = correlator.correlate(evidence, weights, settings);
        Duration step = request.getStep() != null ? request.getStep() : properties.getFetch().getDefaultStep();
        AlignedSignals aligned = aligner.align(series, request.getStart(), request.getEnd(), step);
        List<DeploymentEvent> deployments = eventRegistry.forService(request.getService(),
                request.getStart().minus(settings.getDeploymentLookback()), request.getEnd());
        CausalGraph graph = causalEngine.infer(bundles, aligned, settings, deployments);
        List<Hypothesis> hypotheses = ranker.rank(graph, bundles, settings, request.getService(), topologyProvider);

        WeightProposal proposal = weightAdjuster.propose(hypotheses.isEmpty() ? null : hypotheses.get(0),
                bundles, weights, settings.getWeightUpdateAlpha());

        Map<String, InterventionResult> interventions = new LinkedHashMap<>();
        for (String root : graph.getRoots()) {
            interventions.put(root, graph.simulateIntervention(root, properties.getCausal().getInterventionDepth()));
        }

        // Step 8: report
        Instant generatedAt = Instant.now();
        return AnalysisReport.builder()
                .analysisId(analysisId)
                .tenant(request.getTenant())
                .service(request.getService())
                .window(new TimeInterval(request.getStart(), request.getEnd()))
                .hypotheses(hypotheses)
                .bundles(bundles)
                .edges(graph.getEdges())
                .roots(graph.getRoots())
                .posterior(graph.getPosterior())
                .annotations(annotations)
                .fetchErrors(errors)
                .partialFailure(partialFailure)
                .weightProposal(proposal)
                .forecasts(forecasts)
                .degradations(degradations)
                .logPatterns(logPatterns)
                .anomalyGroups(anomalyGrouper.group(anomalies))
                .anomalyClusters(anomalyClusterer.cluster(anomalies))
                .interventions(interventions)
                .seriesAnalyzed((int) outcomes.stream().filter(o -> !o.skipped()).count())
                .generatedAt(generatedAt)
                .elapsed(Duration.between(startedAt, generatedAt))
                .build();
    }

    private void recordSlot(FetchResult<?> slot, List<FetchError> errors,
                            List<ReportAnnotation> annotations, boolean deadlineHit) {
        String queryId = slot.getQuery().getId();
        if (slot.isSuccess()) {
            metrics.recordFetchSuccess(slot.isFromFallback());
            if (slot.isFromFallback()) {
                annotations.add(annotation(ReportAnnotation.Type.FALLBACK_USED, queryId,
                        "Range query returned nothing; instant query used"));
            }
            return;
        }

        FetchError error = slot.getError();
        errors.add(error);
        metrics.recordFetchFailure(error.getKind());
        if (error.getKind() == FetchErrorKind.NO_DATA) {
            annotations.add(annotation(ReportAnnotation.Type.NO_DATA, queryId, error.getMessage()));
        } else if (error.getKind() == FetchErrorKind.TIMEOUT && deadlineHit) {
            annotations.add(annotation(ReportAnnotation.Type.DEADLINE_EXCEEDED, queryId, error.getMessage()));
        } else {
            annotations.add(annotation(ReportAnnotation.Type.FETCH_FAILED, queryId,
                    error.getKind() + ": " + error.getMessage()));
        }
    }

    /**
     * Detection per series on the parallel scheduler; results are joined in series id order.
     */
    private Mono<List<SeriesOutcome>> analyzeSeries(AnalysisRequest request, AnalysisSettings settings,
                                                    List<TimeSeries> series) {
        if (series.isEmpty()) {
            return Mono.just(List.of());
        }
        return Flux.fromIterable(series)
                .parallel(Math.max(1, settings.getAnalysisParallelism()))
                .runOn(Schedulers.parallel())
                .map(s -> analyzeOne(request, settings, s))
                .sequential()
                .collectSortedList(Comparator.comparing(SeriesOutcome::seriesId));
    }

    private SeriesOutcome analyzeOne(AnalysisRequest request, AnalysisSettings settings, TimeSeries series) {
        List<ReportAnnotation> annotations = new ArrayList<>();
        NormalizedSeries normalized = normalizer.normalize(series,
                properties.getFetch().getDefaultStep(), settings.getMaxGapSteps());
        if (normalized.isDiscontinuous()) {
            annotations.add(annotation(ReportAnnotation.Type.DISCONTINUOUS_SERIES, series.getId(),
                    normalized.getSegments().size() + " segments after gap splitting"));
        }

        try {
            Baseline baseline = referenceBaseline(request, settings, series, normalized.allSamples());

            List<ChangepointEvent> changepoints = new ArrayList<>();
            for (List<Sample> segment : normalized.getSegments()) {
                changepoints.addAll(changepointDetector.detect(series.getId(), series.getService(), segment,
                        baseline.getMean(), baseline.getStddev(), settings.getCusumDrift(),
                        settings.getCusumThreshold(), settings.getReanchorPoints()));
            }
            List<AnomalyEvent> anomalies = anomalyDetector.detect(normalized, baseline, changepoints, settings);
            return new SeriesOutcome(series.getId(), anomalies, changepoints, annotations,
                    trajectoryForecaster.forecast(series), degradationAnalyzer.analyze(series), false);
        } catch (InsufficientHistoryException e) {
            annotations.add(annotation(ReportAnnotation.Type.INSUFFICIENT_HISTORY, series.getId(), e.getMessage()));
            return new SeriesOutcome(series.getId(), List.of(), List.of(), annotations,
                    Optional.empty(), Optional.empty(), true);
        }
    }

    /**
     * Baseline from the leading history window. A changepoint inside that window would seed
     * the band with shifted data, so the window is cut before the first one for as long as
     * the remainder still holds the minimum history.
     */
    private Baseline referenceBaseline(AnalysisRequest request, AnalysisSettings settings, TimeSeries series,
                                       List<Sample> samples) {
        int historySize = Math.min(samples.size(), Math.max(settings.getMinHistory(),
                (int) Math.floor(samples.size() * settings.getHistoryFraction())));
        List<Sample> history = samples.subList(0, Math.min(historySize, settings.getBaselineWindow()));
        Optional<BaselineSeed> seed = baselineStore.find(request.getTenant(), series.getId());
        Baseline baseline = baselineEngine.computeBaseline(series.getId(), history, settings, seed);

        while (true) {
            List<ChangepointEvent> shifts = changepointDetector.detect(series.getId(), series.getService(), history,
                    baseline.getMean(), baseline.getStddev(), settings.getCusumDrift(),
                    settings.getCusumThreshold(), settings.getReanchorPoints());
            if (shifts.isEmpty() || shifts.get(0).getIndex() < settings.getMinHistory()) {
                return baseline;
            }
            history = history.subList(0, shifts.get(0).getIndex());
            baseline = baselineEngine.computeBaseline(series.getId(), history, settings, seed);
            log.debug("Baseline of {} cut to {} points before a shift in its history",
                    series.getId(), history.size());
        }
    }

    private void completed(AnalysisRequest request, AnalysisReport report, AnalysisSettings settings,
                           Timer.Sample timer) {
        Hypothesis top = report.topHypothesis();
        double topScore = top != null ? top.getRankScore() : 0.0;
        metrics.recordAnalysisCompleted(timer, report.getHypotheses().size(), topScore);

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("hypotheses", report.getHypotheses().size());
        details.put("bundles", report.getBundles().size());
        details.put("seriesAnalyzed", report.getSeriesAnalyzed());
        details.put("partialFailure", report.isPartialFailure());
        details.put("topRoot", top != null ? top.getRootSignal() : null);
        details.put("topScore", topScore);
        details.put("elapsedMs", report.getElapsed().toMillis());
        logEvent(request, report.getAnalysisId(), AnalysisEventType.ANALYSIS_COMPLETED, "Analysis completed", details);

        if (top != null && topScore < settings.getLowRankThreshold()) {
            logEvent(request, report.getAnalysisId(), AnalysisEventType.LOW_CONFIDENCE,
                    "Top hypothesis below rank threshold",
                    Map.of("topScore", topScore, "threshold", settings.getLowRankThreshold()));
        }

        // Weights change only after the report exists, off the request path
        WeightProposal proposal = report.getWeightProposal();
        if (proposal != null && !proposal.isEmpty()) {
            Mono.fromRunnable(() -> weightStore.proposeUpdate(proposal.getTenant(), proposal.getDeltas()))
                    .subscribeOn(Schedulers.boundedElastic())
                    .subscribe(ignored -> { },
                            error -> log.warn("Weight update for tenant {} failed: {}",
                                    proposal.getTenant(), error.getMessage()));
        }
    }

    private void failed(AnalysisRequest request, String analysisId, Timer.Sample timer, Throwable error) {
        metrics.recordAnalysisFailed(timer, error.getClass().getSimpleName());
        logEvent(request, analysisId, AnalysisEventType.ANALYSIS_FAILED,
                "Analysis failed: " + error.getMessage(),
                Map.of("error", error.getClass().getSimpleName()));
    }

    private void logEvent(AnalysisRequest request, String analysisId, AnalysisEventType type,
                          String message, Map<String, Object> details) {
        try (VerityStructuredLogger.MDCScope ignored =
                     logger.withAnalysisContext(request.getTenant(), request.getService(), analysisId)) {
            logger.logAnalysisEvent(analysisId, type, message, details);
        }
    }

    private static ReportAnnotation annotation(ReportAnnotation.Type type, String subject, String message) {
        return ReportAnnotation.builder().type(type).subject(subject).message(message).build();
    }

    private record Fetched(List<FetchResult<TimeSeries>> metrics,
                           List<FetchResult<LogLine>> logs,
                           List<FetchResult<Span>> traces,
                           Duration elapsed) {

        List<FetchResult<?>> allSlots() {
            List<FetchResult<?>> all = new ArrayList<>(metrics);
            all.addAll(logs);
            all.addAll(traces);
            return all;
        }

        boolean hasAnyData() {
            return metrics.stream().anyMatch(s -> s.getData().stream().anyMatch(ts -> !ts.isEmpty()))
                    || logs.stream().anyMatch(s -> !s.getData().isEmpty())
                    || traces.stream().anyMatch(s -> !s.getData().isEmpty());
        }
    }

    private record SeriesOutcome(String seriesId,
                                 List<AnomalyEvent> anomalies,
                                 List<ChangepointEvent> changepoints,
                                 List<ReportAnnotation> annotations,
                                 Optional<TrajectoryForecast> forecast,
                                 Optional<DegradationSignal> degradation,
                                 boolean skipped) {
    }
}
