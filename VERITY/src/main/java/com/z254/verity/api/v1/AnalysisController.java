package com.z254.verity.api.v1;

import com.z254.verity.analysis.AnalysisService;
import com.z254.verity.config.AnalysisSettings;
import com.z254.verity.config.VerityProperties;
import com.z254.verity.domain.model.AnalysisReport;
import com.z254.verity.domain.model.AnalysisRequest;
import com.z254.verity.domain.model.FetchError;
import com.z254.verity.exception.AllSourcesFailedException;
import com.z254.verity.exception.InvalidConfigurationException;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * REST API for root cause analysis requests.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/analyze")
@Tag(name = "Analysis", description = "Root cause analysis of service telemetry")
public class AnalysisController {

    private final AnalysisService analysisService;
    private final VerityProperties verityProperties;

    public AnalysisController(AnalysisService analysisService, VerityProperties verityProperties) {
        this.analysisService = analysisService;
        this.verityProperties = verityProperties;
    }

    @PostMapping
    @Operation(summary = "Analyze", description = "Fetch telemetry for a service and rank root cause hypotheses")
    public Mono<ResponseEntity<Object>> analyze(@Valid @RequestBody AnalysisRequest request) {
        log.info("Analysis requested for tenant={} service={} window=[{}, {}]",
                request.getTenant(), request.getService(), request.getStart(), request.getEnd());

        return analysisService.analyze(request)
                .map(report -> ResponseEntity.ok().<Object>body(report))
                .onErrorResume(InvalidConfigurationException.class, error ->
                        Mono.just(ResponseEntity.badRequest().body(ErrorResponse.builder()
                                .error("INVALID_CONFIGURATION")
                                .message(error.getMessage())
                                .violations(error.getViolations())
                                .timestamp(Instant.now())
                                .build())))
                .onErrorResume(AllSourcesFailedException.class, error ->
                        Mono.just(ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorResponse.builder()
                                .error("ALL_SOURCES_FAILED")
                                .message(error.getMessage())
                                .fetchErrors(error.getErrors())
                                .timestamp(Instant.now())
                                .build())))
                .onErrorResume(error -> {
                    log.error("Analysis failed for tenant={} service={}",
                            request.getTenant(), request.getService(), error);
                    return Mono.just(ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.builder()
                            .error("ANALYSIS_FAILED")
                            .message(error.getMessage())
                            .timestamp(Instant.now())
                            .build()));
                });
    }

    @GetMapping("/config")
    @Operation(summary = "Get analysis config", description = "Get the default analysis settings")
    public Mono<ResponseEntity<AnalysisConfig>> getConfig() {
        AnalysisSettings settings = AnalysisSettings.defaults(verityProperties);

        return Mono.just(ResponseEntity.ok(AnalysisConfig.builder()
                .baselineWindow(settings.getBaselineWindow())
                .baselineK(settings.getBaselineK())
                .zscoreMultiplier(settings.getZscoreMultiplier())
                .cusumDrift(settings.getCusumDrift())
                .cusumThreshold(settings.getCusumThreshold())
                .correlationWindow(settings.getCorrelationWindow().toString())
                .maxLag(settings.getMaxLag())
                .minCausalStrength(settings.getMinCausalStrength())
                .rootThreshold(settings.getRootThreshold())
                .maxHypotheses(settings.getMaxHypotheses())
                .concurrencyLimit(settings.getConcurrencyLimit())
                .deadline(settings.getDeadline().toString())
                .dataSources(verityProperties.getDatasources().stream()
                        .map(VerityProperties.DataSourceConfig::getName)
                        .toList())
                .build()));
    }

    // ========== Request/Response DTOs ==========

    @lombok.Data
    @lombok.Builder
    public static class ErrorResponse {
        private String error;
        private String message;
        private List<String> violations;
        private List<FetchError> fetchErrors;
        private Instant timestamp;
    }

    @lombok.Data
    @lombok.Builder
    public static class AnalysisConfig {
        private int baselineWindow;
        private double baselineK;
        private double zscoreMultiplier;
        private double cusumDrift;
        private double cusumThreshold;
        private String correlationWindow;
        private int maxLag;
        private double minCausalStrength;
        private double rootThreshold;
        private int maxHypotheses;
        private int concurrencyLimit;
        private String deadline;
        private List<String> dataSources;
    }
}
