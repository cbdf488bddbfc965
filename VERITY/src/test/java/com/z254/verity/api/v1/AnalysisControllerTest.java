package com.z254.verity.api.v1;

import com.z254.verity.analysis.AnalysisService;
import com.z254.verity.config.VerityProperties;
import com.z254.verity.domain.model.AnalysisReport;
import com.z254.verity.domain.model.AnalysisRequest;
import com.z254.verity.domain.model.FetchError;
import com.z254.verity.domain.model.FetchErrorKind;
import com.z254.verity.exception.AllSourcesFailedException;
import com.z254.verity.exception.InvalidConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Tests for {@link AnalysisController}.
 */
@ExtendWith(MockitoExtension.class)
class AnalysisControllerTest {

    private static final String REQUEST = """
            {"tenant":"acme","service":"checkout",
             "start":"2024-05-01T10:00:00Z","end":"2024-05-01T11:00:00Z",
             "queries":[{"id":"latency","kind":"METRIC","expression":"up"}]}
            """;

    @Mock
    private AnalysisService analysisService;

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        webTestClient = WebTestClient.bindToController(new AnalysisController(analysisService, new VerityProperties()))
                .build();
    }

    @Nested
    @DisplayName("POST /api/v1/analyze")
    class AnalyzeTests {

        @Test
        @DisplayName("should return the report")
        void returnsReport() {
            when(analysisService.analyze(any())).thenReturn(Mono.just(AnalysisReport.builder()
                    .analysisId("a-1")
                    .tenant("acme")
                    .service("checkout")
                    .seriesAnalyzed(2)
                    .build()));

            webTestClient.post()
                    .uri("/api/v1/analyze")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(REQUEST)
                    .exchange()
                    .expectStatus().isOk()
                    .expectBody()
                    .jsonPath("$.analysisId").isEqualTo("a-1")
                    .jsonPath("$.seriesAnalyzed").isEqualTo(2)
                    .jsonPath("$.partialFailure").isEqualTo(false);

            ArgumentCaptor<AnalysisRequest> captor = ArgumentCaptor.forClass(AnalysisRequest.class);
            verify(analysisService).analyze(captor.capture());
            assertThat(captor.getValue().getQueries()).singleElement()
                    .satisfies(q -> assertThat(q.getId()).isEqualTo("latency"));
        }

        @Test
        @DisplayName("should map invalid settings to 400 with violations")
        void invalidConfiguration() {
            when(analysisService.analyze(any())).thenReturn(Mono.error(
                    new InvalidConfigurationException(List.of("maxLag must be positive, got 0.0"))));

            webTestClient.post()
                    .uri("/api/v1/analyze")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(REQUEST)
                    .exchange()
                    .expectStatus().isBadRequest()
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("INVALID_CONFIGURATION")
                    .jsonPath("$.violations[0]").isEqualTo("maxLag must be positive, got 0.0");
        }

        @Test
        @DisplayName("should map total source failure to 503")
        void allSourcesFailed() {
            FetchError error = FetchError.builder()
                    .queryId("latency")
                    .source("mimir")
                    .kind(FetchErrorKind.UNAVAILABLE)
                    .message("connection refused")
                    .attempts(3)
                    .build();
            when(analysisService.analyze(any())).thenReturn(Mono.error(new AllSourcesFailedException(List.of(error))));

            webTestClient.post()
                    .uri("/api/v1/analyze")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(REQUEST)
                    .exchange()
                    .expectStatus().isEqualTo(503)
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("ALL_SOURCES_FAILED")
                    .jsonPath("$.fetchErrors[0].source").isEqualTo("mimir")
                    .jsonPath("$.fetchErrors[0].kind").isEqualTo("UNAVAILABLE");
        }

        @Test
        @DisplayName("should map unexpected failures to 500 with an error body")
        void unexpectedFailure() {
            when(analysisService.analyze(any())).thenReturn(Mono.error(new IllegalStateException("scheduler gone")));

            webTestClient.post()
                    .uri("/api/v1/analyze")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(REQUEST)
                    .exchange()
                    .expectStatus().isEqualTo(500)
                    .expectBody()
                    .jsonPath("$.error").isEqualTo("ANALYSIS_FAILED")
                    .jsonPath("$.message").isEqualTo("scheduler gone")
                    .jsonPath("$.timestamp").exists();
        }

        @Test
        @DisplayName("should reject a request without a tenant")
        void missingTenant() {
            webTestClient.post()
                    .uri("/api/v1/analyze")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue("""
                            {"service":"checkout","start":"2024-05-01T10:00:00Z","end":"2024-05-01T11:00:00Z"}
                            """)
                    .exchange()
                    .expectStatus().isBadRequest();

            verify(analysisService, never()).analyze(any());
        }
    }

    @Test
    @DisplayName("GET /api/v1/analyze/config should expose the default settings")
    void config() {
        webTestClient.get()
                .uri("/api/v1/analyze/config")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.maxLag").isEqualTo(3)
                .jsonPath("$.rootThreshold").isEqualTo(0.3)
                .jsonPath("$.deadline").isEqualTo("PT30S");
    }
}
