package com.z254.verity.datasource;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.z254.verity.config.VerityProperties.BackendType;
import com.z254.verity.config.VerityProperties.DataSourceConfig;
import com.z254.verity.exception.DataSourceException;
import com.z254.verity.exception.DataSourceUnavailableException;
import com.z254.verity.exception.InvalidQueryException;
import com.z254.verity.exception.QueryTimeoutException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.reactor.circuitbreaker.operator.CircuitBreakerOperator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Base for HTTP connectors.
 * <p>
 * Provides:
 * <ul>
 *     <li>Tenant propagation through the {@code X-Scope-OrgID} header</li>
 *     <li>A per-source timeout and circuit breaker</li>
 *     <li>Translation of transport failures into the data source exception hierarchy</li>
 * </ul>
 */
@Slf4j
public abstract class AbstractHttpDataSource implements DataSource {

    static final String TENANT_HEADER = "X-Scope-OrgID";

    protected final DataSourceConfig config;
    protected final ObjectMapper objectMapper;
    private final WebClient webClient;
    private final CircuitBreaker circuitBreaker;

    protected AbstractHttpDataSource(DataSourceConfig config, WebClient.Builder webClientBuilder,
                                     ObjectMapper objectMapper) {
        this.config = config;
        this.objectMapper = objectMapper;
        this.webClient = webClientBuilder.clone()
                .baseUrl(config.getUrl())
                .build();
        this.circuitBreaker = config.getCircuitBreaker().isEnabled() ? circuitBreaker(config) : null;
    }

    @Override
    public String getName() {
        return config.getName();
    }

    @Override
    public BackendType getType() {
        return config.getType();
    }

    /**
     * Current breaker state, or {@code DISABLED} when the source runs without one.
     */
    public CircuitBreaker.State getCircuitState() {
        return circuitBreaker != null ? circuitBreaker.getState() : CircuitBreaker.State.DISABLED;
    }

    /**
     * GET {@code path} with query parameters and parse the body as JSON.
     * Parameter values are passed as URI variables so selector braces are encoded.
     */
    protected Mono<JsonNode> getJson(String path, Map<String, ?> params, String tenant) {
        Map<String, Object> variables = new LinkedHashMap<>(params);
        Mono<JsonNode> call = webClient.get()
                .uri(builder -> {
                    builder.path(path);
                    variables.keySet().forEach(name -> builder.queryParam(name, "{" + name + "}"));
                    return builder.build(variables);
                })
                .headers(headers -> {
                    String orgId = resolveTenant(tenant);
                    if (orgId != null) {
                        headers.set(TENANT_HEADER, orgId);
                    }
                })
                .retrieve()
                .bodyToMono(String.class)
                .defaultIfEmpty("{}")
                .map(this::parse)
                .timeout(config.getTimeout())
                .onErrorMap(this::translate);

        if (circuitBreaker != null) {
            call = call.transformDeferred(CircuitBreakerOperator.of(circuitBreaker))
                    .onErrorMap(CallNotPermittedException.class, e -> new DataSourceUnavailableException(getName(),
                            "Circuit breaker open for " + getName(), e));
        }
        return call.doOnError(e -> log.debug("{} {} failed: {}", getName(), path, e.getMessage()));
    }

    protected static String epochSeconds(Instant instant) {
        return String.valueOf(instant.getEpochSecond());
    }

    protected static String stepSeconds(Duration step) {
        return Math.max(1L, step.toSeconds()) + "s";
    }

    // ========== Private Helper Methods ==========

    private String resolveTenant(String requestTenant) {
        if (config.getTenantId() != null && !config.getTenantId().isBlank()) {
            return config.getTenantId();
        }
        return requestTenant;
    }

    private JsonNode parse(String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new DataSourceException(getName(), "Malformed response from " + getName(), e);
        }
    }

    private Throwable translate(Throwable error) {
        if (error instanceof DataSourceException) {
            return error;
        }
        if (error instanceof WebClientResponseException response) {
            if (response.getStatusCode().is4xxClientError()) {
                return new InvalidQueryException(getName(), getName() + " rejected query ["
                        + response.getStatusCode().value() + "]: " + response.getResponseBodyAsString(), error);
            }
            return new DataSourceUnavailableException(getName(), getName() + " answered "
                    + response.getStatusCode().value(), error);
        }
        if (error instanceof TimeoutException) {
            return new QueryTimeoutException(getName(), getName() + " query timed out after "
                    + config.getTimeout().toMillis() + "ms", error);
        }
        if (error instanceof WebClientRequestException) {
            return new DataSourceUnavailableException(getName(), "Cannot reach " + getName()
                    + " at " + config.getUrl(), error);
        }
        return new DataSourceException(getName(), getName() + " query failed: " + error.getMessage(), error);
    }

    private static CircuitBreaker circuitBreaker(DataSourceConfig config) {
        DataSourceConfig.CircuitBreaker settings = config.getCircuitBreaker();
        CircuitBreakerConfig breakerConfig = CircuitBreakerConfig.custom()
                .failureRateThreshold(settings.getFailureRateThreshold())
                .waitDurationInOpenState(settings.getWaitDurationInOpenState())
                .minimumNumberOfCalls(settings.getMinimumNumberOfCalls())
                .slidingWindowSize(settings.getSlidingWindowSize())
                .ignoreExceptions(InvalidQueryException.class)
                .build();
        return CircuitBreaker.of("datasource-" + config.getName(), breakerConfig);
    }
}
