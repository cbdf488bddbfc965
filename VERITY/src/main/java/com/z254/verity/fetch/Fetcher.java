package com.z254.verity.fetch;

import com.z254.verity.config.AnalysisSettings;
import com.z254.verity.config.VerityProperties;
import com.z254.verity.datasource.DataSource;
import com.z254.verity.datasource.DataSourceRegistry;
import com.z254.verity.domain.model.FetchError;
import com.z254.verity.domain.model.FetchErrorKind;
import com.z254.verity.domain.model.FetchResult;
import com.z254.verity.domain.model.LogLine;
import com.z254.verity.domain.model.Query;
import com.z254.verity.domain.model.Span;
import com.z254.verity.domain.model.TimeSeries;
import com.z254.verity.exception.DataSourceUnavailableException;
import com.z254.verity.exception.InvalidQueryException;
import com.z254.verity.exception.QueryTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.BiFunction;
import java.util.function.Predicate;

/**
 * Runs a batch of queries against the configured data sources with bounded parallelism.
 * <p>
 * Per slot:
 * <ul>
 *     <li>Each attempt is bounded by the query timeout, clipped to what remains of the batch deadline</li>
 *     <li>Unavailable sources are retried with exponential backoff; timeouts and rejected queries are not</li>
 *     <li>An empty range result is followed by one instant query before the slot is reported as no data</li>
 * </ul>
 * The result list has one slot per query, in query order, regardless of completion order.
 * Queries beyond the concurrency limit wait for a free worker.
 */
@Slf4j
@Component
public class Fetcher {

    private final DataSourceRegistry registry;
    private final FallbackTracker fallbackTracker;
    private final VerityProperties properties;

    public Fetcher(DataSourceRegistry registry, FallbackTracker fallbackTracker, VerityProperties properties) {
        this.registry = registry;
        this.fallbackTracker = fallbackTracker;
        this.properties = properties;
    }

    /**
     * Fetch metric queries with an explicit concurrency limit and per-query timeout.
     */
    public Mono<List<FetchResult<TimeSeries>>> fetch(List<Query> queries, int concurrencyLimit, Duration timeout) {
        FetchPolicy policy = FetchPolicy.from(AnalysisSettings.defaults(properties))
                .withLimits(concurrencyLimit, timeout);
        return fetchMetrics(queries, policy);
    }

    public Mono<List<FetchResult<TimeSeries>>> fetchMetrics(List<Query> queries, FetchPolicy policy) {
        return run(queries, policy, DataSource::queryRange, DataSource::queryInstant, Fetcher::hasSamples);
    }

    public Mono<List<FetchResult<LogLine>>> fetchLogs(List<Query> queries, FetchPolicy policy) {
        return run(queries, policy, DataSource::queryLogs, null, lines -> true);
    }

    public Mono<List<FetchResult<Span>>> fetchTraces(List<Query> queries, FetchPolicy policy) {
        return run(queries, policy, DataSource::queryTraces, null, spans -> true);
    }

    // ========== Private Helper Methods ==========

    private <T> Mono<List<FetchResult<T>>> run(List<Query> queries, FetchPolicy policy,
                                               BiFunction<DataSource, Query, Mono<List<T>>> primary,
                                               BiFunction<DataSource, Query, Mono<List<T>>> fallback,
                                               Predicate<List<T>> hasData) {
        if (queries.isEmpty()) {
            return Mono.just(List.of());
        }
        return Mono.defer(() -> {
            Instant deadlineAt = Instant.now().plus(policy.deadline());
            return Flux.fromIterable(queries)
                    .flatMapSequential(query -> slot(query, policy, deadlineAt, primary, fallback, hasData),
                            Math.max(1, policy.concurrencyLimit()))
                    .collectList();
        });
    }

    private <T> Mono<FetchResult<T>> slot(Query query, FetchPolicy policy, Instant deadlineAt,
                                          BiFunction<DataSource, Query, Mono<List<T>>> primary,
                                          BiFunction<DataSource, Query, Mono<List<T>>> fallback,
                                          Predicate<List<T>> hasData) {
        Optional<DataSource> resolved = resolve(query);
        if (resolved.isEmpty()) {
            String name = query.getSource() != null ? query.getSource() : query.getKind().name();
            return Mono.just(FetchResult.failure(query, FetchError.builder()
                    .queryId(query.getId())
                    .source(name)
                    .kind(FetchErrorKind.UNKNOWN_SOURCE)
                    .message("No data source configured for " + name)
                    .attempts(0)
                    .build()));
        }
        DataSource source = resolved.get();
        AtomicInteger attempts = new AtomicInteger();

        return Mono.<FetchResult<T>>defer(() -> {
            Duration remaining = remaining(deadlineAt);
            if (remaining.isZero()) {
                return Mono.error(new QueryTimeoutException(source.getName(), "Deadline exceeded before " + query.getId()));
            }
            Mono<FetchResult<T>> work = attempt(source, query, policy, deadlineAt, primary, attempts)
                    .retryWhen(Retry.backoff(Math.max(0, policy.maxAttempts() - 1), policy.initialBackoff())
                            .maxBackoff(policy.maxBackoff())
                            .jitter(policy.jitter())
                            .filter(e -> e instanceof DataSourceUnavailableException)
                            .onRetryExhaustedThrow((spec, signal) -> signal.failure()))
                    .flatMap(data -> {
                        if (hasData.test(data) || fallback == null) {
                            return Mono.just(FetchResult.success(query, data, false));
                        }
                        return instantFallback(source, query, deadlineAt, policy, fallback, hasData);
                    });
            return work.timeout(remaining, Mono.error(() -> new QueryTimeoutException(source.getName(),
                    "Deadline exceeded while fetching " + query.getId())));
        })
                .doOnNext(result -> {
                    if (result.isSuccess()) {
                        fallbackTracker.recordSuccess(source.getName());
                    }
                })
                .onErrorResume(error -> Mono.just(FetchResult.failure(query, toError(query, source, error, attempts.get()))));
    }

    private <T> Mono<List<T>> attempt(DataSource source, Query query, FetchPolicy policy, Instant deadlineAt,
                                      BiFunction<DataSource, Query, Mono<List<T>>> operation,
                                      AtomicInteger attempts) {
        return Mono.<List<T>>defer(() -> {
            attempts.incrementAndGet();
            Duration timeout = min(policy.queryTimeout(), remaining(deadlineAt));
            if (timeout.isZero()) {
                return Mono.error(new QueryTimeoutException(source.getName(), "Deadline exceeded for " + query.getId()));
            }
            return operation.apply(source, query)
                    .defaultIfEmpty(List.of())
                    .timeout(timeout)
                    .onErrorMap(TimeoutException.class, e -> new QueryTimeoutException(source.getName(),
                            query.getId() + " timed out after " + timeout.toMillis() + "ms", e));
        });
    }

    private <T> Mono<FetchResult<T>> instantFallback(DataSource source, Query query, Instant deadlineAt,
                                                      FetchPolicy policy,
                                                      BiFunction<DataSource, Query, Mono<List<T>>> fallback,
                                                      Predicate<List<T>> hasData) {
        log.debug("Range query {} on {} returned no samples, trying instant query", query.getId(), source.getName());
        return attempt(source, query, policy, deadlineAt, fallback, new AtomicInteger())
                .map(data -> {
                    if (!hasData.test(data)) {
                        return FetchResult.<T>failure(query, FetchError.builder()
                                .queryId(query.getId())
                                .source(source.getName())
                                .kind(FetchErrorKind.NO_DATA)
                                .message("Range and instant queries returned no samples")
                                .attempts(1)
                                .build());
                    }
                    fallbackTracker.recordFallback(source.getName(), query.getId());
                    return FetchResult.success(query, markFallback(data), true);
                });
    }

    @SuppressWarnings("unchecked")
    private static <T> List<T> markFallback(List<T> data) {
        return data.stream()
                .map(item -> item instanceof TimeSeries ts ? (T) ts.toBuilder().fromFallback(true).build() : item)
                .toList();
    }

    private FetchError toError(Query query, DataSource source, Throwable error, int attempts) {
        FetchErrorKind kind;
        if (error instanceof QueryTimeoutException || error instanceof TimeoutException) {
            kind = FetchErrorKind.TIMEOUT;
        } else if (error instanceof DataSourceUnavailableException) {
            kind = FetchErrorKind.UNAVAILABLE;
        } else if (error instanceof InvalidQueryException) {
            kind = FetchErrorKind.INVALID_QUERY;
        } else {
            kind = FetchErrorKind.FAILED;
        }
        if (kind == FetchErrorKind.TIMEOUT || kind == FetchErrorKind.UNAVAILABLE) {
            fallbackTracker.recordFailure(source.getName(), error.getMessage());
        }
        log.warn("Query {} on {} failed after {} attempt(s): {} ({})",
                query.getId(), source.getName(), attempts, kind, error.getMessage());
        return FetchError.builder()
                .queryId(query.getId())
                .source(source.getName())
                .kind(kind)
                .message(error.getMessage())
                .attempts(Math.max(1, attempts))
                .build();
    }

    private Optional<DataSource> resolve(Query query) {
        if (query.getSource() != null && !query.getSource().isBlank()) {
            return registry.find(query.getSource());
        }
        return registry.defaultFor(query.getKind());
    }

    private static boolean hasSamples(List<TimeSeries> series) {
        return series.stream().anyMatch(ts -> !ts.isEmpty());
    }

    private static Duration remaining(Instant deadlineAt) {
        Duration left = Duration.between(Instant.now(), deadlineAt);
        return left.isNegative() ? Duration.ZERO : left;
    }

    private static Duration min(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
