package com.z254.verity.datasource;

import com.z254.verity.config.VerityProperties.BackendType;
import com.z254.verity.domain.model.LogLine;
import com.z254.verity.domain.model.Query;
import com.z254.verity.domain.model.Span;
import com.z254.verity.domain.model.TimeSeries;
import com.z254.verity.exception.InvalidQueryException;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Query capability of one telemetry backend.
 * <p>
 * Operations a backend does not serve fail with {@link InvalidQueryException}. Failures are
 * signalled with the {@link com.z254.verity.exception.DataSourceException} hierarchy.
 */
public interface DataSource {

    String getName();

    BackendType getType();

    /**
     * Range query over {@code [query.start, query.end]} at {@code query.step}. A query that
     * matches nothing completes with an empty list.
     */
    default Mono<List<TimeSeries>> queryRange(Query query) {
        return unsupported("range");
    }

    /**
     * Single evaluation at {@code query.end}.
     */
    default Mono<List<TimeSeries>> queryInstant(Query query) {
        return unsupported("instant");
    }

    default Mono<List<LogLine>> queryLogs(Query query) {
        return unsupported("log");
    }

    default Mono<List<Span>> queryTraces(Query query) {
        return unsupported("trace");
    }

    private <T> Mono<T> unsupported(String operation) {
        return Mono.error(new InvalidQueryException(getName(),
                getType() + " source '" + getName() + "' does not support " + operation + " queries"));
    }
}
