package com.z254.verity.domain.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * One slot of a fetch batch: either data or a typed error, never both.
 *
 * @param <T> series, log lines or spans
 */
@Value
@Builder
public class FetchResult<T> {
    Query query;
    List<T> data;
    FetchError error;
    /** True when the data came from the instant fallback */
    boolean fromFallback;

    public static <T> FetchResult<T> success(Query query, List<T> data, boolean fromFallback) {
        return FetchResult.<T>builder()
                .query(query)
                .data(List.copyOf(data))
                .fromFallback(fromFallback)
                .build();
    }

    public static <T> FetchResult<T> failure(Query query, FetchError error) {
        return FetchResult.<T>builder()
                .query(query)
                .data(List.of())
                .error(error)
                .build();
    }

    public boolean isSuccess() {
        return error == null;
    }
}
