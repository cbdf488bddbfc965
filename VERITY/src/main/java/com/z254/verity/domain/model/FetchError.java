package com.z254.verity.domain.model;

import lombok.Builder;
import lombok.Value;

/**
 * Typed failure occupying a fetch slot.
 */
@Value
@Builder
public class FetchError {
    String queryId;
    String source;
    FetchErrorKind kind;
    String message;
    int attempts;

    /**
     * True for failures caused by the source rather than by the data.
     */
    public boolean isSourceFailure() {
        return kind != FetchErrorKind.NO_DATA;
    }
}
