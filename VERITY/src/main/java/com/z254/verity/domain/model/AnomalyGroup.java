package com.z254.verity.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Anomalies collapsed as repeats of one event.
 */
@Value
@Builder
public class AnomalyGroup {
    /** Most severe member, earliest on ties */
    AnomalyEvent representative;
    /** Members in onset order */
    @Singular
    List<AnomalyEvent> members;

    public int getCount() {
        return members.size();
    }
}
