package com.z254.verity.domain.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Anomalies that are close in both time and peak value.
 */
@Value
@Builder
public class AnomalyCluster {
    /** Zero-based cluster index; {@link #NOISE_ID} for anomalies that joined no cluster */
    public static final int NOISE_ID = -1;

    int clusterId;
    @Singular
    List<AnomalyEvent> members;
    Instant centroidTimestamp;
    double centroidValue;
    /** Distinct series ids in first-seen order */
    @Singular
    List<String> seriesIds;

    public int getSize() {
        return members.size();
    }

    public boolean isNoise() {
        return clusterId == NOISE_ID;
    }
}
