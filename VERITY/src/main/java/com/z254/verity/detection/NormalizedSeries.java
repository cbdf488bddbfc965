package com.z254.verity.detection;

import com.z254.verity.domain.model.Sample;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Series on a regular step grid, split into contiguous segments at gaps too long to fill.
 */
@Value
@Builder
public class NormalizedSeries {
    String seriesId;
    String service;
    Duration step;
    @Singular
    List<List<Sample>> segments;
    /** Points synthesized by linear interpolation */
    int interpolatedPoints;
    /** Non-finite or out-of-order samples dropped */
    int droppedPoints;

    public boolean isDiscontinuous() {
        return segments.size() > 1;
    }

    public int size() {
        return segments.stream().mapToInt(List::size).sum();
    }

    public List<Sample> allSamples() {
        List<Sample> all = new ArrayList<>(size());
        segments.forEach(all::addAll);
        return all;
    }
}
