package com.z254.verity.domain.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Closed time interval {@code [start, end]}. A point event has {@code start == end}.
 */
public record TimeInterval(Instant start, Instant end) implements Comparable<TimeInterval> {

    public TimeInterval {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Interval end " + end + " precedes start " + start);
        }
    }

    public static TimeInterval at(Instant instant) {
        return new TimeInterval(instant, instant);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && !instant.isAfter(end);
    }

    /**
     * True when the two intervals overlap or the gap between them is at most {@code window}.
     */
    public boolean isWithin(TimeInterval other, Duration window) {
        return !other.start.isAfter(end.plus(window)) && !start.isAfter(other.end.plus(window));
    }

    public TimeInterval span(TimeInterval other) {
        Instant s = start.isBefore(other.start) ? start : other.start;
        Instant e = end.isAfter(other.end) ? end : other.end;
        return new TimeInterval(s, e);
    }

    @Override
    public int compareTo(TimeInterval other) {
        int byStart = start.compareTo(other.start);
        return byStart != 0 ? byStart : end.compareTo(other.end);
    }
}
