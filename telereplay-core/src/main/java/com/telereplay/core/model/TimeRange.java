package com.telereplay.core.model;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Half-open time interval [start, end).
 */
public record TimeRange(Instant start, Instant end) {

    public TimeRange {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) {
            throw new IllegalArgumentException("start must be <= end: " + start + " > " + end);
        }
    }

    public boolean contains(Instant time) {
        return !time.isBefore(start) && time.isBefore(end);
    }

    /**
     * Check if a timestamp lies within the closed interval [start, end].
     */
    public boolean covers(Instant time) {
        return !time.isBefore(start) && !time.isAfter(end);
    }

    public boolean overlaps(TimeRange other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    public boolean adjacent(TimeRange other) {
        return end.equals(other.start) || other.end.equals(start);
    }

    /**
     * Smallest range spanning both ranges.
     */
    public TimeRange union(TimeRange other) {
        Instant s = start.isBefore(other.start) ? start : other.start;
        Instant e = end.isAfter(other.end) ? end : other.end;
        return new TimeRange(s, e);
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
