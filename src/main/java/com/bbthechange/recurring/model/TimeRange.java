package com.bbthechange.recurring.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Half-open time interval {@code [start, end)}.
 * Two ranges that only share a boundary instant do not overlap.
 */
public final class TimeRange {

    private final Instant start;
    private final Instant end;

    @JsonCreator
    public TimeRange(@JsonProperty("start") Instant start, @JsonProperty("end") Instant end) {
        if (start == null || end == null) {
            throw new IllegalArgumentException("Time range requires both start and end");
        }
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Time range end must be after start: [" + start + ", " + end + ")");
        }
        this.start = start;
        this.end = end;
    }

    public static TimeRange of(Instant start, Duration duration) {
        return new TimeRange(start, start.plus(duration));
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public Duration duration() {
        return Duration.between(start, end);
    }

    public boolean overlaps(TimeRange other) {
        return start.isBefore(other.end) && other.start.isBefore(end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeRange)) return false;
        TimeRange that = (TimeRange) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + ")";
    }
}
