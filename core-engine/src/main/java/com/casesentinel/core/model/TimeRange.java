package com.casesentinel.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Half-open instant range {@code [start, end)}.
 *
 * @since 1.0.0
 */
public final class TimeRange {

    private final Instant start;
    private final Instant end;

    /**
     * @throws IllegalArgumentException if {@code end} is before {@code start}
     */
    public TimeRange(Instant start, Instant end) {
        this.start = Objects.requireNonNull(start, "start must not be null");
        this.end = Objects.requireNonNull(end, "end must not be null");
        if (end.isBefore(start)) {
            throw new IllegalArgumentException("Range end " + end + " is before start " + start);
        }
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    /**
     * @return {@code true} if {@code instant} is at or after start and strictly
     *         before end
     */
    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TimeRange that))
            return false;
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
