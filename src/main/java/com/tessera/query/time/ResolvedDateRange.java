package com.tessera.query.time;

import com.tessera.error.InvalidDateRangeException;

import java.time.Instant;
import java.util.Objects;

/**
 * A closed interval {@code [start, end]}, inclusive on both ends.
 * Always satisfies {@code start <= end}.
 */
public final class ResolvedDateRange {
    private final Instant start;
    private final Instant end;

    public ResolvedDateRange(Instant start, Instant end) {
        this.start = Objects.requireNonNull(start, "start");
        this.end = Objects.requireNonNull(end, "end");
        if (start.isAfter(end)) {
            throw new InvalidDateRangeException("Date range start is after its end", start + " .. " + end);
        }
    }

    public Instant getStart() {
        return start;
    }

    public Instant getEnd() {
        return end;
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && !instant.isAfter(end);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResolvedDateRange)) return false;
        ResolvedDateRange that = (ResolvedDateRange) o;
        return start.equals(that.start) && end.equals(that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(start, end);
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
