package com.tessera.query;

import java.util.Objects;

/**
 * A time dimension clause of a query: the member, an optional bucketing
 * granularity and an optional date range.
 */
public final class TimeDimension {
    private final String dimension;
    private final TimeGranularity granularity;
    private final DateRangeExpression dateRange;

    public TimeDimension(String dimension, TimeGranularity granularity, DateRangeExpression dateRange) {
        this.dimension = Objects.requireNonNull(dimension, "dimension");
        this.granularity = granularity;
        this.dateRange = dateRange;
    }

    public String getDimension() {
        return dimension;
    }

    public TimeGranularity getGranularity() {
        return granularity;
    }

    public DateRangeExpression getDateRange() {
        return dateRange;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TimeDimension)) return false;
        TimeDimension that = (TimeDimension) o;
        return dimension.equals(that.dimension)
            && granularity == that.granularity
            && Objects.equals(dateRange, that.dateRange);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dimension, granularity, dateRange);
    }

    @Override
    public String toString() {
        return dimension + (granularity != null ? " by " + granularity.getValue() : "")
            + (dateRange != null ? " in " + dateRange : "");
    }
}
