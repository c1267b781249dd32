package com.tessera.query;

import com.tessera.query.time.ResolvedDateRange;
import com.tessera.schema.Dimension;

/**
 * A time dimension after normalization: the dimension is resolved against the
 * registry and any date range has been turned into absolute bounds.
 */
public final class ResolvedTimeDimension {
    private final Dimension dimension;
    private final TimeGranularity granularity;
    private final ResolvedDateRange dateRange;

    public ResolvedTimeDimension(Dimension dimension, TimeGranularity granularity, ResolvedDateRange dateRange) {
        this.dimension = dimension;
        this.granularity = granularity;
        this.dateRange = dateRange;
    }

    public Dimension getDimension() {
        return dimension;
    }

    /**
     * Bucket size, or null when the dimension only bounds the query.
     */
    public TimeGranularity getGranularity() {
        return granularity;
    }

    /**
     * Absolute bounds, or null when no date range was requested.
     */
    public ResolvedDateRange getDateRange() {
        return dateRange;
    }

    @Override
    public String toString() {
        return dimension.getFullName()
            + (granularity != null ? " by " + granularity.getValue() : "")
            + (dateRange != null ? " in " + dateRange : "");
    }
}
