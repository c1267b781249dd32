package com.tessera.plan;

import com.tessera.query.TimeGranularity;
import com.tessera.query.predicate.ColumnRef;

/**
 * A GROUP BY key: a dimension column, truncated to a granularity when the
 * key comes from a time dimension.
 */
public final class GroupingKey {
    private final String member;
    private final ColumnRef column;
    private final TimeGranularity granularity;

    public GroupingKey(String member, ColumnRef column, TimeGranularity granularity) {
        this.member = member;
        this.column = column;
        this.granularity = granularity;
    }

    public String getMember() {
        return member;
    }

    public ColumnRef getColumn() {
        return column;
    }

    public TimeGranularity getGranularity() {
        return granularity;
    }

    public boolean isTruncated() {
        return granularity != null;
    }

    /**
     * Output column name; time keys are suffixed with their granularity.
     */
    public String getAlias() {
        return granularity != null ? member + "." + granularity.getValue() : member;
    }

    @Override
    public String toString() {
        return getAlias();
    }
}
