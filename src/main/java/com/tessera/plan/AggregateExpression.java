package com.tessera.plan;

import com.tessera.query.predicate.ColumnRef;
import com.tessera.query.predicate.Predicate;
import com.tessera.schema.MeasureType;

/**
 * Represents an aggregate computed for one measure
 */
public final class AggregateExpression {
    private final String member;
    private final MeasureType function;
    private final ColumnRef column;
    private final Predicate filter;

    public AggregateExpression(String member, MeasureType function, ColumnRef column, Predicate filter) {
        this.member = member;
        this.function = function;
        this.column = column;
        this.filter = filter;
    }

    public String getMember() {
        return member;
    }

    public MeasureType getFunction() {
        return function;
    }

    /**
     * Aggregated column, or null for a plain row count.
     */
    public ColumnRef getColumn() {
        return column;
    }

    /**
     * Condition restricting which rows feed this aggregate, or null.
     */
    public Predicate getFilter() {
        return filter;
    }

    public String getAlias() {
        return member;
    }

    @Override
    public String toString() {
        return function.getValue() + "(" + (column != null ? column : "*") + ") AS " + getAlias();
    }
}
