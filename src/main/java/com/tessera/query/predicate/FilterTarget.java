package com.tessera.query.predicate;

import com.tessera.schema.MemberType;

/**
 * What a filter's member compiles against: the column (or aggregate alias)
 * and the member's value kind.
 */
public final class FilterTarget {
    private final ColumnRef column;
    private final MemberType type;

    public FilterTarget(ColumnRef column, MemberType type) {
        this.column = column;
        this.type = type;
    }

    public ColumnRef getColumn() {
        return column;
    }

    public MemberType getType() {
        return type;
    }
}
