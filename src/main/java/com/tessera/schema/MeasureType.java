package com.tessera.schema;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Aggregate functions a measure can compile to
 */
public enum MeasureType {
    COUNT("count"),
    COUNT_DISTINCT("countDistinct"),
    SUM("sum"),
    AVG("avg"),
    MIN("min"),
    MAX("max");

    private final String value;

    MeasureType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Whether the aggregate can be computed without a source column.
     */
    public boolean allowsRowCount() {
        return this == COUNT;
    }
}
