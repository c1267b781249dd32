package com.tessera.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.tessera.error.InvalidDateRangeException;

/**
 * Bucket sizes for grouping by a time dimension. Granularity only controls
 * bucketing; it never widens, narrows or drops a date range.
 */
public enum TimeGranularity {
    SECOND("second"),
    MINUTE("minute"),
    HOUR("hour"),
    DAY("day"),
    WEEK("week"),
    MONTH("month"),
    QUARTER("quarter"),
    YEAR("year");

    private final String value;

    TimeGranularity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * @throws InvalidDateRangeException if the name is not a known granularity
     */
    @JsonCreator
    public static TimeGranularity fromValue(String value) {
        for (TimeGranularity granularity : values()) {
            if (granularity.value.equals(value)) {
                return granularity;
            }
        }
        throw new InvalidDateRangeException("Unknown time granularity '" + value + "'", value);
    }
}
