package com.tessera.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SortDirection {
    ASC("asc"),
    DESC("desc");

    private final String value;

    SortDirection(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SortDirection fromValue(String value) {
        if ("asc".equalsIgnoreCase(value)) {
            return ASC;
        }
        if ("desc".equalsIgnoreCase(value)) {
            return DESC;
        }
        throw new IllegalArgumentException("Sort direction must be 'asc' or 'desc', got '" + value + "'");
    }
}
