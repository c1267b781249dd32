package com.tessera.schema;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Value kind of a cube member
 */
public enum MemberType {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    TIME("time");

    private final String value;

    MemberType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
