package com.tessera.schema;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Cardinality of a declared join, read from the declaring cube's side
 */
public enum JoinRelationship {
    BELONGS_TO("belongsTo"),
    HAS_ONE("hasOne"),
    HAS_MANY("hasMany");

    private final String value;

    JoinRelationship(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * The relationship as seen when the join is walked from the target cube
     * back to the declaring cube.
     */
    public JoinRelationship reverse() {
        return switch (this) {
            case BELONGS_TO -> HAS_MANY;
            case HAS_ONE, HAS_MANY -> BELONGS_TO;
        };
    }
}
