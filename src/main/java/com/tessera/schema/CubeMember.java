package com.tessera.schema;

import com.tessera.error.SchemaDefinitionException;
import com.tessera.query.predicate.ColumnRef;

/**
 * Common shape of measures and dimensions: a named member of one cube backed
 * by a source column or expression.
 */
public abstract class CubeMember {
    private final String cubeName;
    private final String name;
    private final String title;
    private final String sql;

    protected CubeMember(String cubeName, String name, String title, String sql) {
        if (name == null || name.trim().isEmpty()) {
            throw new SchemaDefinitionException("Member name must not be empty in cube '" + cubeName + "'");
        }
        if (name.contains(".")) {
            throw new SchemaDefinitionException("Member name '" + name + "' must not contain '.'");
        }
        this.cubeName = cubeName;
        this.name = name;
        this.title = title != null ? title : name;
        this.sql = sql;
    }

    public String getCubeName() {
        return cubeName;
    }

    public String getName() {
        return name;
    }

    /**
     * Fully qualified reference, {@code Cube.member}
     */
    public String getFullName() {
        return cubeName + "." + name;
    }

    public String getTitle() {
        return title;
    }

    public String getSql() {
        return sql;
    }

    /**
     * Source column reference, or null for members without one (row counts).
     */
    public ColumnRef getColumn() {
        return sql != null ? ColumnRef.of(cubeName, sql) : null;
    }

    public abstract MemberType getType();

    @Override
    public String toString() {
        return getFullName();
    }
}
