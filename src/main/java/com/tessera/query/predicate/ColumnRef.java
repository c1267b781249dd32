package com.tessera.query.predicate;

import java.util.Objects;

/**
 * Reference to a source column (or source expression) of a cube.
 */
public final class ColumnRef {
    private final String cube;
    private final String column;

    public ColumnRef(String cube, String column) {
        if (cube == null || cube.isEmpty() || column == null || column.isEmpty()) {
            throw new IllegalArgumentException("Column reference needs both a cube and a column");
        }
        this.cube = cube;
        this.column = column;
    }

    public static ColumnRef of(String cube, String column) {
        return new ColumnRef(cube, column);
    }

    public String getCube() {
        return cube;
    }

    public String getColumn() {
        return column;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ColumnRef)) return false;
        ColumnRef that = (ColumnRef) o;
        return cube.equals(that.cube) && column.equals(that.column);
    }

    @Override
    public int hashCode() {
        return Objects.hash(cube, column);
    }

    @Override
    public String toString() {
        return cube + "." + column;
    }
}
