package com.tessera.plan;

import com.tessera.query.predicate.ColumnRef;
import com.tessera.schema.JoinRelationship;

/**
 * One edge of a plan's join list: {@code toCube} is joined onto the already
 * joined {@code fromCube} where {@code fromColumn = toColumn}.
 */
public final class JoinStep {
    private final String fromCube;
    private final String toCube;
    private final JoinRelationship relationship;
    private final JoinType joinType;
    private final ColumnRef fromColumn;
    private final ColumnRef toColumn;

    public JoinStep(String fromCube, String toCube, JoinRelationship relationship,
                    ColumnRef fromColumn, ColumnRef toColumn) {
        this.fromCube = fromCube;
        this.toCube = toCube;
        this.relationship = relationship;
        // A belongsTo parent always exists; child sides may be absent
        this.joinType = relationship == JoinRelationship.BELONGS_TO ? JoinType.INNER : JoinType.LEFT;
        this.fromColumn = fromColumn;
        this.toColumn = toColumn;
    }

    public String getFromCube() {
        return fromCube;
    }

    public String getToCube() {
        return toCube;
    }

    /**
     * Relationship seen from {@code fromCube} towards {@code toCube}.
     */
    public JoinRelationship getRelationship() {
        return relationship;
    }

    public JoinType getJoinType() {
        return joinType;
    }

    public ColumnRef getFromColumn() {
        return fromColumn;
    }

    public ColumnRef getToColumn() {
        return toColumn;
    }

    @Override
    public String toString() {
        return fromCube + " -" + relationship.getValue() + "-> " + toCube;
    }
}
