package com.tessera.schema;

/**
 * A join declared on a cube: {@code sourceColumn} of the declaring cube
 * equals {@code targetColumn} of {@code targetCube}.
 */
public final class CubeJoin {
    private final String targetCube;
    private final JoinRelationship relationship;
    private final String sourceColumn;
    private final String targetColumn;

    public CubeJoin(String targetCube, JoinRelationship relationship, String sourceColumn, String targetColumn) {
        this.targetCube = targetCube;
        this.relationship = relationship;
        this.sourceColumn = sourceColumn;
        this.targetColumn = targetColumn;
    }

    public String getTargetCube() {
        return targetCube;
    }

    public JoinRelationship getRelationship() {
        return relationship;
    }

    public String getSourceColumn() {
        return sourceColumn;
    }

    public String getTargetColumn() {
        return targetColumn;
    }
}
