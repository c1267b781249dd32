package com.tessera.schema;

import com.tessera.error.SchemaDefinitionException;

/**
 * A groupable, filterable attribute of a cube. Dimensions of type
 * {@link MemberType#TIME} are time dimensions.
 */
public final class Dimension extends CubeMember {
    private final MemberType type;
    private final boolean primaryKey;

    Dimension(String cubeName, String name, String title, MemberType type, String sql, boolean primaryKey) {
        super(cubeName, name, title, sql);
        if (type == null) {
            throw new SchemaDefinitionException("Dimension '" + cubeName + "." + name + "' needs a type");
        }
        if (sql == null) {
            throw new SchemaDefinitionException("Dimension '" + cubeName + "." + name + "' needs a source column");
        }
        this.type = type;
        this.primaryKey = primaryKey;
    }

    @Override
    public MemberType getType() {
        return type;
    }

    public boolean isPrimaryKey() {
        return primaryKey;
    }

    public boolean isTime() {
        return type == MemberType.TIME;
    }
}
