package com.tessera.schema;

import com.tessera.error.SchemaDefinitionException;
import com.tessera.query.predicate.Predicate;

/**
 * A numeric aggregate over a cube.
 *
 * A measure may carry a static filter (for example "count of active users");
 * the planner attaches it to the aggregate itself rather than to the query's
 * where-clause, so other measures in the same query are unaffected.
 */
public final class Measure extends CubeMember {
    private final MeasureType measureType;
    private final Predicate filter;

    Measure(String cubeName, String name, String title, MeasureType measureType, String sql, Predicate filter) {
        super(cubeName, name, title, sql);
        if (measureType == null) {
            throw new SchemaDefinitionException("Measure '" + cubeName + "." + name + "' needs a type");
        }
        if (sql == null && !measureType.allowsRowCount()) {
            throw new SchemaDefinitionException(
                "Measure '" + cubeName + "." + name + "' of type " + measureType.getValue() + " needs a source column");
        }
        if (filter != null && !filter.getReferencedCubes().stream().allMatch(cubeName::equals)) {
            throw new SchemaDefinitionException(
                "Filter of measure '" + cubeName + "." + name + "' may only read columns of its own cube");
        }
        this.measureType = measureType;
        this.filter = filter;
    }

    public MeasureType getMeasureType() {
        return measureType;
    }

    public Predicate getFilter() {
        return filter;
    }

    @Override
    public MemberType getType() {
        return MemberType.NUMBER;
    }
}
