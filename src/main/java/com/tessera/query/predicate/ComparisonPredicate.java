package com.tessera.query.predicate;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Represents a comparison leaf (column op values)
 */
public final class ComparisonPredicate implements Predicate {
    private final ColumnRef column;
    private final ComparisonOperator operator;
    private final List<Object> values;

    public ComparisonPredicate(ColumnRef column, ComparisonOperator operator, List<?> values) {
        this.column = Objects.requireNonNull(column, "column");
        this.operator = Objects.requireNonNull(operator, "operator");
        List<Object> copy = values == null ? new ArrayList<>() : new ArrayList<>(values);
        int arity = operator.getArity();
        if (arity >= 0 ? copy.size() != arity : copy.isEmpty()) {
            throw new IllegalArgumentException(
                "Operator " + operator + " cannot take " + copy.size() + " value(s)");
        }
        this.values = Collections.unmodifiableList(copy);
    }

    public ColumnRef getColumn() {
        return column;
    }

    public ComparisonOperator getOperator() {
        return operator;
    }

    public List<Object> getValues() {
        return values;
    }

    /**
     * The single operand of a unary comparison.
     */
    public Object getValue() {
        return values.isEmpty() ? null : values.get(0);
    }

    @Override
    public Set<String> getReferencedCubes() {
        return Collections.singleton(column.getCube());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ComparisonPredicate)) return false;
        ComparisonPredicate that = (ComparisonPredicate) o;
        return column.equals(that.column) && operator == that.operator && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(column, operator, values);
    }

    @Override
    public String toString() {
        return column + " " + operator.getSymbol() + (values.isEmpty() ? "" : " " + values);
    }
}
