package com.tessera.query.predicate;

import java.util.List;

/**
 * Shorthand factories for predicate leaves, mainly for cube tenant filters
 * and measure filters declared in schema code.
 */
public final class Predicates {

    private Predicates() {
        throw new UnsupportedOperationException("Predicates is a utility class and cannot be instantiated");
    }

    public static Predicate equalTo(ColumnRef column, Object value) {
        return new ComparisonPredicate(column, ComparisonOperator.EQUALS, List.of(value));
    }

    public static Predicate in(ColumnRef column, List<?> values) {
        return new ComparisonPredicate(column, ComparisonOperator.IN, values);
    }

    public static Predicate greaterThanOrEqual(ColumnRef column, Object value) {
        return new ComparisonPredicate(column, ComparisonOperator.GREATER_THAN_OR_EQUAL, List.of(value));
    }

    public static Predicate lessThanOrEqual(ColumnRef column, Object value) {
        return new ComparisonPredicate(column, ComparisonOperator.LESS_THAN_OR_EQUAL, List.of(value));
    }

    public static Predicate isNotNull(ColumnRef column) {
        return new ComparisonPredicate(column, ComparisonOperator.IS_NOT_NULL, List.of());
    }
}
