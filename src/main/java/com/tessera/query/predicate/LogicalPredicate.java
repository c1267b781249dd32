package com.tessera.query.predicate;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Represents a logical combination (AND/OR/NOT) of predicates.
 * Nested nodes of the same operator are flattened on construction.
 */
public final class LogicalPredicate implements Predicate {
    private final LogicalOperator operator;
    private final List<Predicate> operands;

    private LogicalPredicate(LogicalOperator operator, List<Predicate> operands) {
        this.operator = operator;
        this.operands = Collections.unmodifiableList(operands);
    }

    /**
     * AND of the given predicates. Nulls are skipped; a single operand is
     * returned as-is, and no operands yields null.
     */
    public static Predicate and(List<? extends Predicate> predicates) {
        return combine(LogicalOperator.AND, predicates);
    }

    public static Predicate and(Predicate... predicates) {
        return and(List.of(nonNull(predicates)));
    }

    /**
     * OR of the given predicates, with the same null handling as {@link #and(List)}.
     */
    public static Predicate or(List<? extends Predicate> predicates) {
        return combine(LogicalOperator.OR, predicates);
    }

    public static Predicate or(Predicate... predicates) {
        return or(List.of(nonNull(predicates)));
    }

    public static Predicate not(Predicate predicate) {
        Objects.requireNonNull(predicate, "predicate");
        return new LogicalPredicate(LogicalOperator.NOT, List.of(predicate));
    }

    private static Predicate combine(LogicalOperator operator, List<? extends Predicate> predicates) {
        List<Predicate> flattened = new ArrayList<>();
        for (Predicate predicate : predicates) {
            if (predicate == null) {
                continue;
            }
            if (predicate instanceof LogicalPredicate
                    && ((LogicalPredicate) predicate).operator == operator) {
                flattened.addAll(((LogicalPredicate) predicate).operands);
            } else {
                flattened.add(predicate);
            }
        }
        if (flattened.isEmpty()) {
            return null;
        }
        if (flattened.size() == 1) {
            return flattened.get(0);
        }
        return new LogicalPredicate(operator, flattened);
    }

    private static Predicate[] nonNull(Predicate[] predicates) {
        return Arrays.stream(predicates).filter(Objects::nonNull).toArray(Predicate[]::new);
    }

    public LogicalOperator getOperator() {
        return operator;
    }

    public List<Predicate> getOperands() {
        return operands;
    }

    @Override
    public Set<String> getReferencedCubes() {
        Set<String> cubes = new LinkedHashSet<>();
        for (Predicate operand : operands) {
            cubes.addAll(operand.getReferencedCubes());
        }
        return cubes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogicalPredicate)) return false;
        LogicalPredicate that = (LogicalPredicate) o;
        return operator == that.operator && operands.equals(that.operands);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, operands);
    }

    @Override
    public String toString() {
        return operator + operands.toString();
    }
}
