package com.tessera.query.predicate;

/**
 * Primitive comparisons a predicate leaf can express
 */
public enum ComparisonOperator {
    EQUALS("=", 1),
    NOT_EQUALS("<>", 1),
    IN("IN", -1),
    NOT_IN("NOT IN", -1),
    GREATER_THAN(">", 1),
    GREATER_THAN_OR_EQUAL(">=", 1),
    LESS_THAN("<", 1),
    LESS_THAN_OR_EQUAL("<=", 1),
    CONTAINS("CONTAINS", 1),
    NOT_CONTAINS("NOT CONTAINS", 1),
    STARTS_WITH("STARTS WITH", 1),
    ENDS_WITH("ENDS WITH", 1),
    IS_NULL("IS NULL", 0),
    IS_NOT_NULL("IS NOT NULL", 0);

    private final String symbol;
    private final int arity;

    ComparisonOperator(String symbol, int arity) {
        this.symbol = symbol;
        this.arity = arity;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Number of operand values, or -1 for one-or-more.
     */
    public int getArity() {
        return arity;
    }
}
