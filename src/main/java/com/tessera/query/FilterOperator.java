package com.tessera.query;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.tessera.error.InvalidFilterException;

/**
 * Operators accepted in a member filter, with the number of values each one
 * takes. {@code minValues == maxValues == 0} means the operator forbids values;
 * {@code maxValues == -1} means one or more.
 */
public enum FilterOperator {
    EQUALS("equals", 1, -1),
    NOT_EQUALS("notEquals", 1, -1),
    IN("in", 1, -1),
    NOT_IN("notIn", 1, -1),
    CONTAINS("contains", 1, -1),
    NOT_CONTAINS("notContains", 1, -1),
    STARTS_WITH("startsWith", 1, -1),
    ENDS_WITH("endsWith", 1, -1),
    GT("gt", 1, 1),
    GTE("gte", 1, 1),
    LT("lt", 1, 1),
    LTE("lte", 1, 1),
    BETWEEN("between", 2, 2),
    NOT_BETWEEN("notBetween", 2, 2),
    IN_DATE_RANGE("inDateRange", 2, 2),
    NOT_IN_DATE_RANGE("notInDateRange", 2, 2),
    BEFORE_DATE("beforeDate", 1, 1),
    AFTER_DATE("afterDate", 1, 1),
    SET("set", 0, 0),
    NOT_SET("notSet", 0, 0),
    IS_EMPTY("isEmpty", 0, 0),
    IS_NOT_EMPTY("isNotEmpty", 0, 0);

    private final String value;
    private final int minValues;
    private final int maxValues;

    FilterOperator(String value, int minValues, int maxValues) {
        this.value = value;
        this.minValues = minValues;
        this.maxValues = maxValues;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public int getMinValues() {
        return minValues;
    }

    public int getMaxValues() {
        return maxValues;
    }

    public boolean forbidsValues() {
        return maxValues == 0;
    }

    /**
     * Looks an operator up by its wire name.
     *
     * @throws InvalidFilterException if the name is not a known operator
     */
    @JsonCreator
    public static FilterOperator fromValue(String value) {
        for (FilterOperator operator : values()) {
            if (operator.value.equals(value)) {
                return operator;
            }
        }
        throw new InvalidFilterException("Unknown filter operator '" + value + "'");
    }
}
