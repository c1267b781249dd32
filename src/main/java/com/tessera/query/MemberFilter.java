package com.tessera.query;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A condition on one member: {@code member operator values}, or for
 * {@code inDateRange} on a time member, {@code member inDateRange dateRange}.
 * Value/arity validation happens in the predicate builder, not here.
 */
public final class MemberFilter implements Filter {
    private final String member;
    private final FilterOperator operator;
    private final List<Object> values;
    private final DateRangeExpression dateRange;

    public MemberFilter(String member, FilterOperator operator, List<?> values) {
        this(member, operator, values, null);
    }

    public MemberFilter(String member, FilterOperator operator, List<?> values, DateRangeExpression dateRange) {
        this.member = Objects.requireNonNull(member, "member");
        this.operator = Objects.requireNonNull(operator, "operator");
        this.values = values == null
            ? Collections.emptyList()
            : Collections.unmodifiableList(new ArrayList<>(values));
        this.dateRange = dateRange;
    }

    public static MemberFilter of(String member, FilterOperator operator, Object... values) {
        return new MemberFilter(member, operator, values == null ? null : Arrays.asList(values));
    }

    public static MemberFilter inDateRange(String member, DateRangeExpression dateRange) {
        return new MemberFilter(member, FilterOperator.IN_DATE_RANGE, null, Objects.requireNonNull(dateRange));
    }

    public String getMember() {
        return member;
    }

    public FilterOperator getOperator() {
        return operator;
    }

    public List<Object> getValues() {
        return values;
    }

    /**
     * Relative or literal range to resolve instead of values, or null.
     */
    public DateRangeExpression getDateRange() {
        return dateRange;
    }

    @Override
    public List<String> getMembers() {
        return Collections.singletonList(member);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MemberFilter)) return false;
        MemberFilter that = (MemberFilter) o;
        return member.equals(that.member) && operator == that.operator && values.equals(that.values)
            && Objects.equals(dateRange, that.dateRange);
    }

    @Override
    public int hashCode() {
        return Objects.hash(member, operator, values, dateRange);
    }

    @Override
    public String toString() {
        return member + " " + operator.getValue() + " " + (dateRange != null ? dateRange : values);
    }
}
