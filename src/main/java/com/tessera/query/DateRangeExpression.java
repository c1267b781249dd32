package com.tessera.query;

import java.util.Objects;

/**
 * The unresolved {@code dateRange} of a time dimension: either a single
 * expression ({@code "last 7 days"}, {@code "2024-03-01"}) or a literal
 * {@code [start, end]} interval.
 */
public final class DateRangeExpression {
    private final String expression;
    private final String start;
    private final String end;

    private DateRangeExpression(String expression, String start, String end) {
        this.expression = expression;
        this.start = start;
        this.end = end;
    }

    public static DateRangeExpression of(String expression) {
        return new DateRangeExpression(Objects.requireNonNull(expression, "expression"), null, null);
    }

    public static DateRangeExpression between(String start, String end) {
        return new DateRangeExpression(null, Objects.requireNonNull(start, "start"), Objects.requireNonNull(end, "end"));
    }

    public boolean isInterval() {
        return expression == null;
    }

    public String getExpression() {
        return expression;
    }

    public String getStart() {
        return start;
    }

    public String getEnd() {
        return end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DateRangeExpression)) return false;
        DateRangeExpression that = (DateRangeExpression) o;
        return Objects.equals(expression, that.expression)
            && Objects.equals(start, that.start)
            && Objects.equals(end, that.end);
    }

    @Override
    public int hashCode() {
        return Objects.hash(expression, start, end);
    }

    @Override
    public String toString() {
        return isInterval() ? "[" + start + ", " + end + "]" : expression;
    }
}
