package com.tessera.query;

import com.tessera.query.predicate.LogicalOperator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * An AND/OR group of nested filters
 */
public final class LogicalFilter implements Filter {
    private final LogicalOperator operator;
    private final List<Filter> filters;

    private LogicalFilter(LogicalOperator operator, List<Filter> filters) {
        if (operator == LogicalOperator.NOT) {
            throw new IllegalArgumentException("Filter groups are either 'and' or 'or'");
        }
        this.operator = operator;
        this.filters = Collections.unmodifiableList(new ArrayList<>(filters));
    }

    public static LogicalFilter and(List<Filter> filters) {
        return new LogicalFilter(LogicalOperator.AND, filters);
    }

    public static LogicalFilter or(List<Filter> filters) {
        return new LogicalFilter(LogicalOperator.OR, filters);
    }

    public LogicalOperator getOperator() {
        return operator;
    }

    public List<Filter> getFilters() {
        return filters;
    }

    @Override
    public List<String> getMembers() {
        List<String> members = new ArrayList<>();
        for (Filter filter : filters) {
            members.addAll(filter.getMembers());
        }
        return members;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogicalFilter)) return false;
        LogicalFilter that = (LogicalFilter) o;
        return operator == that.operator && filters.equals(that.filters);
    }

    @Override
    public int hashCode() {
        return Objects.hash(operator, filters);
    }

    @Override
    public String toString() {
        return operator.name().toLowerCase() + filters;
    }
}
