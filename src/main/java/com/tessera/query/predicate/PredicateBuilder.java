package com.tessera.query.predicate;

import com.tessera.error.InvalidDateRangeException;
import com.tessera.error.InvalidFilterException;
import com.tessera.query.Filter;
import com.tessera.query.FilterOperator;
import com.tessera.query.LogicalFilter;
import com.tessera.query.MemberFilter;
import com.tessera.query.time.DateRangeResolver;
import com.tessera.query.time.ResolvedDateRange;
import com.tessera.schema.MemberType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Compiles query filters into predicate trees.
 *
 * Each operator has exactly one compilation rule, selected by an exhaustive
 * switch, so a new operator does not compile until it has one. Before
 * compiling, the builder checks that the number of values suits the operator
 * and that the operator suits the member's type. Nothing is executed here.
 */
@Component
public class PredicateBuilder {

    private static final Logger log = LoggerFactory.getLogger(PredicateBuilder.class);

    private final DateRangeResolver dateRangeResolver;

    public PredicateBuilder(DateRangeResolver dateRangeResolver) {
        this.dateRangeResolver = dateRangeResolver;
    }

    /**
     * Compiles a filter, possibly a nested and/or group.
     *
     * @param filter the filter to compile
     * @param targets resolves each member name to the column and type it compiles against
     * @param now reference instant for relative {@code dateRange} filters
     * @return the predicate, never null
     * @throws InvalidFilterException if any condition in the filter is invalid
     */
    public Predicate build(Filter filter, Function<String, FilterTarget> targets, Instant now) {
        if (filter instanceof MemberFilter) {
            MemberFilter memberFilter = (MemberFilter) filter;
            FilterTarget target = targets.apply(memberFilter.getMember());
            return build(memberFilter, target.getType(), target.getColumn(), now);
        }
        if (filter instanceof LogicalFilter) {
            LogicalFilter group = (LogicalFilter) filter;
            if (group.getFilters().isEmpty()) {
                throw new InvalidFilterException("Filter group '" + group.getOperator().name().toLowerCase()
                    + "' must contain at least one filter");
            }
            List<Predicate> operands = new ArrayList<>();
            for (Filter nested : group.getFilters()) {
                operands.add(build(nested, targets, now));
            }
            return switch (group.getOperator()) {
                case AND -> LogicalPredicate.and(operands);
                case OR -> LogicalPredicate.or(operands);
                case NOT -> throw new InvalidFilterException("Negated filter groups are not supported");
            };
        }
        throw new InvalidFilterException("Unsupported filter type: " + filter);
    }

    /**
     * Compiles a filter that carries no relative {@code dateRange}.
     */
    public Predicate build(Filter filter, Function<String, FilterTarget> targets) {
        return build(filter, targets, null);
    }

    public Predicate build(MemberFilter filter, MemberType memberType, ColumnRef column) {
        return build(filter, memberType, column, null);
    }

    /**
     * Compiles a single member condition.
     *
     * @param filter the condition
     * @param memberType the value kind of the filtered member
     * @param column the column the condition applies to
     * @param now reference instant for a relative {@code dateRange}
     * @return the predicate, never null
     * @throws InvalidFilterException if the operator, values and type disagree
     * @throws InvalidDateRangeException if the filter's date range does not resolve
     */
    public Predicate build(MemberFilter filter, MemberType memberType, ColumnRef column, Instant now) {
        if (filter.getDateRange() != null) {
            return buildDateRange(filter, memberType, column, now);
        }
        FilterOperator operator = filter.getOperator();
        validateArity(filter);
        validateType(filter, memberType);

        List<Object> values = coerce(filter, memberType);
        Predicate predicate = switch (operator) {
            case EQUALS -> values.size() == 1
                ? leaf(column, ComparisonOperator.EQUALS, values.get(0))
                : new ComparisonPredicate(column, ComparisonOperator.IN, values);
            case NOT_EQUALS -> values.size() == 1
                ? leaf(column, ComparisonOperator.NOT_EQUALS, values.get(0))
                : new ComparisonPredicate(column, ComparisonOperator.NOT_IN, values);
            case IN -> new ComparisonPredicate(column, ComparisonOperator.IN, values);
            case NOT_IN -> new ComparisonPredicate(column, ComparisonOperator.NOT_IN, values);
            case CONTAINS -> LogicalPredicate.or(leaves(column, ComparisonOperator.CONTAINS, values));
            case NOT_CONTAINS -> LogicalPredicate.and(leaves(column, ComparisonOperator.NOT_CONTAINS, values));
            case STARTS_WITH -> LogicalPredicate.or(leaves(column, ComparisonOperator.STARTS_WITH, values));
            case ENDS_WITH -> LogicalPredicate.or(leaves(column, ComparisonOperator.ENDS_WITH, values));
            case GT -> leaf(column, ComparisonOperator.GREATER_THAN, values.get(0));
            case GTE -> leaf(column, ComparisonOperator.GREATER_THAN_OR_EQUAL, values.get(0));
            case LT -> leaf(column, ComparisonOperator.LESS_THAN, values.get(0));
            case LTE -> leaf(column, ComparisonOperator.LESS_THAN_OR_EQUAL, values.get(0));
            case BETWEEN -> {
                requireOrdered(filter, values.get(0), values.get(1));
                yield LogicalPredicate.and(
                    leaf(column, ComparisonOperator.GREATER_THAN_OR_EQUAL, values.get(0)),
                    leaf(column, ComparisonOperator.LESS_THAN_OR_EQUAL, values.get(1)));
            }
            case NOT_BETWEEN -> {
                requireOrdered(filter, values.get(0), values.get(1));
                yield LogicalPredicate.or(
                    leaf(column, ComparisonOperator.LESS_THAN, values.get(0)),
                    leaf(column, ComparisonOperator.GREATER_THAN, values.get(1)));
            }
            case IN_DATE_RANGE -> {
                ResolvedDateRange range = dateRange(filter);
                yield LogicalPredicate.and(
                    leaf(column, ComparisonOperator.GREATER_THAN_OR_EQUAL, range.getStart()),
                    leaf(column, ComparisonOperator.LESS_THAN_OR_EQUAL, range.getEnd()));
            }
            case NOT_IN_DATE_RANGE -> {
                ResolvedDateRange range = dateRange(filter);
                yield LogicalPredicate.or(
                    leaf(column, ComparisonOperator.LESS_THAN, range.getStart()),
                    leaf(column, ComparisonOperator.GREATER_THAN, range.getEnd()));
            }
            case BEFORE_DATE -> leaf(column, ComparisonOperator.LESS_THAN, values.get(0));
            case AFTER_DATE -> leaf(column, ComparisonOperator.GREATER_THAN, values.get(0));
            case SET -> leaf(column, ComparisonOperator.IS_NOT_NULL, null);
            case NOT_SET -> leaf(column, ComparisonOperator.IS_NULL, null);
            case IS_EMPTY -> LogicalPredicate.or(
                leaf(column, ComparisonOperator.IS_NULL, null),
                leaf(column, ComparisonOperator.EQUALS, ""));
            case IS_NOT_EMPTY -> LogicalPredicate.and(
                leaf(column, ComparisonOperator.IS_NOT_NULL, null),
                leaf(column, ComparisonOperator.NOT_EQUALS, ""));
        };

        log.debug("Compiled filter '{}' to {}", filter, predicate);
        return predicate;
    }

    private Predicate buildDateRange(MemberFilter filter, MemberType memberType, ColumnRef column, Instant now) {
        if (filter.getOperator() != FilterOperator.IN_DATE_RANGE) {
            throw new InvalidFilterException("dateRange can only be used with operator 'inDateRange', got '"
                + filter.getOperator().getValue() + "'", filter.getMember());
        }
        if (!filter.getValues().isEmpty()) {
            throw new InvalidFilterException("Filter takes either values or a dateRange, not both", filter.getMember());
        }
        validateType(filter, memberType);
        if (now == null && !filter.getDateRange().isInterval()) {
            throw new IllegalArgumentException("Relative date range '" + filter.getDateRange()
                + "' needs a reference instant");
        }

        ResolvedDateRange range = dateRangeResolver.resolve(filter.getDateRange(), now);
        Predicate predicate = LogicalPredicate.and(
            leaf(column, ComparisonOperator.GREATER_THAN_OR_EQUAL, range.getStart()),
            leaf(column, ComparisonOperator.LESS_THAN_OR_EQUAL, range.getEnd()));
        log.debug("Compiled filter '{}' to {}", filter, predicate);
        return predicate;
    }

    private void validateArity(MemberFilter filter) {
        FilterOperator operator = filter.getOperator();
        int count = filter.getValues().size();
        if (operator.forbidsValues()) {
            if (count > 0) {
                throw new InvalidFilterException(
                    "Operator '" + operator.getValue() + "' does not take values", filter.getMember());
            }
            return;
        }
        if (count == 0) {
            throw new InvalidFilterException(
                "Operator '" + operator.getValue() + "' requires at least one value", filter.getMember());
        }
        if (count < operator.getMinValues() || (operator.getMaxValues() >= 0 && count > operator.getMaxValues())) {
            throw new InvalidFilterException(
                "Operator '" + operator.getValue() + "' takes " + describeArity(operator) + " but got " + count,
                filter.getMember());
        }
        for (Object value : filter.getValues()) {
            if (value == null) {
                throw new InvalidFilterException("Filter values must not be null", filter.getMember());
            }
        }
    }

    private void validateType(MemberFilter filter, MemberType type) {
        boolean compatible = switch (filter.getOperator()) {
            case EQUALS, NOT_EQUALS, IN, NOT_IN, SET, NOT_SET -> true;
            case CONTAINS, NOT_CONTAINS, STARTS_WITH, ENDS_WITH, IS_EMPTY, IS_NOT_EMPTY -> type == MemberType.STRING;
            case GT, GTE, LT, LTE, BETWEEN, NOT_BETWEEN -> type == MemberType.NUMBER || type == MemberType.TIME;
            case IN_DATE_RANGE, NOT_IN_DATE_RANGE, BEFORE_DATE, AFTER_DATE -> type == MemberType.TIME;
        };
        if (!compatible) {
            throw new InvalidFilterException("Operator '" + filter.getOperator().getValue()
                + "' cannot be applied to a " + type.getValue() + " member", filter.getMember());
        }
    }

    private List<Object> coerce(MemberFilter filter, MemberType type) {
        List<Object> coerced = new ArrayList<>();
        for (int i = 0; i < filter.getValues().size(); i++) {
            Object value = filter.getValues().get(i);
            boolean endOfDay = isUpperBound(filter.getOperator(), i);
            coerced.add(switch (type) {
                case STRING -> String.valueOf(value);
                case NUMBER -> toNumber(filter, value);
                case BOOLEAN -> toBoolean(filter, value);
                case TIME -> toInstant(filter, value, endOfDay);
            });
        }
        return coerced;
    }

    /**
     * Date-only values in an inclusive upper bound stand for the end of that day.
     */
    private static boolean isUpperBound(FilterOperator operator, int index) {
        return switch (operator) {
            case LTE -> true;
            case BETWEEN, NOT_BETWEEN -> index == 1;
            default -> false;
        };
    }

    private ResolvedDateRange dateRange(MemberFilter filter) {
        Instant start = toInstant(filter, filter.getValues().get(0), false);
        Instant end = toInstant(filter, filter.getValues().get(1), true);
        if (start.isAfter(end)) {
            throw new InvalidFilterException("Date range start is after its end", filter.getMember());
        }
        return new ResolvedDateRange(start, end);
    }

    private Instant toInstant(MemberFilter filter, Object value, boolean endOfDay) {
        try {
            return dateRangeResolver.toInstant(value, endOfDay);
        } catch (InvalidDateRangeException e) {
            throw new InvalidFilterException("Value '" + value + "' is not a valid date for operator '"
                + filter.getOperator().getValue() + "'", filter.getMember(), e);
        }
    }

    private static Object toNumber(MemberFilter filter, Object value) {
        if (value instanceof Number) {
            return value;
        }
        try {
            return new BigDecimal(String.valueOf(value).trim());
        } catch (NumberFormatException e) {
            throw new InvalidFilterException("Value '" + value + "' is not a number", filter.getMember());
        }
    }

    private static Object toBoolean(MemberFilter filter, Object value) {
        if (value instanceof Boolean) {
            return value;
        }
        String text = String.valueOf(value).trim();
        if ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text)) {
            return Boolean.valueOf(text);
        }
        throw new InvalidFilterException("Value '" + value + "' is not a boolean", filter.getMember());
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static void requireOrdered(MemberFilter filter, Object low, Object high) {
        int comparison;
        if (low instanceof Number && high instanceof Number) {
            comparison = new BigDecimal(low.toString()).compareTo(new BigDecimal(high.toString()));
        } else if (low instanceof Comparable && low.getClass() == high.getClass()) {
            comparison = ((Comparable) low).compareTo(high);
        } else {
            return;
        }
        if (comparison > 0) {
            throw new InvalidFilterException("Lower bound " + low + " is greater than upper bound " + high,
                filter.getMember());
        }
    }

    private static Predicate leaf(ColumnRef column, ComparisonOperator operator, Object value) {
        return new ComparisonPredicate(column, operator, value == null ? List.of() : List.of(value));
    }

    private static List<Predicate> leaves(ColumnRef column, ComparisonOperator operator, List<Object> values) {
        List<Predicate> leaves = new ArrayList<>();
        for (Object value : values) {
            leaves.add(leaf(column, operator, value));
        }
        return leaves;
    }

    private static String describeArity(FilterOperator operator) {
        if (operator.getMaxValues() < 0) {
            return "at least " + operator.getMinValues() + " value(s)";
        }
        return "exactly " + operator.getMaxValues() + " value(s)";
    }
}
