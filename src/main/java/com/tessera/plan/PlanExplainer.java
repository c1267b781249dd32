package com.tessera.plan;

import com.tessera.query.predicate.ComparisonPredicate;
import com.tessera.query.predicate.LogicalPredicate;
import com.tessera.query.predicate.Predicate;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders a plan as SQL-like text for logging and debugging.
 *
 * The output is not meant to be executed: columns are printed as
 * {@code Cube.column} and cubes are referenced by name.
 */
@Component
public class PlanExplainer {

    private static final DateTimeFormatter DATETIME_FORMATTER =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS").withZone(ZoneOffset.UTC);

    public String explain(QueryPlan plan) {
        StringBuilder sql = new StringBuilder();

        // SELECT clause
        sql.append("SELECT ");
        sql.append(buildSelect(plan));

        // FROM / JOIN clauses
        sql.append(" FROM ").append(plan.getPrimaryCube());
        for (JoinStep join : plan.getJoins()) {
            sql.append(' ').append(join.getJoinType().name()).append(" JOIN ").append(join.getToCube());
            sql.append(" ON ").append(join.getFromColumn()).append(" = ").append(join.getToColumn());
            Predicate tenant = plan.getJoinTenantPredicate(join);
            if (tenant != null) {
                sql.append(" AND ").append(buildExpressionSql(tenant));
            }
        }

        // Joined cubes carry their tenant predicate in the ON clause
        Predicate where = plan.getFilterPredicate();
        if (where != null) {
            sql.append(" WHERE ").append(buildExpressionSql(where));
        }

        if (!plan.getGroupingKeys().isEmpty()) {
            sql.append(" GROUP BY ");
            sql.append(plan.getGroupingKeys().stream()
                .map(PlanExplainer::groupingExpression)
                .collect(Collectors.joining(", ")));
        }

        if (plan.getHavingPredicate() != null) {
            sql.append(" HAVING ").append(buildExpressionSql(plan.getHavingPredicate()));
        }

        if (!plan.getOrderBy().isEmpty()) {
            sql.append(" ORDER BY ").append(buildOrderByClause(plan.getOrderBy()));
        }

        if (plan.getLimit() != null) {
            sql.append(" LIMIT ").append(plan.getLimit());
        }
        if (plan.getOffset() != null && plan.getOffset() > 0) {
            sql.append(" OFFSET ").append(plan.getOffset());
        }

        return sql.toString();
    }

    private String buildSelect(QueryPlan plan) {
        List<String> columns = plan.getGroupingKeys().stream()
            .map(key -> groupingExpression(key) + " AS \"" + key.getAlias() + "\"")
            .collect(Collectors.toList());
        for (AggregateExpression aggregate : plan.getAggregates()) {
            columns.add(buildAggregationFunction(aggregate) + " AS \"" + aggregate.getAlias() + "\"");
        }
        return columns.isEmpty() ? "*" : String.join(", ", columns);
    }

    private static String groupingExpression(GroupingKey key) {
        if (key.isTruncated()) {
            return "DATE_TRUNC('" + key.getGranularity().getValue() + "', " + key.getColumn() + ")";
        }
        return key.getColumn().toString();
    }

    /**
     * Filtered measures aggregate a CASE expression so that only matching
     * rows contribute.
     */
    private String buildAggregationFunction(AggregateExpression aggregate) {
        String operand = aggregate.getColumn() != null ? aggregate.getColumn().toString() : null;
        if (aggregate.getFilter() != null) {
            String condition = buildExpressionSql(aggregate.getFilter());
            operand = "CASE WHEN " + condition + " THEN " + (operand != null ? operand : "1") + " END";
        }
        return switch (aggregate.getFunction()) {
            case COUNT -> "COUNT(" + (operand != null ? operand : "*") + ")";
            case COUNT_DISTINCT -> "COUNT(DISTINCT " + operand + ")";
            case SUM -> "SUM(" + operand + ")";
            case AVG -> "AVG(" + operand + ")";
            case MIN -> "MIN(" + operand + ")";
            case MAX -> "MAX(" + operand + ")";
        };
    }

    String buildExpressionSql(Predicate predicate) {
        if (predicate instanceof LogicalPredicate) {
            LogicalPredicate logical = (LogicalPredicate) predicate;
            List<String> operands = logical.getOperands().stream()
                .map(this::buildExpressionSql)
                .collect(Collectors.toList());
            return switch (logical.getOperator()) {
                case AND -> "(" + String.join(" AND ", operands) + ")";
                case OR -> "(" + String.join(" OR ", operands) + ")";
                case NOT -> "NOT " + operands.get(0);
            };
        } else if (predicate instanceof ComparisonPredicate) {
            return buildComparisonSql((ComparisonPredicate) predicate);
        }
        throw new IllegalArgumentException("Unsupported predicate: " + predicate.getClass().getName());
    }

    private String buildComparisonSql(ComparisonPredicate comparison) {
        String field = comparison.getColumn().toString();
        return switch (comparison.getOperator()) {
            case IS_NULL -> field + " IS NULL";
            case IS_NOT_NULL -> field + " IS NOT NULL";
            case IN, NOT_IN -> field + " " + comparison.getOperator().getSymbol() + " ("
                + comparison.getValues().stream().map(PlanExplainer::literal).collect(Collectors.joining(", ")) + ")";
            case CONTAINS -> field + " LIKE " + likePattern("%", comparison.getValue(), "%");
            case NOT_CONTAINS -> field + " NOT LIKE " + likePattern("%", comparison.getValue(), "%");
            case STARTS_WITH -> field + " LIKE " + likePattern("", comparison.getValue(), "%");
            case ENDS_WITH -> field + " LIKE " + likePattern("%", comparison.getValue(), "");
            default -> field + " " + comparison.getOperator().getSymbol() + " " + literal(comparison.getValue());
        };
    }

    private static String likePattern(String prefix, Object value, String suffix) {
        return "'" + prefix + escape(String.valueOf(value)) + suffix + "'";
    }

    private static String literal(Object value) {
        if (value instanceof Number || value instanceof Boolean) {
            return value.toString();
        }
        if (value instanceof Instant) {
            return "'" + DATETIME_FORMATTER.format((Instant) value) + "'";
        }
        return "'" + escape(String.valueOf(value)) + "'";
    }

    private static String escape(String value) {
        return value.replace("'", "''");
    }

    private String buildOrderByClause(List<OrderByItem> items) {
        StringBuilder orderBy = new StringBuilder();

        for (int i = 0; i < items.size(); i++) {
            if (i > 0) orderBy.append(", ");
            OrderByItem item = items.get(i);
            orderBy.append('"').append(item.getMember()).append('"');
            orderBy.append(" ");
            orderBy.append(item.isAscending() ? "ASC" : "DESC");
        }

        return orderBy.toString();
    }
}
