package com.tessera.plan;

import com.tessera.query.SortDirection;
import com.tessera.query.TimeGranularity;
import com.tessera.query.predicate.ColumnRef;
import com.tessera.query.predicate.ComparisonOperator;
import com.tessera.query.predicate.ComparisonPredicate;
import com.tessera.query.predicate.LogicalPredicate;
import com.tessera.query.predicate.Predicate;
import com.tessera.query.predicate.Predicates;
import com.tessera.schema.JoinRelationship;
import com.tessera.schema.MeasureType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for PlanExplainer
 */
@DisplayName("PlanExplainer Tests")
class PlanExplainerTest {

    private static final ColumnRef STATUS = ColumnRef.of("Orders", "status");
    private static final ColumnRef CREATED_AT = ColumnRef.of("Orders", "created_at");

    private PlanExplainer explainer;

    @BeforeEach
    void setUp() {
        explainer = new PlanExplainer();
    }

    @Test
    @DisplayName("Should render a secured plan with joins, grouping and pagination")
    void shouldRenderSecuredPlan() {
        // Given
        Map<String, Predicate> tenants = new LinkedHashMap<>();
        tenants.put("Orders", Predicates.equalTo(ColumnRef.of("Orders", "organisation_id"), 42));
        tenants.put("Customers", Predicates.equalTo(ColumnRef.of("Customers", "organisation_id"), 42));

        QueryPlan plan = QueryPlan.builder("Orders")
            .joins(List.of(new JoinStep("Orders", "Customers", JoinRelationship.BELONGS_TO,
                ColumnRef.of("Orders", "customer_id"), ColumnRef.of("Customers", "id"))))
            .groupingKeys(List.of(
                new GroupingKey("Customers.country", ColumnRef.of("Customers", "country"), null),
                new GroupingKey("Orders.createdAt", CREATED_AT, TimeGranularity.MONTH)))
            .aggregates(List.of(new AggregateExpression("Orders.revenue", MeasureType.SUM,
                ColumnRef.of("Orders", "amount"), null)))
            .userPredicate(Predicates.equalTo(STATUS, "completed"))
            .orderBy(List.of(new OrderByItem("Orders.revenue", SortDirection.DESC)))
            .limit(10)
            .offset(20)
            .build()
            .withTenantPredicates(tenants);

        // When
        String sql = explainer.explain(plan);

        // Then
        assertThat(sql).isEqualTo("SELECT Customers.country AS \"Customers.country\", "
            + "DATE_TRUNC('month', Orders.created_at) AS \"Orders.createdAt.month\", "
            + "SUM(Orders.amount) AS \"Orders.revenue\" "
            + "FROM Orders INNER JOIN Customers ON Orders.customer_id = Customers.id "
            + "AND Customers.organisation_id = 42 "
            + "WHERE (Orders.organisation_id = 42 AND Orders.status = 'completed') "
            + "GROUP BY Customers.country, DATE_TRUNC('month', Orders.created_at) "
            + "ORDER BY \"Orders.revenue\" DESC LIMIT 10 OFFSET 20");
    }

    @Test
    @DisplayName("Should render row counts, distinct counts and filtered measures")
    void shouldRenderAggregates() {
        QueryPlan plan = QueryPlan.builder("Orders")
            .aggregates(List.of(
                new AggregateExpression("Orders.count", MeasureType.COUNT, null, null),
                new AggregateExpression("Orders.uniqueCustomers", MeasureType.COUNT_DISTINCT,
                    ColumnRef.of("Orders", "customer_id"), null),
                new AggregateExpression("Orders.completedCount", MeasureType.COUNT, null,
                    Predicates.equalTo(STATUS, "completed"))))
            .build();

        String sql = explainer.explain(plan);

        assertThat(sql).isEqualTo("SELECT COUNT(*) AS \"Orders.count\", "
            + "COUNT(DISTINCT Orders.customer_id) AS \"Orders.uniqueCustomers\", "
            + "COUNT(CASE WHEN Orders.status = 'completed' THEN 1 END) AS \"Orders.completedCount\" "
            + "FROM Orders");
    }

    @Test
    @DisplayName("Should render HAVING conditions against measure aliases")
    void shouldRenderHaving() {
        QueryPlan plan = QueryPlan.builder("Orders")
            .groupingKeys(List.of(new GroupingKey("Orders.status", STATUS, null)))
            .aggregates(List.of(new AggregateExpression("Orders.count", MeasureType.COUNT, null, null)))
            .havingPredicate(new ComparisonPredicate(ColumnRef.of("Orders", "count"),
                ComparisonOperator.GREATER_THAN, List.of(5)))
            .build();

        assertThat(explainer.explain(plan))
            .contains(" GROUP BY Orders.status HAVING Orders.count > 5");
    }

    @Test
    @DisplayName("Should group dimension-only plans")
    void shouldGroupWithoutAggregates() {
        QueryPlan plan = QueryPlan.builder("Orders")
            .groupingKeys(List.of(new GroupingKey("Orders.status", STATUS, null)))
            .build();

        assertThat(explainer.explain(plan))
            .isEqualTo("SELECT Orders.status AS \"Orders.status\" FROM Orders GROUP BY Orders.status");
    }

    @Test
    @DisplayName("Should scope a LEFT-joined cube in its join condition only")
    void shouldScopeLeftJoinInOnClause() {
        // Given: customers with their orders, where customers without orders must survive
        Map<String, Predicate> tenants = new LinkedHashMap<>();
        tenants.put("Customers", Predicates.equalTo(ColumnRef.of("Customers", "organisation_id"), 7));
        tenants.put("Orders", Predicates.equalTo(ColumnRef.of("Orders", "organisation_id"), 7));
        QueryPlan plan = QueryPlan.builder("Customers")
            .joins(List.of(new JoinStep("Customers", "Orders", JoinRelationship.HAS_MANY,
                ColumnRef.of("Customers", "id"), ColumnRef.of("Orders", "customer_id"))))
            .groupingKeys(List.of(new GroupingKey("Orders.status", STATUS, null)))
            .aggregates(List.of(new AggregateExpression("Customers.count", MeasureType.COUNT, null, null)))
            .build()
            .withTenantPredicates(tenants);

        // When
        String sql = explainer.explain(plan);

        // Then
        assertThat(sql).isEqualTo("SELECT Orders.status AS \"Orders.status\", COUNT(*) AS \"Customers.count\" "
            + "FROM Customers LEFT JOIN Orders ON Customers.id = Orders.customer_id "
            + "AND Orders.organisation_id = 7 "
            + "WHERE Customers.organisation_id = 7 "
            + "GROUP BY Orders.status");
        assertThat(plan.getFilterPredicate()).isEqualTo(tenants.get("Customers"));
        assertThat(plan.getJoinTenantPredicate(plan.getJoins().get(0))).isEqualTo(tenants.get("Orders"));
    }

    @Test
    @DisplayName("Should render comparison operators")
    void shouldRenderComparisons() {
        assertThat(explainer.buildExpressionSql(Predicates.in(STATUS, List.of("a", "b"))))
            .isEqualTo("Orders.status IN ('a', 'b')");
        assertThat(explainer.buildExpressionSql(
                new ComparisonPredicate(STATUS, ComparisonOperator.CONTAINS, List.of("pend"))))
            .isEqualTo("Orders.status LIKE '%pend%'");
        assertThat(explainer.buildExpressionSql(
                new ComparisonPredicate(STATUS, ComparisonOperator.STARTS_WITH, List.of("ship"))))
            .isEqualTo("Orders.status LIKE 'ship%'");
        assertThat(explainer.buildExpressionSql(Predicates.isNotNull(STATUS)))
            .isEqualTo("Orders.status IS NOT NULL");
        assertThat(explainer.buildExpressionSql(
                Predicates.greaterThanOrEqual(CREATED_AT, Instant.parse("2024-01-01T00:00:00Z"))))
            .isEqualTo("Orders.created_at >= '2024-01-01 00:00:00.000'");
    }

    @Test
    @DisplayName("Should render nested logic and escape quotes")
    void shouldRenderLogic() {
        Predicate predicate = LogicalPredicate.or(
            Predicates.equalTo(STATUS, "o'neil"),
            LogicalPredicate.not(Predicates.equalTo(ColumnRef.of("Orders", "is_paid"), true)));

        assertThat(explainer.buildExpressionSql(predicate))
            .isEqualTo("(Orders.status = 'o''neil' OR NOT Orders.is_paid = true)");
    }
}
