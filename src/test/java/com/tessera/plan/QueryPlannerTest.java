package com.tessera.plan;

import com.tessera.TestCubes;
import com.tessera.error.InvalidFilterException;
import com.tessera.error.InvalidMemberUsageException;
import com.tessera.error.UnreachableCubeException;
import com.tessera.query.DateRangeExpression;
import com.tessera.query.FilterOperator;
import com.tessera.query.LogicalFilter;
import com.tessera.query.MemberFilter;
import com.tessera.query.Query;
import com.tessera.query.QueryNormalizer;
import com.tessera.query.SortDirection;
import com.tessera.query.TimeGranularity;
import com.tessera.query.predicate.ColumnRef;
import com.tessera.query.predicate.ComparisonOperator;
import com.tessera.query.predicate.ComparisonPredicate;
import com.tessera.query.predicate.LogicalPredicate;
import com.tessera.query.predicate.PredicateBuilder;
import com.tessera.query.predicate.Predicates;
import com.tessera.query.time.DateRangeResolver;
import com.tessera.schema.MeasureType;
import com.tessera.schema.SchemaRegistry;
import com.tessera.security.SecurityInjector;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for QueryPlanner
 */
@DisplayName("QueryPlanner Tests")
class QueryPlannerTest {

    private SchemaRegistry registry;
    private QueryNormalizer normalizer;
    private QueryPlanner planner;

    @BeforeEach
    void setUp() {
        DateRangeResolver dateRangeResolver = new DateRangeResolver();
        registry = TestCubes.registry();
        normalizer = new QueryNormalizer(dateRangeResolver);
        planner = new QueryPlanner(new PredicateBuilder(dateRangeResolver), new JoinPathResolver(), 0);
    }

    private QueryPlan plan(Query query) {
        return planner.plan(normalizer.normalize(query, registry, TestCubes.NOW), registry);
    }

    @Test
    @DisplayName("Should plan a single-cube query")
    void shouldPlanSingleCubeQuery() {
        // Given
        Query query = Query.builder()
            .measures("Orders.count")
            .dimensions("Orders.status")
            .build();

        // When
        QueryPlan plan = plan(query);

        // Then
        assertThat(plan.getPrimaryCube()).isEqualTo("Orders");
        assertThat(plan.getJoins()).isEmpty();
        assertThat(plan.getGroupingKeys()).extracting(GroupingKey::getAlias).containsExactly("Orders.status");
        assertThat(plan.getAggregates()).hasSize(1);
        AggregateExpression count = plan.getAggregates().get(0);
        assertThat(count.getFunction()).isEqualTo(MeasureType.COUNT);
        assertThat(count.getColumn()).isNull();
        assertThat(plan.getUserPredicate()).isNull();
        assertThat(plan.getHavingPredicate()).isNull();
        assertThat(plan.isSecured()).isFalse();
        assertThat(plan.getResolvedAt()).isEqualTo(TestCubes.NOW);
    }

    @Test
    @DisplayName("Should order by the first measure descending when no order is given")
    void shouldDefaultOrderToFirstMeasure() {
        QueryPlan plan = plan(Query.builder()
            .measures("Orders.revenue", "Orders.count")
            .dimensions("Orders.status")
            .build());

        assertThat(plan.getOrderBy()).hasSize(1);
        assertThat(plan.getOrderBy().get(0).getMember()).isEqualTo("Orders.revenue");
        assertThat(plan.getOrderBy().get(0).isAscending()).isFalse();
    }

    @Test
    @DisplayName("Should order by the first dimension ascending for dimension-only queries")
    void shouldDefaultOrderToFirstDimension() {
        QueryPlan plan = plan(Query.builder().dimensions("Orders.status").build());

        assertThat(plan.getAggregates()).isEmpty();
        assertThat(plan.getOrderBy().get(0).getMember()).isEqualTo("Orders.status");
        assertThat(plan.getOrderBy().get(0).isAscending()).isTrue();
    }

    @Test
    @DisplayName("Should keep an explicit order as given")
    void shouldKeepExplicitOrder() {
        QueryPlan plan = plan(Query.builder()
            .measures("Orders.count")
            .dimensions("Orders.status")
            .order("Orders.status", SortDirection.ASC)
            .order("Orders.count", SortDirection.DESC)
            .build());

        assertThat(plan.getOrderBy()).extracting(OrderByItem::getMember)
            .containsExactly("Orders.status", "Orders.count");
        assertThat(plan.getOrderBy()).extracting(OrderByItem::isAscending).containsExactly(true, false);
    }

    @Test
    @DisplayName("Should reject ordering by a measure that is not selected")
    void shouldRejectOrderByUnselectedMeasure() {
        Query query = Query.builder()
            .measures("Orders.count")
            .order("Orders.revenue", SortDirection.DESC)
            .build();

        assertThatThrownBy(() -> plan(query))
            .isInstanceOf(InvalidMemberUsageException.class)
            .hasMessageContaining("Cannot order by")
            .extracting("member").isEqualTo("Orders.revenue");
    }

    @Test
    @DisplayName("Should order a time dimension by its truncated alias")
    void shouldOrderTimeDimensionByAlias() {
        QueryPlan plan = plan(Query.builder()
            .measures("Orders.count")
            .timeDimension("Orders.createdAt", TimeGranularity.MONTH, null)
            .order("Orders.createdAt", SortDirection.ASC)
            .build());

        assertThat(plan.getOrderBy()).extracting(OrderByItem::getMember)
            .containsExactly("Orders.createdAt.month");
    }

    @Test
    @DisplayName("Should reject ordering by a time dimension that only bounds the rows")
    void shouldRejectOrderByUngroupedTimeDimension() {
        Query query = Query.builder()
            .measures("Orders.count")
            .timeDimension("Orders.createdAt", null, DateRangeExpression.of("today"))
            .order("Orders.createdAt", SortDirection.ASC)
            .build();

        assertThatThrownBy(() -> plan(query)).isInstanceOf(InvalidMemberUsageException.class);
    }

    @Test
    @DisplayName("Should join cubes of selected dimensions")
    void shouldJoinSelectedCubes() {
        QueryPlan plan = plan(Query.builder()
            .measures("Orders.revenue")
            .dimensions("Customers.country")
            .build());

        assertThat(plan.getJoins()).extracting(JoinStep::getToCube).containsExactly("Customers");
        assertThat(plan.getReferencedCubes()).containsExactly("Orders", "Customers");
    }

    @Test
    @DisplayName("Should join cubes referenced only by filters")
    void shouldJoinFilterCubes() {
        QueryPlan plan = plan(Query.builder()
            .measures("Orders.count")
            .filter(MemberFilter.of("Customers.country", FilterOperator.EQUALS, "DE"))
            .build());

        assertThat(plan.getJoins()).extracting(JoinStep::getToCube).containsExactly("Customers");
        assertThat(plan.getUserPredicate()).isEqualTo(new ComparisonPredicate(
            ColumnRef.of("Customers", "country"), ComparisonOperator.EQUALS, List.of("DE")));
    }

    @Test
    @DisplayName("Should keep joined tenant predicates out of the WHERE condition of a reversed join")
    void shouldScopeReversedJoinInJoinCondition() {
        // Given: Orders belongsTo Customers, walked from the Customers side
        QueryPlan plan = plan(Query.builder()
            .measures("Customers.count")
            .dimensions("Orders.status")
            .build());

        // When
        QueryPlan secured = new SecurityInjector().inject(plan, TestCubes.tenant(7), registry);

        // Then
        JoinStep join = secured.getJoins().get(0);
        assertThat(join.toString()).isEqualTo("Customers -hasMany-> Orders");
        assertThat(join.getJoinType()).isEqualTo(JoinType.LEFT);
        assertThat(secured.getFilterPredicate())
            .isEqualTo(Predicates.equalTo(ColumnRef.of("Customers", "organisation_id"), 7));
        assertThat(secured.getJoinTenantPredicate(join))
            .isEqualTo(Predicates.equalTo(ColumnRef.of("Orders", "organisation_id"), 7));
    }

    @Test
    @DisplayName("Should resolve a relative date range on a filter against the query instant")
    void shouldResolveFilterDateRange() {
        QueryPlan plan = plan(Query.builder()
            .measures("Orders.count")
            .filter(MemberFilter.inDateRange("Orders.createdAt", DateRangeExpression.of("last 7 days")))
            .build());

        ColumnRef createdAt = ColumnRef.of("Orders", "created_at");
        assertThat(plan.getUserPredicate()).isEqualTo(LogicalPredicate.and(
            Predicates.greaterThanOrEqual(createdAt, TestCubes.NOW.minus(Duration.ofDays(7))),
            Predicates.lessThanOrEqual(createdAt, TestCubes.NOW)));
    }

    @Test
    @DisplayName("Should turn measure filters into HAVING conditions")
    void shouldPlanMeasureFilterAsHaving() {
        QueryPlan plan = plan(Query.builder()
            .measures("Orders.count")
            .dimensions("Orders.status")
            .filter(MemberFilter.of("Orders.revenue", FilterOperator.GT, 100))
            .build());

        assertThat(plan.getUserPredicate()).isNull();
        assertThat(plan.getHavingPredicate()).isEqualTo(new ComparisonPredicate(
            ColumnRef.of("Orders", "revenue"), ComparisonOperator.GREATER_THAN, List.of(100)));
        assertThat(plan.getAggregates()).extracting(AggregateExpression::getAlias)
            .containsExactly("Orders.count", "Orders.revenue");
    }

    @Test
    @DisplayName("Should reject a filter group mixing measures and dimensions")
    void shouldRejectMixedFilterGroup() {
        Query query = Query.builder()
            .measures("Orders.count")
            .filter(LogicalFilter.or(List.of(
                MemberFilter.of("Orders.revenue", FilterOperator.GT, 100),
                MemberFilter.of("Orders.status", FilterOperator.EQUALS, "completed"))))
            .build();

        assertThatThrownBy(() -> plan(query))
            .isInstanceOf(InvalidFilterException.class)
            .hasMessageContaining("mixes measures and dimensions");
    }

    @Test
    @DisplayName("Should group by truncated time and bound the rows by the date range")
    void shouldPlanTimeDimension() {
        QueryPlan plan = plan(Query.builder()
            .measures("Orders.count")
            .timeDimension("Orders.createdAt", TimeGranularity.MONTH,
                DateRangeExpression.between("2024-01-01", "2024-12-31"))
            .build());

        ColumnRef createdAt = ColumnRef.of("Orders", "created_at");
        assertThat(plan.getGroupingKeys()).hasSize(1);
        GroupingKey key = plan.getGroupingKeys().get(0);
        assertThat(key.isTruncated()).isTrue();
        assertThat(key.getAlias()).isEqualTo("Orders.createdAt.month");
        assertThat(plan.getUserPredicate()).isEqualTo(LogicalPredicate.and(
            Predicates.greaterThanOrEqual(createdAt, Instant.parse("2024-01-01T00:00:00Z")),
            Predicates.lessThanOrEqual(createdAt, Instant.parse("2024-12-31T23:59:59.999Z"))));
    }

    @Test
    @DisplayName("Should filter by date range without grouping when no granularity is given")
    void shouldFilterWithoutGranularity() {
        QueryPlan plan = plan(Query.builder()
            .measures("Orders.count")
            .timeDimension("Orders.createdAt", null, DateRangeExpression.of("today"))
            .build());

        assertThat(plan.getGroupingKeys()).isEmpty();
        assertThat(plan.getUserPredicate()).isInstanceOf(LogicalPredicate.class);
    }

    @Test
    @DisplayName("Should fail when a selected cube cannot be joined")
    void shouldFailOnUnreachableCube() {
        Query query = Query.builder()
            .measures("Orders.count")
            .dimensions("Products.sku")
            .build();

        assertThatThrownBy(() -> plan(query)).isInstanceOf(UnreachableCubeException.class);
    }

    @Test
    @DisplayName("Should carry pagination and the row limit hint")
    void shouldCarryPaginationAndHint() {
        DateRangeResolver dateRangeResolver = new DateRangeResolver();
        QueryPlanner hinted = new QueryPlanner(new PredicateBuilder(dateRangeResolver), new JoinPathResolver(), 5000);

        QueryPlan plan = hinted.plan(normalizer.normalize(Query.builder()
            .measures("Orders.count")
            .limit(10)
            .offset(20)
            .build(), registry, TestCubes.NOW), registry);

        assertThat(plan.getLimit()).isEqualTo(10);
        assertThat(plan.getOffset()).isEqualTo(20);
        assertThat(plan.getRowLimitHint()).isEqualTo(5000);
    }
}
