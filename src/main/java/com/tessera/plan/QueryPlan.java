package com.tessera.plan;

import com.tessera.query.predicate.LogicalPredicate;
import com.tessera.query.predicate.Predicate;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Backend-neutral description of the relational work a query needs.
 *
 * <p>A plan is immutable. The planner produces an unsecured plan; the
 * security injector derives a secured copy carrying one tenant predicate per
 * referenced cube. Only secured plans leave the compiler.
 */
public final class QueryPlan {
    private final String primaryCube;
    private final List<JoinStep> joins;
    private final List<GroupingKey> groupingKeys;
    private final List<AggregateExpression> aggregates;
    private final Predicate userPredicate;
    private final Predicate havingPredicate;
    private final Map<String, Predicate> tenantPredicates;
    private final List<OrderByItem> orderBy;
    private final Integer limit;
    private final Integer offset;
    private final int rowLimitHint;
    private final Instant resolvedAt;

    private QueryPlan(Builder builder) {
        this.primaryCube = builder.primaryCube;
        this.joins = Collections.unmodifiableList(new ArrayList<>(builder.joins));
        this.groupingKeys = Collections.unmodifiableList(new ArrayList<>(builder.groupingKeys));
        this.aggregates = Collections.unmodifiableList(new ArrayList<>(builder.aggregates));
        this.userPredicate = builder.userPredicate;
        this.havingPredicate = builder.havingPredicate;
        this.tenantPredicates = Collections.unmodifiableMap(new LinkedHashMap<>(builder.tenantPredicates));
        this.orderBy = Collections.unmodifiableList(new ArrayList<>(builder.orderBy));
        this.limit = builder.limit;
        this.offset = builder.offset;
        this.rowLimitHint = builder.rowLimitHint;
        this.resolvedAt = builder.resolvedAt;
    }

    public static Builder builder(String primaryCube) {
        return new Builder(primaryCube);
    }

    public String getPrimaryCube() {
        return primaryCube;
    }

    public List<JoinStep> getJoins() {
        return joins;
    }

    public List<GroupingKey> getGroupingKeys() {
        return groupingKeys;
    }

    public List<AggregateExpression> getAggregates() {
        return aggregates;
    }

    /**
     * User filters on dimensions AND the resolved time bounds, or null.
     */
    public Predicate getUserPredicate() {
        return userPredicate;
    }

    /**
     * Post-aggregation conditions over measure aliases, or null.
     */
    public Predicate getHavingPredicate() {
        return havingPredicate;
    }

    public Map<String, Predicate> getTenantPredicates() {
        return tenantPredicates;
    }

    /**
     * The WHERE condition: the primary cube's tenant predicate AND the user
     * predicate. Joined cubes are scoped by {@link #getJoinTenantPredicate}
     * instead, so a LEFT join keeps rows without a match. Null only for an
     * unsecured plan without filters.
     */
    public Predicate getFilterPredicate() {
        return LogicalPredicate.and(tenantPredicates.get(primaryCube), userPredicate);
    }

    /**
     * Tenant predicate the executor adds to the join condition of the given
     * step, or null for an unsecured plan.
     */
    public Predicate getJoinTenantPredicate(JoinStep join) {
        return tenantPredicates.get(join.getToCube());
    }

    public List<OrderByItem> getOrderBy() {
        return orderBy;
    }

    public Integer getLimit() {
        return limit;
    }

    public Integer getOffset() {
        return offset;
    }

    /**
     * Advisory row cap for the executor; 0 means none.
     */
    public int getRowLimitHint() {
        return rowLimitHint;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    /**
     * The primary cube followed by every joined cube, in join order.
     */
    public Set<String> getReferencedCubes() {
        Set<String> cubes = new LinkedHashSet<>();
        cubes.add(primaryCube);
        joins.forEach(j -> cubes.add(j.getToCube()));
        return cubes;
    }

    /**
     * True when every referenced cube carries a tenant predicate.
     */
    public boolean isSecured() {
        return tenantPredicates.keySet().containsAll(getReferencedCubes());
    }

    /**
     * Copy of this plan with the given tenant predicates attached.
     */
    public QueryPlan withTenantPredicates(Map<String, Predicate> predicates) {
        Builder builder = toBuilder();
        builder.tenantPredicates = new LinkedHashMap<>(predicates);
        return builder.build();
    }

    private Builder toBuilder() {
        Builder builder = new Builder(primaryCube);
        builder.joins = joins;
        builder.groupingKeys = groupingKeys;
        builder.aggregates = aggregates;
        builder.userPredicate = userPredicate;
        builder.havingPredicate = havingPredicate;
        builder.tenantPredicates = tenantPredicates;
        builder.orderBy = orderBy;
        builder.limit = limit;
        builder.offset = offset;
        builder.rowLimitHint = rowLimitHint;
        builder.resolvedAt = resolvedAt;
        return builder;
    }

    @Override
    public String toString() {
        return "QueryPlan{" +
            "primaryCube='" + primaryCube + '\'' +
            ", joins=" + joins +
            ", groupingKeys=" + groupingKeys +
            ", aggregates=" + aggregates +
            ", secured=" + isSecured() +
            '}';
    }

    public static final class Builder {
        private final String primaryCube;
        private List<JoinStep> joins = List.of();
        private List<GroupingKey> groupingKeys = List.of();
        private List<AggregateExpression> aggregates = List.of();
        private Predicate userPredicate;
        private Predicate havingPredicate;
        private Map<String, Predicate> tenantPredicates = Map.of();
        private List<OrderByItem> orderBy = List.of();
        private Integer limit;
        private Integer offset;
        private int rowLimitHint;
        private Instant resolvedAt;

        private Builder(String primaryCube) {
            this.primaryCube = primaryCube;
        }

        public Builder joins(List<JoinStep> joins) {
            this.joins = joins;
            return this;
        }

        public Builder groupingKeys(List<GroupingKey> groupingKeys) {
            this.groupingKeys = groupingKeys;
            return this;
        }

        public Builder aggregates(List<AggregateExpression> aggregates) {
            this.aggregates = aggregates;
            return this;
        }

        public Builder userPredicate(Predicate userPredicate) {
            this.userPredicate = userPredicate;
            return this;
        }

        public Builder havingPredicate(Predicate havingPredicate) {
            this.havingPredicate = havingPredicate;
            return this;
        }

        public Builder orderBy(List<OrderByItem> orderBy) {
            this.orderBy = orderBy;
            return this;
        }

        public Builder limit(Integer limit) {
            this.limit = limit;
            return this;
        }

        public Builder offset(Integer offset) {
            this.offset = offset;
            return this;
        }

        public Builder rowLimitHint(int rowLimitHint) {
            this.rowLimitHint = rowLimitHint;
            return this;
        }

        public Builder resolvedAt(Instant resolvedAt) {
            this.resolvedAt = resolvedAt;
            return this;
        }

        public QueryPlan build() {
            return new QueryPlan(this);
        }
    }
}
