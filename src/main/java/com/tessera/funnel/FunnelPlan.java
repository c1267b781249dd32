package com.tessera.funnel;

import com.tessera.plan.JoinStep;
import com.tessera.query.predicate.ColumnRef;
import com.tessera.query.predicate.LogicalPredicate;
import com.tessera.query.predicate.Predicate;
import com.tessera.query.predicate.Predicates;
import com.tessera.query.time.ResolvedDateRange;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * What the execution collaborator needs to fetch funnel rows: rows of the
 * event-stream cube matching any step, scoped to the tenant and the optional
 * date range, returned ordered by (binding key, time). A row that satisfies
 * several step predicates is returned once per matching step.
 */
public final class FunnelPlan {
    private final FunnelDefinition definition;
    private final String cube;
    private final ColumnRef bindingKeyColumn;
    private final ColumnRef timeColumn;
    private final List<JoinStep> joins;
    private final List<Predicate> stepPredicates;
    private final Map<String, Predicate> tenantPredicates;
    private final ResolvedDateRange dateRange;
    private final Instant resolvedAt;

    FunnelPlan(FunnelDefinition definition, String cube, ColumnRef bindingKeyColumn, ColumnRef timeColumn,
               List<JoinStep> joins, List<Predicate> stepPredicates, Map<String, Predicate> tenantPredicates,
               ResolvedDateRange dateRange, Instant resolvedAt) {
        this.definition = definition;
        this.cube = cube;
        this.bindingKeyColumn = bindingKeyColumn;
        this.timeColumn = timeColumn;
        this.joins = Collections.unmodifiableList(new ArrayList<>(joins));
        this.stepPredicates = Collections.unmodifiableList(new ArrayList<>(stepPredicates));
        this.tenantPredicates = Collections.unmodifiableMap(new LinkedHashMap<>(tenantPredicates));
        this.dateRange = dateRange;
        this.resolvedAt = resolvedAt;
    }

    public FunnelDefinition getDefinition() {
        return definition;
    }

    public String getCube() {
        return cube;
    }

    public ColumnRef getBindingKeyColumn() {
        return bindingKeyColumn;
    }

    public ColumnRef getTimeColumn() {
        return timeColumn;
    }

    public List<JoinStep> getJoins() {
        return joins;
    }

    /**
     * Row condition per step, in step order. The executor emits one
     * {@link FunnelEvent} for every (row, step) pair whose predicate holds.
     */
    public List<Predicate> getStepPredicates() {
        return stepPredicates;
    }

    public Map<String, Predicate> getTenantPredicates() {
        return tenantPredicates;
    }

    public ResolvedDateRange getDateRange() {
        return dateRange;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    /**
     * Tenant predicates AND the date bounds AND (any step predicate).
     */
    public Predicate getFilterPredicate() {
        List<Predicate> parts = new ArrayList<>(tenantPredicates.values());
        if (dateRange != null) {
            parts.add(Predicates.greaterThanOrEqual(timeColumn, dateRange.getStart()));
            parts.add(Predicates.lessThanOrEqual(timeColumn, dateRange.getEnd()));
        }
        parts.add(LogicalPredicate.or(stepPredicates));
        return LogicalPredicate.and(parts);
    }

    /**
     * Rows must arrive grouped by entity and in time order within each entity.
     */
    public List<ColumnRef> getOrderBy() {
        return List.of(bindingKeyColumn, timeColumn);
    }

    @Override
    public String toString() {
        return "FunnelPlan{cube='" + cube + "', steps=" + stepPredicates.size()
            + ", tenantCubes=" + tenantPredicates.keySet() + '}';
    }
}
