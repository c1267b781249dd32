package com.tessera.plan;

import com.tessera.error.InvalidFilterException;
import com.tessera.query.Filter;
import com.tessera.query.NormalizedQuery;
import com.tessera.query.ResolvedTimeDimension;
import com.tessera.query.SortDirection;
import com.tessera.query.predicate.ColumnRef;
import com.tessera.query.predicate.FilterTarget;
import com.tessera.query.predicate.LogicalPredicate;
import com.tessera.query.predicate.Predicate;
import com.tessera.query.predicate.PredicateBuilder;
import com.tessera.query.predicate.Predicates;
import com.tessera.query.time.ResolvedDateRange;
import com.tessera.schema.CubeMember;
import com.tessera.schema.Dimension;
import com.tessera.schema.Measure;
import com.tessera.schema.MemberReference;
import com.tessera.schema.MemberType;
import com.tessera.schema.SchemaRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Turns a normalized query into an unsecured {@link QueryPlan}.
 *
 * <p>Filters whose members are all measures become HAVING conditions,
 * filters over dimensions become row conditions, and a single filter group
 * mixing both is rejected. Measures only referenced by a HAVING filter are
 * still aggregated so the condition can be evaluated.
 */
@Component
public class QueryPlanner {

    private static final Logger log = LoggerFactory.getLogger(QueryPlanner.class);

    private final PredicateBuilder predicateBuilder;
    private final JoinPathResolver joinPathResolver;
    private final int rowLimitHint;

    public QueryPlanner(PredicateBuilder predicateBuilder, JoinPathResolver joinPathResolver,
                        @Value("${tessera.compiler.row-limit-hint:0}") int rowLimitHint) {
        this.predicateBuilder = predicateBuilder;
        this.joinPathResolver = joinPathResolver;
        this.rowLimitHint = rowLimitHint;
    }

    public QueryPlan plan(NormalizedQuery query, SchemaRegistry registry) {
        String primaryCube = query.getPrimaryCube();

        Set<String> cubes = new LinkedHashSet<>(query.getSelectedCubes());
        for (Filter filter : query.getFilters()) {
            filter.getMembers().forEach(m -> cubes.add(MemberReference.parse(m).getCubeName()));
        }

        List<JoinStep> joins = joinPathResolver.resolve(registry, primaryCube, cubes);

        List<Predicate> rowConditions = new ArrayList<>();
        List<Predicate> havingConditions = new ArrayList<>();
        Map<String, Measure> aggregated = new LinkedHashMap<>();
        query.getMeasures().forEach(m -> aggregated.put(m.getFullName(), m));

        for (Filter filter : query.getFilters()) {
            List<CubeMember> members = new ArrayList<>();
            filter.getMembers().forEach(m -> members.add(registry.getMember(m)));
            boolean allMeasures = members.stream().allMatch(m -> m instanceof Measure);
            boolean anyMeasure = members.stream().anyMatch(m -> m instanceof Measure);

            if (allMeasures) {
                members.forEach(m -> aggregated.putIfAbsent(m.getFullName(), (Measure) m));
                havingConditions.add(predicateBuilder.build(filter, member -> measureTarget(registry, member),
                    query.getResolvedAt()));
            } else if (anyMeasure) {
                throw new InvalidFilterException(
                    "Filter group mixes measures and dimensions: " + filter.getMembers());
            } else {
                rowConditions.add(predicateBuilder.build(filter, member -> dimensionTarget(registry, member),
                    query.getResolvedAt()));
            }
        }

        List<GroupingKey> groupingKeys = new ArrayList<>();
        for (Dimension dimension : query.getDimensions()) {
            groupingKeys.add(new GroupingKey(dimension.getFullName(), dimension.getColumn(), null));
        }
        for (ResolvedTimeDimension timeDimension : query.getTimeDimensions()) {
            Dimension dimension = timeDimension.getDimension();
            if (timeDimension.getGranularity() != null) {
                groupingKeys.add(new GroupingKey(dimension.getFullName(), dimension.getColumn(),
                    timeDimension.getGranularity()));
            }
            ResolvedDateRange range = timeDimension.getDateRange();
            if (range != null) {
                rowConditions.add(Predicates.greaterThanOrEqual(dimension.getColumn(), range.getStart()));
                rowConditions.add(Predicates.lessThanOrEqual(dimension.getColumn(), range.getEnd()));
            }
        }

        List<AggregateExpression> aggregates = new ArrayList<>();
        for (Measure measure : aggregated.values()) {
            aggregates.add(new AggregateExpression(measure.getFullName(), measure.getMeasureType(),
                measure.getColumn(), measure.getFilter()));
        }

        QueryPlan plan = QueryPlan.builder(primaryCube)
            .joins(joins)
            .groupingKeys(groupingKeys)
            .aggregates(aggregates)
            .userPredicate(LogicalPredicate.and(rowConditions))
            .havingPredicate(LogicalPredicate.and(havingConditions))
            .orderBy(buildOrder(query, groupingKeys))
            .limit(query.getLimit())
            .offset(query.getOffset())
            .rowLimitHint(rowLimitHint)
            .resolvedAt(query.getResolvedAt())
            .build();

        log.debug("Planned query on '{}': {} joins, {} grouping keys, {} aggregates",
            primaryCube, joins.size(), groupingKeys.size(), aggregates.size());
        return plan;
    }

    /**
     * Order keys refer to output aliases; a time dimension orders by its first
     * truncated grouping key.
     */
    private static List<OrderByItem> buildOrder(NormalizedQuery query, List<GroupingKey> groupingKeys) {
        Map<String, String> aliases = new HashMap<>();
        groupingKeys.forEach(key -> aliases.putIfAbsent(key.getMember(), key.getAlias()));

        List<OrderByItem> orderBy = new ArrayList<>();
        if (!query.getOrder().isEmpty()) {
            query.getOrder().forEach((member, direction) ->
                orderBy.add(new OrderByItem(aliases.getOrDefault(member, member), direction)));
        } else if (!query.getMeasures().isEmpty()) {
            orderBy.add(new OrderByItem(query.getMeasures().get(0).getFullName(), SortDirection.DESC));
        } else if (!query.getDimensions().isEmpty()) {
            orderBy.add(new OrderByItem(query.getDimensions().get(0).getFullName(), SortDirection.ASC));
        }
        return orderBy;
    }

    private static FilterTarget dimensionTarget(SchemaRegistry registry, String member) {
        Dimension dimension = registry.getDimension(member);
        return new FilterTarget(dimension.getColumn(), dimension.getType());
    }

    private static FilterTarget measureTarget(SchemaRegistry registry, String member) {
        Measure measure = registry.getMeasure(member);
        return new FilterTarget(ColumnRef.of(measure.getCubeName(), measure.getName()), MemberType.NUMBER);
    }
}
