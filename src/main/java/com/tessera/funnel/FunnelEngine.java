package com.tessera.funnel;

import com.tessera.error.FunnelNotSupportedException;
import com.tessera.error.FunnelStepOrderException;
import com.tessera.error.InvalidFunnelException;
import com.tessera.plan.JoinPathResolver;
import com.tessera.plan.JoinStep;
import com.tessera.query.predicate.FilterTarget;
import com.tessera.query.predicate.Predicate;
import com.tessera.query.predicate.PredicateBuilder;
import com.tessera.query.time.DateRangeResolver;
import com.tessera.query.time.ResolvedDateRange;
import com.tessera.schema.CubeDefinition;
import com.tessera.schema.CubeMember;
import com.tessera.schema.Dimension;
import com.tessera.schema.MemberReference;
import com.tessera.schema.SchemaRegistry;
import com.tessera.security.SecurityContext;
import com.tessera.security.SecurityInjector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Plans and evaluates step-sequence funnels over event-stream cubes.
 *
 * <p>{@link #plan} validates a funnel against the registry and produces the
 * tenant-scoped row request; {@link #evaluate} runs the rows the execution
 * collaborator returns through the {@link FunnelSequencer} and aggregates
 * per-step counts.
 */
@Component
public class FunnelEngine {

    private static final Logger log = LoggerFactory.getLogger(FunnelEngine.class);

    private final PredicateBuilder predicateBuilder;
    private final JoinPathResolver joinPathResolver;
    private final SecurityInjector securityInjector;
    private final DateRangeResolver dateRangeResolver;

    public FunnelEngine(PredicateBuilder predicateBuilder, JoinPathResolver joinPathResolver,
                        SecurityInjector securityInjector, DateRangeResolver dateRangeResolver) {
        this.predicateBuilder = predicateBuilder;
        this.joinPathResolver = joinPathResolver;
        this.securityInjector = securityInjector;
        this.dateRangeResolver = dateRangeResolver;
    }

    public FunnelPlan plan(FunnelDefinition definition, SchemaRegistry registry,
                           SecurityContext securityContext, Instant now) {
        validateSteps(definition.getSteps());

        Dimension bindingKey = registry.getDimension(definition.getBindingKey());
        CubeDefinition cube = registry.getCube(bindingKey.getCubeName());
        if (!cube.isEventStream()) {
            throw new FunnelNotSupportedException(
                "Cube '" + cube.getName() + "' does not declare event stream metadata");
        }

        Dimension timeDimension = registry.getDimension(definition.getTimeDimension());
        if (!timeDimension.isTime() || !timeDimension.getCubeName().equals(cube.getName())) {
            throw new InvalidFunnelException("Funnel time dimension '" + definition.getTimeDimension()
                + "' must be a time dimension of cube '" + cube.getName() + "'");
        }

        Set<String> cubes = new LinkedHashSet<>();
        cubes.add(cube.getName());
        List<Predicate> stepPredicates = new ArrayList<>();
        for (FunnelStep step : definition.getSteps()) {
            for (String member : step.getFilter().getMembers()) {
                CubeMember resolved = registry.getMember(member);
                if (!(resolved instanceof Dimension)) {
                    throw new InvalidFunnelException(
                        "Step '" + step.getName() + "' may only filter on dimensions, got '" + member + "'");
                }
                cubes.add(MemberReference.parse(member).getCubeName());
            }
            stepPredicates.add(predicateBuilder.build(step.getFilter(), member -> {
                Dimension dimension = registry.getDimension(member);
                return new FilterTarget(dimension.getColumn(), dimension.getType());
            }, now));
        }

        List<JoinStep> joins = joinPathResolver.resolve(registry, cube.getName(), cubes);
        ResolvedDateRange dateRange = definition.getDateRange() != null
            ? dateRangeResolver.resolve(definition.getDateRange(), now)
            : null;
        Map<String, Predicate> tenantPredicates =
            securityInjector.resolveTenantPredicates(cubes, securityContext, registry);

        FunnelPlan plan = new FunnelPlan(definition, cube.getName(), bindingKey.getColumn(),
            timeDimension.getColumn(), joins, stepPredicates, tenantPredicates, dateRange, now);
        log.debug("Planned funnel on '{}' with {} steps, date range {}",
            cube.getName(), stepPredicates.size(), dateRange);
        return plan;
    }

    public FunnelResult evaluate(FunnelPlan plan, List<FunnelEvent> rows) {
        return evaluate(plan.getDefinition(), rows);
    }

    /**
     * Sequences rows and aggregates per-step counts. Rows must be ordered by
     * time within each binding-key value.
     */
    public FunnelResult evaluate(FunnelDefinition definition, List<FunnelEvent> rows) {
        List<FunnelStep> steps = definition.getSteps();
        FunnelSequencer sequencer = new FunnelSequencer(
            steps, definition.getGlobalTimeWindow(), dateRangeResolver.getZone());
        List<EntityProgress> entities = sequencer.sequence(rows);

        List<FunnelStepResult> results = new ArrayList<>();
        for (int i = 0; i < steps.size(); i++) {
            final int step = i;
            long entered = entities.stream().filter(e -> e.hasEntered(step)).count();
            long converted = step == steps.size() - 1
                ? entities.stream().filter(e -> e.getState() == FunnelState.COMPLETED).count()
                : entities.stream().filter(e -> e.hasEntered(step + 1)).count();

            TimeToConvertStats stats = null;
            if (definition.isIncludeTimeMetrics() && step > 0) {
                List<Duration> gaps = new ArrayList<>();
                entities.stream().filter(e -> e.hasEntered(step)).forEach(e -> gaps.add(e.timeToStep(step)));
                stats = TimeToConvertStats.of(gaps);
            }
            results.add(new FunnelStepResult(steps.get(step).getName(), step, entered, converted, stats));
        }

        long completed = entities.stream().filter(e -> e.getState() == FunnelState.COMPLETED).count();
        log.debug("Evaluated funnel over {} rows and {} entities, {} completed", rows.size(), entities.size(), completed);
        return new FunnelResult(results, completed);
    }

    private static void validateSteps(List<FunnelStep> steps) {
        if (steps.size() < 2) {
            throw new InvalidFunnelException("A funnel needs at least two steps, got " + steps.size());
        }
        Set<String> names = new HashSet<>();
        for (int i = 0; i < steps.size(); i++) {
            FunnelStep step = steps.get(i);
            if (step.getName() == null || step.getName().trim().isEmpty()) {
                throw new InvalidFunnelException("Funnel step " + i + " has no name");
            }
            if (!names.add(step.getName())) {
                throw new InvalidFunnelException("Funnel step name '" + step.getName() + "' is used twice");
            }
            if (step.getFilter() == null) {
                throw new InvalidFunnelException("Funnel step '" + step.getName() + "' has no filter");
            }
        }
        if (steps.get(0).getTimeToConvert() != null) {
            throw new FunnelStepOrderException(
                "First funnel step '" + steps.get(0).getName() + "' cannot declare a time to convert");
        }
    }
}
