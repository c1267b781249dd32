package com.tessera.service;

import com.tessera.descriptor.DescriptorMapper;
import com.tessera.error.CompilationException;
import com.tessera.funnel.FunnelDefinition;
import com.tessera.funnel.FunnelEngine;
import com.tessera.funnel.FunnelEvent;
import com.tessera.funnel.FunnelPlan;
import com.tessera.funnel.FunnelResult;
import com.tessera.plan.PlanExplainer;
import com.tessera.plan.QueryPlan;
import com.tessera.plan.QueryPlanner;
import com.tessera.query.NormalizedQuery;
import com.tessera.query.Query;
import com.tessera.query.QueryNormalizer;
import com.tessera.schema.SchemaRegistry;
import com.tessera.security.SecurityContext;
import com.tessera.security.SecurityInjector;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.function.Supplier;

/**
 * Entry point of the compiler.
 *
 * <p>A query flows through normalization (member resolution and date range
 * resolution), planning and tenant injection; only secured plans are
 * returned. Funnels are planned through the {@link FunnelEngine} and evaluated
 * over the rows the execution collaborator returns.
 *
 * <p>Every call is independent and reads only the sealed registry, so the
 * service may be used from any number of threads.
 */
@Service
public class AnalyticsCompiler {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsCompiler.class);

    private final SchemaRegistry registry;
    private final QueryNormalizer normalizer;
    private final QueryPlanner planner;
    private final SecurityInjector securityInjector;
    private final FunnelEngine funnelEngine;
    private final DescriptorMapper descriptorMapper;
    private final PlanExplainer planExplainer;
    private final CompilerMetrics metrics;
    private final Clock clock;

    public AnalyticsCompiler(SchemaRegistry registry, QueryNormalizer normalizer, QueryPlanner planner,
                             SecurityInjector securityInjector, FunnelEngine funnelEngine,
                             DescriptorMapper descriptorMapper, PlanExplainer planExplainer,
                             CompilerMetrics metrics, Clock clock) {
        this.registry = registry;
        this.normalizer = normalizer;
        this.planner = planner;
        this.securityInjector = securityInjector;
        this.funnelEngine = funnelEngine;
        this.descriptorMapper = descriptorMapper;
        this.planExplainer = planExplainer;
        this.metrics = metrics;
        this.clock = clock;
    }

    public QueryPlan compile(Query query, SecurityContext securityContext) {
        return compile(query, securityContext, clock.instant());
    }

    /**
     * Compile a query with an explicit reference instant for relative date ranges.
     *
     * @throws CompilationException if the query is rejected at any stage
     */
    public QueryPlan compile(Query query, SecurityContext securityContext, Instant now) {
        return timed(() -> compileQuery(query, securityContext, now));
    }

    /**
     * Compile a JSON query descriptor.
     */
    public QueryPlan compile(String queryJson, SecurityContext securityContext) {
        Instant now = clock.instant();
        return timed(() -> compileQuery(descriptorMapper.readQuery(queryJson), securityContext, now));
    }

    public FunnelPlan planFunnel(FunnelDefinition definition, SecurityContext securityContext) {
        return planFunnel(definition, securityContext, clock.instant());
    }

    public FunnelPlan planFunnel(FunnelDefinition definition, SecurityContext securityContext, Instant now) {
        FunnelPlan plan = guarded(() -> funnelEngine.plan(definition, registry, securityContext, now));
        metrics.recordFunnelPlanned();
        return plan;
    }

    /**
     * Plan a JSON funnel descriptor.
     */
    public FunnelPlan planFunnel(String funnelJson, SecurityContext securityContext) {
        Instant now = clock.instant();
        FunnelPlan plan = guarded(() ->
            funnelEngine.plan(descriptorMapper.readFunnel(funnelJson), registry, securityContext, now));
        metrics.recordFunnelPlanned();
        return plan;
    }

    public FunnelResult evaluateFunnel(FunnelPlan plan, List<FunnelEvent> rows) {
        Timer.Sample sample = metrics.startTimer();
        try {
            FunnelResult result = funnelEngine.evaluate(plan, rows);
            metrics.recordFunnelEvaluated();
            return result;
        } finally {
            metrics.recordFunnelLatency(sample);
        }
    }

    public String explain(QueryPlan plan) {
        return planExplainer.explain(plan);
    }

    private QueryPlan compileQuery(Query query, SecurityContext securityContext, Instant now) {
        NormalizedQuery normalized = normalizer.normalize(query, registry, now);
        QueryPlan plan = planner.plan(normalized, registry);
        return securityInjector.inject(plan, securityContext, registry);
    }

    private QueryPlan timed(Supplier<QueryPlan> compilation) {
        Timer.Sample sample = metrics.startTimer();
        try {
            QueryPlan plan = guarded(compilation);
            metrics.recordCompilationSucceeded(plan.getReferencedCubes().size());
            if (log.isDebugEnabled()) {
                log.debug("Compiled plan: {}", planExplainer.explain(plan));
            }
            return plan;
        } finally {
            metrics.recordCompileLatency(sample);
        }
    }

    private <T> T guarded(Supplier<T> step) {
        try {
            return step.get();
        } catch (CompilationException e) {
            metrics.recordCompilationFailed(e.getErrorCode());
            log.warn("Compilation rejected [{}]: {}", e.getErrorCode(), e.getMessage());
            throw e;
        }
    }
}
