package com.tessera.security;

import com.tessera.plan.QueryPlan;
import com.tessera.query.predicate.Predicate;
import com.tessera.schema.CubeDefinition;
import com.tessera.schema.SchemaRegistry;
import com.tessera.schema.TenantFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Attaches tenant predicates to compiled plans.
 *
 * Every cube a plan references (the primary cube and every joined cube) gets
 * the predicate produced by its tenant filter for the given security context.
 * There is no opt-out: a missing context, a cube without a tenant filter, or
 * a tenant filter that fails or returns nothing aborts the compilation.
 */
@Component
public class SecurityInjector {

    private static final Logger logger = LoggerFactory.getLogger(SecurityInjector.class);

    /**
     * Returns a secured copy of the plan.
     *
     * @throws MissingSecurityContextException if securityContext is null
     * @throws TenantFilterException if any referenced cube cannot be scoped
     */
    public QueryPlan inject(QueryPlan plan, SecurityContext securityContext, SchemaRegistry registry) {
        Map<String, Predicate> predicates =
            resolveTenantPredicates(plan.getReferencedCubes(), securityContext, registry);
        QueryPlan secured = plan.withTenantPredicates(predicates);
        logger.debug("Injected tenant predicates for cubes {}", predicates.keySet());
        return secured;
    }

    /**
     * Tenant predicate per cube, in the iteration order of {@code cubes}.
     */
    public Map<String, Predicate> resolveTenantPredicates(Collection<String> cubes,
                                                          SecurityContext securityContext,
                                                          SchemaRegistry registry) {
        if (securityContext == null) {
            throw new MissingSecurityContextException("A security context is required to compile a query");
        }

        Map<String, Predicate> predicates = new LinkedHashMap<>();
        for (String cubeName : cubes) {
            CubeDefinition cube = registry.getCube(cubeName);
            predicates.put(cubeName, applyTenantFilter(cube, securityContext));
        }
        return predicates;
    }

    private Predicate applyTenantFilter(CubeDefinition cube, SecurityContext securityContext) {
        TenantFilter tenantFilter = cube.getTenantFilter();
        if (tenantFilter == null) {
            throw new TenantFilterException(cube.getName(), "Cube declares no tenant filter");
        }

        Predicate predicate;
        try {
            predicate = tenantFilter.apply(securityContext);
        } catch (RuntimeException e) {
            throw new TenantFilterException(cube.getName(), "Tenant filter failed: " + e.getMessage(), e);
        }

        if (predicate == null) {
            throw new TenantFilterException(cube.getName(), "Tenant filter produced no predicate");
        }
        logger.debug("Tenant predicate for cube '{}': {}", cube.getName(), predicate);
        return predicate;
    }
}
