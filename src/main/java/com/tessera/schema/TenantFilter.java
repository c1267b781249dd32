package com.tessera.schema;

import com.tessera.query.predicate.Predicate;
import com.tessera.security.SecurityContext;

/**
 * Produces the predicate that restricts a cube's rows to the tenant described
 * by a security context. Implementations must be side-effect free; they may be
 * invoked concurrently for different contexts.
 */
@FunctionalInterface
public interface TenantFilter {

    Predicate apply(SecurityContext securityContext);
}
