package com.tessera.security;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Caller-supplied tenant-scoping attributes for one compilation.
 *
 * The compiler never inspects these attributes itself. They are forwarded to
 * every referenced cube's tenant filter, which turns them into a predicate.
 * A context is immutable and is passed explicitly into each compile call, so
 * concurrent compilations for different tenants never share state.
 *
 * Usage:
 * <pre>
 * SecurityContext context = SecurityContext.of(Map.of("organisationId", 42));
 *
 * // Inside a cube's tenant filter
 * Object organisationId = context.require("organisationId");
 * </pre>
 *
 * @see SecurityInjector
 */
public final class SecurityContext {

    private final Map<String, Object> attributes;

    private SecurityContext(Map<String, Object> attributes) {
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    /**
     * Creates a context from the given attributes.
     *
     * @param attributes the tenant-scoping attributes, must not be null
     * @return an immutable security context
     * @throws IllegalArgumentException if attributes is null
     */
    public static SecurityContext of(Map<String, ?> attributes) {
        if (attributes == null) {
            throw new IllegalArgumentException("Security context attributes must not be null");
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        attributes.forEach((key, value) -> {
            if (key == null || key.trim().isEmpty()) {
                throw new IllegalArgumentException("Security context attribute names must not be null or empty");
            }
            copy.put(key, value);
        });
        return new SecurityContext(copy);
    }

    /**
     * Creates a context holding a single attribute.
     */
    public static SecurityContext of(String name, Object value) {
        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put(name, value);
        return of(attributes);
    }

    /**
     * Retrieves an attribute, or null if it is not present.
     *
     * @param name the attribute name
     * @return the attribute value, or null if not set
     */
    public Object get(String name) {
        return attributes.get(name);
    }

    /**
     * Retrieves an attribute, throwing if it is absent.
     *
     * Tenant filters use this when the attribute is mandatory for isolation:
     * a missing attribute is a configuration or authentication error, never a
     * reason to skip the filter.
     *
     * @param name the attribute name
     * @return the attribute value
     * @throws IllegalStateException if the attribute is not set
     */
    public Object require(String name) {
        Object value = attributes.get(name);
        if (value == null) {
            throw new IllegalStateException("No '" + name + "' attribute set in security context");
        }
        return value;
    }

    /**
     * Checks if an attribute is present.
     */
    public boolean has(String name) {
        return attributes.get(name) != null;
    }

    public Map<String, Object> getAttributes() {
        return attributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SecurityContext)) return false;
        SecurityContext that = (SecurityContext) o;
        return attributes.equals(that.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attributes);
    }

    // Attribute values stay out of toString so they don't leak into logs
    @Override
    public String toString() {
        return "SecurityContext" + attributes.keySet();
    }
}
