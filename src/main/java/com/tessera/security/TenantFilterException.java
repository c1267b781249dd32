package com.tessera.security;

import com.tessera.error.CompilationException;
import com.tessera.error.ErrorCode;

/**
 * Exception thrown when a cube referenced by a plan cannot be scoped to the
 * current tenant.
 *
 * This indicates one of:
 * - The cube was registered without a tenant filter
 * - The cube's tenant filter threw while evaluating the security context
 * - The cube's tenant filter returned no predicate
 *
 * Security Implications:
 * - The plan is discarded; an unscoped plan is never handed to execution
 * - Repeated occurrences usually point at a misconfigured cube definition
 *   rather than at the caller
 *
 * Example Usage:
 * <pre>
 * if (cube.getTenantFilter() == null) {
 *     throw new TenantFilterException(cube.getName(),
 *         "Cube 'Orders' declares no tenant filter");
 * }
 * </pre>
 *
 * @see SecurityInjector
 * @see SecurityContext
 */
public class TenantFilterException extends CompilationException {

    private static final long serialVersionUID = 1L;

    /**
     * The cube whose tenant filter is missing or failed
     */
    private final String cubeName;

    /**
     * Constructs a new TenantFilterException for the given cube.
     *
     * @param cubeName The cube that could not be scoped
     * @param message The detail message
     */
    public TenantFilterException(String cubeName, String message) {
        super(ErrorCode.TENANT_FILTER, message);
        this.cubeName = cubeName;
    }

    /**
     * Constructs a new TenantFilterException wrapping the failure raised by
     * the cube's tenant filter.
     *
     * @param cubeName The cube that could not be scoped
     * @param message The detail message
     * @param cause The exception raised by the tenant filter
     */
    public TenantFilterException(String cubeName, String message, Throwable cause) {
        super(ErrorCode.TENANT_FILTER, message, cause);
        this.cubeName = cubeName;
    }

    /**
     * Gets the name of the cube that could not be scoped.
     *
     * @return The cube name
     */
    public String getCubeName() {
        return cubeName;
    }

    /**
     * Returns a detailed message including the cube name.
     *
     * @return A detailed error message
     */
    @Override
    public String getMessage() {
        String baseMessage = super.getMessage();
        if (cubeName != null) {
            return String.format("%s [cube=%s]", baseMessage, cubeName);
        }
        return baseMessage;
    }
}
