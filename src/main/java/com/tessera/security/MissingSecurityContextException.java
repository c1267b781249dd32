package com.tessera.security;

import com.tessera.error.CompilationException;
import com.tessera.error.ErrorCode;

/**
 * Thrown when a plan is compiled without a security context.
 *
 * Every plan must be scoped to a tenant before it leaves the compiler, so the
 * absence of a context is a hard failure rather than an unfiltered plan.
 *
 * @see SecurityInjector
 */
public class MissingSecurityContextException extends CompilationException {

    private static final long serialVersionUID = 1L;

    public MissingSecurityContextException(String message) {
        super(ErrorCode.MISSING_SECURITY_CONTEXT, message);
    }
}
