package com.tessera.error;

/**
 * Thrown for structurally invalid funnels: too few steps, unnamed steps, malformed durations.
 */
public class InvalidFunnelException extends CompilationException {

    private static final long serialVersionUID = 1L;

    public InvalidFunnelException(String message) {
        super(ErrorCode.INVALID_FUNNEL, message);
    }

    public InvalidFunnelException(String message, Throwable cause) {
        super(ErrorCode.INVALID_FUNNEL, message, cause);
    }
}
