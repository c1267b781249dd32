package com.tessera.error;

/**
 * Thrown when the first funnel step declares a time-to-convert window it has no predecessor for.
 */
public class FunnelStepOrderException extends CompilationException {

    private static final long serialVersionUID = 1L;

    public FunnelStepOrderException(String message) {
        super(ErrorCode.FUNNEL_STEP_ORDER, message);
    }
}
