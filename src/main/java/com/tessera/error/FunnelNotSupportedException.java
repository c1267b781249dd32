package com.tessera.error;

/**
 * Thrown when a funnel's primary cube declares no event-stream metadata.
 */
public class FunnelNotSupportedException extends CompilationException {

    private static final long serialVersionUID = 1L;

    public FunnelNotSupportedException(String message) {
        super(ErrorCode.FUNNEL_NOT_SUPPORTED, message);
    }
}
