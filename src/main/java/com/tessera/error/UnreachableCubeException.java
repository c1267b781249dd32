package com.tessera.error;

/**
 * Thrown when no declared join path connects the primary cube to a referenced cube.
 */
public class UnreachableCubeException extends CompilationException {

    private static final long serialVersionUID = 1L;

    public UnreachableCubeException(String message) {
        super(ErrorCode.UNREACHABLE_CUBE, message);
    }
}
