package com.tessera.error;

/**
 * Thrown when a query has neither measures nor dimensions.
 */
public class EmptyQueryException extends CompilationException {

    private static final long serialVersionUID = 1L;

    public EmptyQueryException(String message) {
        super(ErrorCode.EMPTY_QUERY, message);
    }
}
