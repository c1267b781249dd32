package com.tessera.error;

/**
 * Thrown when a filter's operator, values and member type do not agree.
 */
public class InvalidFilterException extends CompilationException {

    private static final long serialVersionUID = 1L;

    public InvalidFilterException(String message) {
        super(ErrorCode.INVALID_FILTER, message);
    }

    public InvalidFilterException(String message, String member) {
        super(ErrorCode.INVALID_FILTER, message, member, null);
    }

    public InvalidFilterException(String message, String member, Throwable cause) {
        super(ErrorCode.INVALID_FILTER, message, member, null, cause);
    }
}
