package com.tessera.error;

/**
 * Thrown when a date range expression matches no supported grammar or resolves to an inverted interval. Never downgraded to an absent filter.
 */
public class InvalidDateRangeException extends CompilationException {

    private static final long serialVersionUID = 1L;

    public InvalidDateRangeException(String message) {
        super(ErrorCode.INVALID_DATE_RANGE, message);
    }

    public InvalidDateRangeException(String message, String expression) {
        super(ErrorCode.INVALID_DATE_RANGE, message, null, expression);
    }

    public InvalidDateRangeException(String message, String expression, Throwable cause) {
        super(ErrorCode.INVALID_DATE_RANGE, message, null, expression, cause);
    }
}
