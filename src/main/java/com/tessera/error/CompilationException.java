package com.tessera.error;

/**
 * Base type for every failure raised while compiling a query or funnel.
 * Carries the error code plus, where known, the member or expression that
 * caused it. Compilation is all-or-nothing: once one of these is thrown no
 * partial plan exists.
 */
public class CompilationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorCode errorCode;
    private final String member;
    private final String expression;

    public CompilationException(ErrorCode errorCode, String message) {
        this(errorCode, message, null, null, null);
    }

    public CompilationException(ErrorCode errorCode, String message, Throwable cause) {
        this(errorCode, message, null, null, cause);
    }

    public CompilationException(ErrorCode errorCode, String message, String member, String expression) {
        this(errorCode, message, member, expression, null);
    }

    public CompilationException(ErrorCode errorCode, String message, String member, String expression,
                                Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.member = member;
        this.expression = expression;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public String getMember() {
        return member;
    }

    public String getExpression() {
        return expression;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (member != null) {
            sb.append(" [Member: ").append(member).append("]");
        }
        if (expression != null) {
            sb.append(" [Expression: ").append(expression).append("]");
        }
        return sb.toString();
    }
}
