package com.tessera.error;

/**
 * Thrown when a query references a member that no registered cube declares.
 */
public class UnknownMemberException extends CompilationException {

    private static final long serialVersionUID = 1L;

    public UnknownMemberException(String message) {
        super(ErrorCode.UNKNOWN_MEMBER, message);
    }

    public UnknownMemberException(String message, String member) {
        super(ErrorCode.UNKNOWN_MEMBER, message, member, null);
    }
}
