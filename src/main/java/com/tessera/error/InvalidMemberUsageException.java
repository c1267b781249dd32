package com.tessera.error;

/**
 * Thrown when a registered member is used in a clause it cannot serve, such
 * as a string dimension listed as a time dimension or an order key that is
 * not selected by the query.
 */
public class InvalidMemberUsageException extends CompilationException {

    private static final long serialVersionUID = 1L;

    public InvalidMemberUsageException(String message, String member) {
        super(ErrorCode.INVALID_MEMBER_USAGE, message, member, null);
    }
}
