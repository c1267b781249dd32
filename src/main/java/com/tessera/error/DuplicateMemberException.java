package com.tessera.error;

/**
 * Thrown when a query lists the same measure or dimension twice.
 */
public class DuplicateMemberException extends CompilationException {

    private static final long serialVersionUID = 1L;

    public DuplicateMemberException(String message) {
        super(ErrorCode.DUPLICATE_MEMBER, message);
    }

    public DuplicateMemberException(String message, String member) {
        super(ErrorCode.DUPLICATE_MEMBER, message, member, null);
    }
}
