package com.tessera.error;

/**
 * Thrown when a JSON request descriptor cannot be read.
 */
public class InvalidDescriptorException extends CompilationException {

    private static final long serialVersionUID = 1L;

    public InvalidDescriptorException(String message) {
        super(ErrorCode.INVALID_DESCRIPTOR, message);
    }

    public InvalidDescriptorException(String message, Throwable cause) {
        super(ErrorCode.INVALID_DESCRIPTOR, message, cause);
    }
}
