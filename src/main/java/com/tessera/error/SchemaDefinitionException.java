package com.tessera.error;

/**
 * Thrown while building the schema registry, never at query time.
 */
public class SchemaDefinitionException extends CompilationException {

    private static final long serialVersionUID = 1L;

    public SchemaDefinitionException(String message) {
        super(ErrorCode.SCHEMA_DEFINITION, message);
    }
}
