package com.bookforge.error;

/**
 * Raised by the end-of-stage schema gate.
 */
public class SchemaViolationException extends PipelineException {

    private static final long serialVersionUID = 1L;

    public SchemaViolationException(String message) {
        super(ErrorKind.SCHEMA_VIOLATION, message, null, null);
    }

    public SchemaViolationException(String message, Integer row, String column) {
        super(ErrorKind.SCHEMA_VIOLATION, message, row, column);
    }
}
