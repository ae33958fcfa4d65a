package com.bookforge.error;

/**
 * Raised when the raw table contains nulls, unparseable cells or no rows at all.
 */
public class IntegrityException extends PipelineException {

    private static final long serialVersionUID = 1L;

    public IntegrityException(String message) {
        super(ErrorKind.INTEGRITY, message, null, null);
    }

    public IntegrityException(String message, Integer row, String column) {
        super(ErrorKind.INTEGRITY, message, row, column);
    }

    public IntegrityException(String message, Integer row, String column, Throwable cause) {
        super(ErrorKind.INTEGRITY, message, row, column, cause);
    }
}
