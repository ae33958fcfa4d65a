package com.bookforge.error;

/**
 * Raised when a categorical token lies outside its recognized vocabulary.
 */
public class UnrecognizedValueException extends PipelineException {

    private static final long serialVersionUID = 1L;

    public UnrecognizedValueException(String message) {
        super(ErrorKind.UNRECOGNIZED_VALUE, message, null, null);
    }

    public UnrecognizedValueException(String message, Integer row, String column) {
        super(ErrorKind.UNRECOGNIZED_VALUE, message, row, column);
    }
}
