package com.bookforge.error;

/**
 * Raised when a file a run depends on does not exist.
 */
public class MissingInputException extends PipelineException {

    private static final long serialVersionUID = 1L;

    public MissingInputException(String message) {
        super(ErrorKind.MISSING_INPUT, message, null, null);
    }

    public MissingInputException(String message, Integer row, String column) {
        super(ErrorKind.MISSING_INPUT, message, row, column);
    }
}
