package com.bookforge.error;

/**
 * Raised when a derived-feature computation receives a value outside its domain.
 */
public class DomainException extends PipelineException {

    private static final long serialVersionUID = 1L;

    public DomainException(String message) {
        super(ErrorKind.DOMAIN, message, null, null);
    }

    public DomainException(String message, Integer row, String column) {
        super(ErrorKind.DOMAIN, message, row, column);
    }
}
