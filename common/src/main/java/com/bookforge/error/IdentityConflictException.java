package com.bookforge.error;

/**
 * Raised when generated row identifiers collide.
 */
public class IdentityConflictException extends PipelineException {

    private static final long serialVersionUID = 1L;

    public IdentityConflictException(String message) {
        super(ErrorKind.IDENTITY_CONFLICT, message, null, null);
    }

    public IdentityConflictException(String message, Integer row, String column) {
        super(ErrorKind.IDENTITY_CONFLICT, message, row, column);
    }
}
