package com.bookforge.error;

import lombok.Getter;

/**
 * Base class for the typed failures raised inside a stage.
 *
 * <p>Stages never let these escape: they are caught at the stage boundary and turned into a
 * {@link com.bookforge.model.StageResult} failure carrying a {@link PipelineError}.</p>
 */
@Getter
public abstract class PipelineException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    /** 1-based data row the failure refers to, or {@code null} for table-level failures. */
    private final Integer row;

    /** Column the failure refers to, or {@code null}. */
    private final String column;

    protected PipelineException(ErrorKind kind, String message, Integer row, String column) {
        this(kind, message, row, column, null);
    }

    protected PipelineException(ErrorKind kind, String message, Integer row, String column, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.row = row;
        this.column = column;
    }

    public PipelineError toError() {
        return new PipelineError(kind, getMessage(), row, column);
    }
}
