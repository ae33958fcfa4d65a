package com.bookforge.error;

import lombok.Value;

/**
 * Immutable description of a failed run or stage: what kind of failure, and where.
 */
@Value
public class PipelineError {

    ErrorKind kind;
    String message;
    Integer row;
    String column;

    public static PipelineError of(ErrorKind kind, String message) {
        return new PipelineError(kind, message, null, null);
    }

    /**
     * Human-readable form including the row/column context when present.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(kind.name()).append(": ").append(message);
        if (row != null || column != null) {
            sb.append(" [");
            if (row != null) {
                sb.append("row=").append(row);
            }
            if (column != null) {
                if (row != null) {
                    sb.append(", ");
                }
                sb.append("column=").append(column);
            }
            sb.append(']');
        }
        return sb.toString();
    }
}
