package com.bookforge.error;

/**
 * Classifies every way a pipeline run can fail, together with the process exit status
 * the command-line job reports for it.
 */
public enum ErrorKind {

    /** Nulls, unparseable cells or an empty raw table. */
    INTEGRITY(ExitStatus.BAD_INPUT),

    /** Availability token outside the recognized vocabulary. */
    UNRECOGNIZED_VALUE(ExitStatus.BAD_INPUT),

    /** The id generator produced a duplicate. */
    IDENTITY_CONFLICT(ExitStatus.INTERNAL),

    /** A derived-feature computation received an out-of-range value. */
    DOMAIN(ExitStatus.BAD_INPUT),

    /** A row failed the end-of-stage schema gate. */
    SCHEMA_VIOLATION(ExitStatus.BAD_INPUT),

    /** A required input file does not exist. */
    MISSING_INPUT(ExitStatus.MISSING_PREREQUISITE),

    /** Reading or writing a file failed. */
    IO(ExitStatus.INTERNAL),

    /** The configuration cannot drive any run. */
    INVALID_CONFIGURATION(ExitStatus.USAGE);

    private final int exitStatus;

    ErrorKind(int exitStatus) {
        this.exitStatus = exitStatus;
    }

    public int getExitStatus() {
        return exitStatus;
    }

    /**
     * Process exit statuses used by the command-line job.
     */
    public static final class ExitStatus {
        public static final int SUCCESS = 0;
        public static final int USAGE = 1;
        public static final int BAD_INPUT = 2;
        public static final int MISSING_PREREQUISITE = 3;
        public static final int INTERNAL = 4;

        private ExitStatus() {
        }
    }
}
