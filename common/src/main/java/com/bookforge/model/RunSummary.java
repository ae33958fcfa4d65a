package com.bookforge.model;

import com.bookforge.config.PipelineMode;
import com.bookforge.error.PipelineError;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.util.List;

/**
 * What a pipeline run did, reported back to the caller whether it succeeded or not.
 *
 * <p>{@code rowsRejected} is always zero while stages are fail-fast; it is reported so that a
 * partial-acceptance mode can be added without changing the summary's shape.</p>
 */
@Value
@Builder
public class RunSummary {

    PipelineMode mode;
    boolean success;

    /** The error that aborted the run, {@code null} on success. */
    PipelineError error;

    long rowsProcessed;
    long rowsRejected;
    Duration elapsed;
    long categoriesNormalized;
    long featuresCreated;

    @Singular
    List<StepReport> steps;
}
