package com.bookforge.pipeline;

import com.bookforge.config.PipelineConfig;
import com.bookforge.model.StageResult;

/**
 * A single transformation step of the pipeline.
 *
 * <p>Implementations are stateless: every input they need arrives through
 * {@link #execute}, and the output table is a new value rather than a mutation of the
 * input.  Typed failures are returned as {@link StageResult#failure} instead of being
 * thrown; a failed stage produces no table at all.</p>
 *
 * @param <I> input table type
 * @param <O> output table type
 */
public interface Stage<I, O> {

    /** Rows in the stage's input table. */
    String METRIC_ROWS_IN = "rows_in";

    /** Rows in the stage's output table. */
    String METRIC_ROWS_OUT = "rows_out";

    /** Category values replaced during normalization. */
    String METRIC_CATEGORIES_NORMALIZED = "categories_normalized";

    /** Derived columns added to the table. */
    String METRIC_FEATURES_CREATED = "features_created";

    /**
     * Step name used in logs and the execution report, e.g. {@code data_cleaning}.
     */
    String name();

    StageResult<O> execute(I input, PipelineConfig config);
}
