package com.bookforge.model;

import com.bookforge.error.PipelineError;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a single stage: either the fully materialized output table together with the
 * stage's counters, or the typed error that aborted the stage.
 *
 * <p>A failed result never carries a partial table.</p>
 *
 * @param <T> the stage's output table type
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class StageResult<T> {

    private final String stageName;
    private final boolean success;
    private final T output;
    private final PipelineError error;
    private final Map<String, Long> metrics;

    public static <T> StageResult<T> success(String stageName, T output, Map<String, Long> metrics) {
        return new StageResult<>(stageName, true, output, null,
                Collections.unmodifiableMap(new LinkedHashMap<>(metrics)));
    }

    public static <T> StageResult<T> failure(String stageName, PipelineError error) {
        return new StageResult<>(stageName, false, null, error, Map.of());
    }

    /**
     * Returns the output table of a successful stage.
     *
     * @throws IllegalStateException if the stage failed
     */
    public T getOutput() {
        if (!success) {
            throw new IllegalStateException("Stage '" + stageName + "' failed: " + error.describe());
        }
        return output;
    }

    public long metric(String name) {
        return metrics.getOrDefault(name, 0L);
    }
}
