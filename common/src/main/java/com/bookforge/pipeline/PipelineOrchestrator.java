package com.bookforge.pipeline;

import com.bookforge.config.PipelineConfig;
import com.bookforge.config.PipelineMode;
import com.bookforge.error.ErrorKind;
import com.bookforge.error.MissingInputException;
import com.bookforge.error.PipelineError;
import com.bookforge.error.PipelineException;
import com.bookforge.io.TableReader;
import com.bookforge.io.TableWriter;
import com.bookforge.model.RunSummary;
import com.bookforge.model.StageResult;
import com.bookforge.model.StepReport;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the cleaning and feature stages according to a {@link PipelineMode}.
 *
 * <p><strong>FULL mode:</strong>
 * <ul>
 *   <li>Reads the raw table, cleans it and persists the processed table</li>
 *   <li>Feeds the in-memory cleaned table straight into the feature stage</li>
 *   <li>Persists the features table</li>
 * </ul>
 *
 * <p><strong>CLEANING_ONLY mode:</strong> the first two bullets only.</p>
 *
 * <p><strong>FEATURES_ONLY mode:</strong> reads the processed table written by an earlier
 * run instead of cleaning; fails with {@link ErrorKind#MISSING_INPUT} if it is absent.</p>
 *
 * <p>A stage's output file is written only after the stage succeeded, so a failure never
 * leaves a partial table behind.  Once a step fails every later step is reported as
 * skipped.  Failures come back inside the {@link RunSummary}; {@link #run} does not throw
 * for any {@link ErrorKind}.</p>
 *
 * <p>The orchestrator holds no per-run state: the same instance can serve any number of
 * sequential runs with different configurations.</p>
 *
 * @param <R> raw row type
 * @param <C> cleaned row type
 * @param <F> featured row type
 */
@Slf4j
public class PipelineOrchestrator<R, C, F> {

    private final TableReader<R> rawReader;
    private final TableReader<C> processedReader;
    private final TableWriter<C> processedWriter;
    private final TableWriter<F> featuresWriter;
    private final Stage<List<R>, List<C>> cleaningStage;
    private final Stage<List<C>, List<F>> featureStage;

    public PipelineOrchestrator(TableReader<R> rawReader,
                                TableReader<C> processedReader,
                                TableWriter<C> processedWriter,
                                TableWriter<F> featuresWriter,
                                Stage<List<R>, List<C>> cleaningStage,
                                Stage<List<C>, List<F>> featureStage) {
        this.rawReader = rawReader;
        this.processedReader = processedReader;
        this.processedWriter = processedWriter;
        this.featuresWriter = featuresWriter;
        this.cleaningStage = cleaningStage;
        this.featureStage = featureStage;
    }

    /**
     * Runs the mode configured in {@code config}.
     */
    public RunSummary run(PipelineConfig config) {
        return run(config.getMode(), config);
    }

    /**
     * Runs the given mode against {@code config}.
     */
    public RunSummary run(PipelineMode mode, PipelineConfig config) {
        long start = System.nanoTime();
        log.info("Starting pipeline in {} mode", mode);

        List<StepReport> steps = new ArrayList<>();
        PipelineError error = validate(mode, config);
        if (error != null) {
            return finish(RunSummary.builder()
                    .mode(mode)
                    .success(false)
                    .error(error)
                    .elapsed(Duration.ofNanos(System.nanoTime() - start))
                    .steps(skippedSteps(mode))
                    .build(), config);
        }
        long rowsProcessed = 0;
        long categoriesNormalized = 0;
        long featuresCreated = 0;

        // ── Cleaning ─────────────────────────────────────────────────────
        List<C> cleaned = null;
        if (mode.runsCleaning()) {
            long stepStart = System.nanoTime();
            StageResult<List<C>> result = runStep(
                    () -> readRequired(rawReader, config.getInputPath(), config),
                    cleaningStage, processedWriter, config.getProcessedPath(), config);
            steps.add(report(result, stepStart, config.getProcessedOutput()));
            if (result.isSuccess()) {
                cleaned = result.getOutput();
                rowsProcessed = result.metric(Stage.METRIC_ROWS_OUT);
                categoriesNormalized = result.metric(Stage.METRIC_CATEGORIES_NORMALIZED);
            } else {
                error = result.getError();
            }
        }

        // ── Feature engineering ──────────────────────────────────────────
        if (mode.runsFeatures()) {
            if (error != null) {
                steps.add(StepReport.skipped(featureStage.name()));
            } else {
                List<C> inMemory = cleaned;
                TableLoader<List<C>> loader = inMemory != null
                        ? () -> inMemory
                        : () -> readRequired(processedReader, config.getProcessedPath(), config);
                long stepStart = System.nanoTime();
                StageResult<List<F>> result = runStep(
                        loader, featureStage, featuresWriter, config.getFeaturesPath(), config);
                steps.add(report(result, stepStart, config.getFeaturesOutput()));
                if (result.isSuccess()) {
                    featuresCreated = result.metric(Stage.METRIC_FEATURES_CREATED);
                    if (!mode.runsCleaning()) {
                        rowsProcessed = result.metric(Stage.METRIC_ROWS_OUT);
                    }
                } else {
                    error = result.getError();
                }
            }
        }

        return finish(RunSummary.builder()
                .mode(mode)
                .success(error == null)
                .error(error)
                .rowsProcessed(rowsProcessed)
                .rowsRejected(0)
                .elapsed(Duration.ofNanos(System.nanoTime() - start))
                .categoriesNormalized(categoriesNormalized)
                .featuresCreated(featuresCreated)
                .steps(steps)
                .build(), config);
    }

    /**
     * Writes the default configuration to {@code path}, independent of any run.
     */
    public void exportConfigTemplate(Path path) throws IOException {
        new PipelineConfig().save(path);
        log.info("Default configuration written to {}", path);
    }

    // ──────────────────────── internals ──────────────────────────────────

    @FunctionalInterface
    private interface TableLoader<T> {
        T load() throws IOException;
    }

    private static PipelineError validate(PipelineMode mode, PipelineConfig config) {
        try {
            if (mode == null) {
                throw new IllegalArgumentException("mode must be set");
            }
            config.validate();
            return null;
        } catch (IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return PipelineError.of(ErrorKind.INVALID_CONFIGURATION, e.getMessage());
        }
    }

    private List<StepReport> skippedSteps(PipelineMode mode) {
        List<StepReport> steps = new ArrayList<>();
        if (mode == null || mode.runsCleaning()) {
            steps.add(StepReport.skipped(cleaningStage.name()));
        }
        if (mode == null || mode.runsFeatures()) {
            steps.add(StepReport.skipped(featureStage.name()));
        }
        return steps;
    }

    private static RunSummary finish(RunSummary summary, PipelineConfig config) {
        logSummary(summary, config);
        writeExecutionReport(summary, config);
        return summary;
    }

    private <I, O> StageResult<List<O>> runStep(TableLoader<I> loader,
                                                Stage<I, List<O>> stage,
                                                TableWriter<O> writer,
                                                Path output,
                                                PipelineConfig config) {
        log.info("Running step {}", stage.name());
        try {
            I input = loader.load();
            StageResult<List<O>> result = stage.execute(input, config);
            if (result.isSuccess()) {
                writer.write(output, result.getOutput(), config);
            }
            return result;
        } catch (PipelineException e) {
            return StageResult.failure(stage.name(), e.toError());
        } catch (IOException e) {
            log.error("I/O failure in step {}", stage.name(), e);
            return StageResult.failure(stage.name(), PipelineError.of(ErrorKind.IO, e.toString()));
        }
    }

    private static <T> List<T> readRequired(TableReader<T> reader, Path path, PipelineConfig config)
            throws IOException {
        if (!Files.isRegularFile(path)) {
            throw new MissingInputException("Required input file not found: " + path);
        }
        return reader.read(path, config);
    }

    private static StepReport report(StageResult<?> result, long stepStartNanos, String artifact) {
        long millis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - stepStartNanos);
        if (result.isSuccess()) {
            return StepReport.success(result.getStageName(), millis, artifact);
        }
        log.error("Step {} failed after {} ms: {}", result.getStageName(), millis, result.getError().describe());
        return StepReport.failed(result.getStageName(), millis, result.getError().describe());
    }

    private static void logSummary(RunSummary summary, PipelineConfig config) {
        log.info("============================================================");
        log.info("Pipeline {} in {} mode after {} ms",
                summary.isSuccess() ? "completed" : "FAILED", summary.getMode(), summary.getElapsed().toMillis());
        log.info("  rows processed:        {}", summary.getRowsProcessed());
        log.info("  rows rejected:         {}", summary.getRowsRejected());
        log.info("  categories normalized: {}", summary.getCategoriesNormalized());
        log.info("  features created:      {}", summary.getFeaturesCreated());
        for (StepReport step : summary.getSteps()) {
            log.info("  step {}: {} ({} ms)", step.getName(), step.getStatus().label(), step.getDurationMillis());
        }
        if (summary.isSuccess()) {
            if (summary.getMode().runsCleaning()) {
                log.info("  processed output:      {}", config.getProcessedOutput());
            }
            if (summary.getMode().runsFeatures()) {
                log.info("  features output:       {}", config.getFeaturesOutput());
            }
        } else {
            log.error("  error: {}", summary.getError().describe());
        }
        log.info("============================================================");
    }

    private static void writeExecutionReport(RunSummary summary, PipelineConfig config) {
        Path reportPath = config.getReportPath();
        if (reportPath == null || config.getDelimiter() == null || config.getDelimiter().length() != 1) {
            return;
        }
        try {
            ExecutionReportWriter.write(reportPath, config.getDelimiterChar(), summary.getSteps());
            log.info("Execution report written to {}", reportPath);
        } catch (IOException e) {
            // the run outcome stands; the report is auxiliary
            log.warn("Could not write execution report to {}", reportPath, e);
        }
    }
}
