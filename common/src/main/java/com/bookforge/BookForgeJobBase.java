package com.bookforge;

import ch.qos.logback.classic.Level;
import com.bookforge.config.PipelineConfig;
import com.bookforge.config.PipelineMode;
import com.bookforge.error.ErrorKind.ExitStatus;
import com.bookforge.model.RunSummary;
import com.bookforge.pipeline.PipelineOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.List;

/**
 * Abstract base for domain-specific pipeline jobs.
 *
 * <p>Subclasses provide the default config resource, a display name, the pipeline
 * description printed by {@code --info}, and the wired {@link PipelineOrchestrator}.
 * Argument handling, config loading and exit statuses are shared.</p>
 *
 * <p>Usage in a sub-project:
 * <pre>
 *   public class BooksJob extends BookForgeJobBase {
 *       protected String getDefaultConfigResource() { return "pipeline-config.yaml"; }
 *       ...
 *       public static void main(String[] args) { System.exit(new BooksJob().run(args)); }
 *   }
 * </pre>
 *
 * <p>Options:
 * <ul>
 *   <li>{@code --config, -c PATH} – load configuration from a YAML/JSON file</li>
 *   <li>{@code --cleaning-only} / {@code --features-only} – run a single stage</li>
 *   <li>{@code --create-config PATH} – write the default configuration and exit</li>
 *   <li>{@code --info} – print the pipeline description and exit</li>
 *   <li>{@code --verbose, -v} – debug logging</li>
 * </ul>
 */
@Slf4j
public abstract class BookForgeJobBase {

    /**
     * Classpath resource loaded when no {@code --config} path is supplied.
     */
    protected abstract String getDefaultConfigResource();

    /**
     * Display name used in logs and the {@code --info} banner.
     */
    protected abstract String getJobName();

    /**
     * Lines printed by {@code --info}, describing what each stage does.
     */
    protected abstract List<String> describePipeline();

    /**
     * Builds the orchestrator wired with this job's stages and table stores.
     */
    protected abstract PipelineOrchestrator<?, ?, ?> createOrchestrator();

    public int run(String[] args) {
        return run(args, System.out);
    }

    /**
     * Runs the job and returns the process exit status.
     *
     * @param args command-line arguments
     * @param out  where {@code --info} and usage text are printed
     */
    public int run(String[] args, PrintStream out) {
        JobArguments arguments;
        try {
            arguments = JobArguments.parse(args);
        } catch (IllegalArgumentException e) {
            out.println("Error: " + e.getMessage());
            printUsage(out);
            return ExitStatus.USAGE;
        }

        if (arguments.help) {
            printUsage(out);
            return ExitStatus.SUCCESS;
        }
        if (arguments.info) {
            printInfo(out);
            return ExitStatus.SUCCESS;
        }
        if (arguments.verbose) {
            enableDebugLogging();
        }

        PipelineOrchestrator<?, ?, ?> orchestrator = createOrchestrator();

        if (arguments.createConfigPath != null) {
            try {
                orchestrator.exportConfigTemplate(Path.of(arguments.createConfigPath));
                out.println("Default configuration written to " + arguments.createConfigPath);
                return ExitStatus.SUCCESS;
            } catch (IOException e) {
                log.error("Could not write default configuration to {}", arguments.createConfigPath, e);
                return ExitStatus.INTERNAL;
            }
        }

        // ── Load configuration ───────────────────────────────────────────
        PipelineConfig config;
        try {
            if (arguments.configPath != null) {
                log.info("Loading configuration from file: {}", arguments.configPath);
                config = PipelineConfig.load(Path.of(arguments.configPath));
            } else {
                String resource = getDefaultConfigResource();
                log.info("Loading configuration from classpath: {}", resource);
                config = PipelineConfig.loadFromClasspath(resource);
            }
        } catch (IOException e) {
            log.error("Could not load configuration: {}", e.getMessage());
            return ExitStatus.USAGE;
        }

        PipelineMode mode = arguments.mode != null ? arguments.mode : config.getMode();
        log.info("{} [{}]", getJobName(), mode);

        // ── Run ──────────────────────────────────────────────────────────
        RunSummary summary = orchestrator.run(mode, config);
        if (summary.isSuccess()) {
            return ExitStatus.SUCCESS;
        }
        return summary.getError().getKind().getExitStatus();
    }

    private void printInfo(PrintStream out) {
        String rule = "=".repeat(60);
        out.println(rule);
        out.println(getJobName());
        out.println(rule);
        describePipeline().forEach(out::println);
        out.println(rule);
    }

    private static void printUsage(PrintStream out) {
        out.println("Options:");
        out.println("  -c, --config PATH        load configuration from a YAML or JSON file");
        out.println("      --cleaning-only      run the cleaning stage only");
        out.println("      --features-only      run the feature stage only (needs the processed table)");
        out.println("      --create-config PATH write the default configuration and exit");
        out.println("      --info               describe the pipeline and exit");
        out.println("  -v, --verbose            debug logging");
        out.println("  -h, --help               show this help");
    }

    private static void enableDebugLogging() {
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
        }
    }

    /**
     * Parsed command line.
     */
    static final class JobArguments {
        String configPath;
        String createConfigPath;
        PipelineMode mode;
        boolean info;
        boolean verbose;
        boolean help;

        static JobArguments parse(String[] args) {
            JobArguments parsed = new JobArguments();
            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                switch (arg) {
                    case "-c", "--config" -> parsed.configPath = value(args, ++i, arg);
                    case "--create-config" -> parsed.createConfigPath = value(args, ++i, arg);
                    case "--cleaning-only" -> parsed.setMode(PipelineMode.CLEANING_ONLY);
                    case "--features-only" -> parsed.setMode(PipelineMode.FEATURES_ONLY);
                    case "--info" -> parsed.info = true;
                    case "-v", "--verbose" -> parsed.verbose = true;
                    case "-h", "--help" -> parsed.help = true;
                    default -> throw new IllegalArgumentException("Unknown option: " + arg);
                }
            }
            return parsed;
        }

        private void setMode(PipelineMode requested) {
            if (mode != null && mode != requested) {
                throw new IllegalArgumentException("--cleaning-only and --features-only are mutually exclusive");
            }
            mode = requested;
        }

        private static String value(String[] args, int index, String option) {
            if (index >= args.length) {
                throw new IllegalArgumentException(option + " requires a value");
            }
            return args[index];
        }
    }
}
