package com.bookforge.books;

import com.bookforge.config.PipelineConfig;
import com.bookforge.config.PipelineMode;
import com.bookforge.error.ErrorKind.ExitStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static com.bookforge.books.BookFixtures.rawCsv;
import static org.assertj.core.api.Assertions.assertThat;

class BooksJobTest {

    @TempDir
    Path tmp;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    private Path configFile;
    private PipelineConfig config;

    @BeforeEach
    void setUp() throws IOException {
        config = new PipelineConfig();
        config.setInputFile(tmp.resolve("raw.csv").toString());
        config.setProcessedOutput(tmp.resolve("processed.csv").toString());
        config.setFeaturesOutput(tmp.resolve("features.csv").toString());
        config.setReportOutput(tmp.resolve("report.csv").toString());
        configFile = tmp.resolve("config.yaml");
        config.save(configFile);
    }

    private int run(String... args) {
        return new BooksJob().run(args, out);
    }

    @Test
    @DisplayName("successful full run exits 0")
    void success() throws IOException {
        Files.writeString(config.getInputPath(), rawCsv("Plain Book,25.0,yes,4,10,Add a comment,"));

        assertThat(run("--config", configFile.toString())).isEqualTo(ExitStatus.SUCCESS);
        assertThat(Files.exists(config.getFeaturesPath())).isTrue();
    }

    @Test
    @DisplayName("--cleaning-only overrides the configured mode")
    void cleaningOnlyFlag() throws IOException {
        Files.writeString(config.getInputPath(), rawCsv("Plain Book,25.0,yes,4,10,Poetry,"));

        assertThat(run("-c", configFile.toString(), "--cleaning-only")).isEqualTo(ExitStatus.SUCCESS);
        assertThat(Files.exists(config.getProcessedPath())).isTrue();
        assertThat(Files.exists(config.getFeaturesPath())).isFalse();
    }

    @Test
    @DisplayName("bad input exits 2")
    void badInput() throws IOException {
        Files.writeString(config.getInputPath(), rawCsv("Plain Book,,yes,4,10,Poetry,"));

        assertThat(run("--config", configFile.toString())).isEqualTo(ExitStatus.BAD_INPUT);
    }

    @Test
    @DisplayName("features-only without a processed table exits 3")
    void missingPrerequisite() {
        assertThat(run("--config", configFile.toString(), "--features-only"))
                .isEqualTo(ExitStatus.MISSING_PREREQUISITE);
    }

    @Test
    @DisplayName("conflicting mode flags are a usage error")
    void conflictingModes() {
        assertThat(run("--cleaning-only", "--features-only")).isEqualTo(ExitStatus.USAGE);
        assertThat(buffer.toString(StandardCharsets.UTF_8)).contains("mutually exclusive");
    }

    @Test
    @DisplayName("unknown options and missing values are usage errors")
    void usageErrors() {
        assertThat(run("--bogus")).isEqualTo(ExitStatus.USAGE);
        assertThat(run("--config")).isEqualTo(ExitStatus.USAGE);
    }

    @Test
    @DisplayName("a config file with an empty mode is a usage error")
    void nullModeInConfigFile() throws IOException {
        Path file = tmp.resolve("null-mode.yaml");
        Files.writeString(file, "mode: ~\nreport_output: " + config.getReportOutput() + "\n");

        assertThat(run("--config", file.toString())).isEqualTo(ExitStatus.USAGE);
    }

    @Test
    @DisplayName("an unreadable config file is a usage error")
    void missingConfigFile() {
        assertThat(run("--config", tmp.resolve("absent.yaml").toString())).isEqualTo(ExitStatus.USAGE);
    }

    @Test
    @DisplayName("--create-config writes the defaults and exits 0")
    void createConfig() throws IOException {
        Path target = tmp.resolve("generated/pipeline-config.yaml");

        assertThat(run("--create-config", target.toString())).isEqualTo(ExitStatus.SUCCESS);
        PipelineConfig written = PipelineConfig.load(target);
        assertThat(written).isEqualTo(new PipelineConfig());
        assertThat(written.getMode()).isEqualTo(PipelineMode.FULL);
    }

    @Test
    @DisplayName("--info describes both steps and exits 0")
    void info() {
        assertThat(run("--info")).isEqualTo(ExitStatus.SUCCESS);
        assertThat(buffer.toString(StandardCharsets.UTF_8))
                .contains("BookForge Books Pipeline", "data_cleaning", "feature_engineering");
    }

    @Test
    @DisplayName("the bundled default configuration matches the built-in defaults")
    void bundledDefaults() throws IOException {
        assertThat(PipelineConfig.loadFromClasspath("pipeline-config.yaml")).isEqualTo(new PipelineConfig());
    }
}
