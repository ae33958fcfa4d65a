package com.bookforge.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Top-level pipeline configuration.
 *
 * <p>When running inside a Spring Boot application the properties are bound automatically
 * under the {@code bookforge.*} prefix.  The static {@link #load(Path)} and
 * {@link #loadFromClasspath(String)} helpers read YAML (or JSON, which is valid YAML)
 * with snake_case keys, e.g. {@code input_file} or {@code problematic_categories}.</p>
 *
 * <p>A config instance is a plain value: it is passed into every stage call and never
 * consulted through static state.</p>
 */
@Data
@ConfigurationProperties(prefix = "bookforge")
public class PipelineConfig {

    private static final ObjectMapper YAML_MAPPER = YAMLMapper.builder()
            .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
            .disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
            .build();

    private PipelineMode mode = PipelineMode.FULL;

    private String inputFile = "data/raw/all_books_with_images.csv";
    private String processedOutput = "data/processed/books_processed.csv";
    private String featuresOutput = "data/features/books_features.csv";

    /** Execution report written after every run; blank disables it. */
    private String reportOutput = "data/statistics/pipeline_execution_report.csv";

    /** Column separator for every table the pipeline reads or writes. */
    private String delimiter = ",";

    /** Label that replaces any problematic category. */
    private String defaultCategory = "Other";

    /** Placeholder categories written by the scraper when a page had no real category. */
    private List<String> problematicCategories = new ArrayList<>(List.of("Add a comment", "Default"));

    private FeatureConfig features = new FeatureConfig();

    // ── Loading ──────────────────────────────────────────────────────────

    /**
     * Loads configuration from a YAML or JSON file on disk.
     */
    public static PipelineConfig load(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path)) {
            return YAML_MAPPER.readValue(is, PipelineConfig.class);
        }
    }

    /**
     * Loads configuration from a classpath resource.
     */
    public static PipelineConfig loadFromClasspath(String resource) throws IOException {
        try (InputStream is = PipelineConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Resource not found on classpath: " + resource);
            }
            return YAML_MAPPER.readValue(is, PipelineConfig.class);
        }
    }

    /**
     * Writes this configuration as YAML, creating parent directories as needed.
     */
    public void save(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        YAML_MAPPER.writeValue(path.toFile(), this);
    }

    // ── Validation ───────────────────────────────────────────────────────

    /**
     * Checks the configuration for values no run could succeed with.
     *
     * @throws IllegalArgumentException describing the first invalid setting
     */
    public void validate() {
        if (mode == null) {
            throw new IllegalArgumentException("mode must be set");
        }
        requireText("input_file", inputFile);
        requireText("processed_output", processedOutput);
        requireText("features_output", featuresOutput);
        if (delimiter == null || delimiter.length() != 1) {
            throw new IllegalArgumentException("delimiter must be a single character, got '" + delimiter + "'");
        }
        requireText("default_category", defaultCategory);
        if (problematicCategories == null || problematicCategories.stream().anyMatch(Objects::isNull)) {
            throw new IllegalArgumentException("problematic_categories must not be null or contain null entries");
        }
        if (problematicCategories.contains(defaultCategory)) {
            throw new IllegalArgumentException(
                    "default_category '" + defaultCategory + "' is itself listed in problematic_categories");
        }
        if (features == null) {
            throw new IllegalArgumentException("features section must not be null");
        }
        features.validate();
    }

    // ── Convenience accessors ────────────────────────────────────────────

    @JsonIgnore
    public Path getInputPath() {
        return Path.of(inputFile);
    }

    @JsonIgnore
    public Path getProcessedPath() {
        return Path.of(processedOutput);
    }

    @JsonIgnore
    public Path getFeaturesPath() {
        return Path.of(featuresOutput);
    }

    @JsonIgnore
    public Path getReportPath() {
        return reportOutput == null || reportOutput.isBlank() ? null : Path.of(reportOutput);
    }

    @JsonIgnore
    public char getDelimiterChar() {
        return delimiter.charAt(0);
    }

    private static void requireText(String key, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(key + " must not be blank");
        }
    }
}
