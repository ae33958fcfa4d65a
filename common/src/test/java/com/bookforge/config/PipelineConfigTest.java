package com.bookforge.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.assertThatCode;

class PipelineConfigTest {

    @TempDir
    Path tmp;

    @Test
    @DisplayName("defaults describe the standard book pipeline layout")
    void defaults() {
        PipelineConfig config = new PipelineConfig();

        assertThat(config.getMode()).isEqualTo(PipelineMode.FULL);
        assertThat(config.getInputFile()).isEqualTo("data/raw/all_books_with_images.csv");
        assertThat(config.getProcessedOutput()).isEqualTo("data/processed/books_processed.csv");
        assertThat(config.getFeaturesOutput()).isEqualTo("data/features/books_features.csv");
        assertThat(config.getDefaultCategory()).isEqualTo("Other");
        assertThat(config.getProblematicCategories()).containsExactly("Add a comment", "Default");
        assertThat(config.getFeatures().getPriceLowMax()).isEqualByComparingTo("20");
        assertThat(config.getFeatures().getRatingWeight()).isEqualTo(0.7);
        assertThatCode(config::validate).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("loads snake_case YAML and keeps defaults for missing keys")
    void loadsYaml() throws IOException {
        Path file = tmp.resolve("config.yaml");
        Files.writeString(file, String.join("\n",
                "mode: cleaning_only",
                "input_file: in/books.csv",
                "delimiter: ';'",
                "problematic_categories: [Unknown]",
                "features:",
                "  price_low_max: 10",
                "  stock_low_max: 2",
                ""));

        PipelineConfig config = PipelineConfig.load(file);

        assertThat(config.getMode()).isEqualTo(PipelineMode.CLEANING_ONLY);
        assertThat(config.getInputPath()).isEqualTo(Path.of("in/books.csv"));
        assertThat(config.getDelimiterChar()).isEqualTo(';');
        assertThat(config.getProblematicCategories()).containsExactly("Unknown");
        assertThat(config.getFeatures().getPriceLowMax()).isEqualByComparingTo("10");
        assertThat(config.getFeatures().getPriceMediumMax()).isEqualByComparingTo("40");
        assertThat(config.getFeatures().getStockLowMax()).isEqualTo(2);
        assertThat(config.getProcessedOutput()).isEqualTo("data/processed/books_processed.csv");
    }

    @Test
    @DisplayName("JSON is accepted as well")
    void loadsJson() throws IOException {
        Path file = tmp.resolve("config.json");
        Files.writeString(file, "{\"default_category\": \"Misc\", \"mode\": \"FEATURES_ONLY\"}");

        PipelineConfig config = PipelineConfig.load(file);

        assertThat(config.getDefaultCategory()).isEqualTo("Misc");
        assertThat(config.getMode()).isEqualTo(PipelineMode.FEATURES_ONLY);
    }

    @Test
    @DisplayName("save then load gives back an equal configuration")
    void saveAndLoad() throws IOException {
        PipelineConfig config = new PipelineConfig();
        config.setDefaultCategory("Misc");
        config.getFeatures().setPriceHighMax(new BigDecimal("60"));
        Path file = tmp.resolve("nested/dir/config.yaml");

        config.save(file);

        assertThat(Files.readString(file)).contains("default_category", "Misc").doesNotContain("input_path");
        assertThat(PipelineConfig.load(file)).isEqualTo(config);
    }

    @Test
    @DisplayName("missing classpath resource is an IOException")
    void missingResource() {
        assertThatThrownBy(() -> PipelineConfig.loadFromClasspath("no-such-config.yaml"))
                .isInstanceOf(IOException.class)
                .hasMessageContaining("no-such-config.yaml");
    }

    @Test
    @DisplayName("validation rejects settings no run could use")
    void validation() {
        PipelineConfig blankInput = new PipelineConfig();
        blankInput.setInputFile(" ");
        assertThatThrownBy(blankInput::validate).hasMessageContaining("input_file");

        PipelineConfig wideDelimiter = new PipelineConfig();
        wideDelimiter.setDelimiter(";;");
        assertThatThrownBy(wideDelimiter::validate).hasMessageContaining("delimiter");

        PipelineConfig problematicDefault = new PipelineConfig();
        problematicDefault.setProblematicCategories(List.of("Other"));
        assertThatThrownBy(problematicDefault::validate).hasMessageContaining("default_category");

        PipelineConfig unorderedPrices = new PipelineConfig();
        unorderedPrices.getFeatures().setPriceMediumMax(new BigDecimal("20"));
        assertThatThrownBy(unorderedPrices::validate).hasMessageContaining("price breakpoints");

        PipelineConfig badWeights = new PipelineConfig();
        badWeights.getFeatures().setStockWeight(0.5);
        assertThatThrownBy(badWeights::validate).hasMessageContaining("weights");
    }

    @Test
    @DisplayName("null entries in problematic_categories are rejected")
    void nullProblematicEntry() throws IOException {
        Path file = tmp.resolve("config.yaml");
        Files.writeString(file, "problematic_categories: [Default, ~]\n");

        PipelineConfig config = PipelineConfig.load(file);

        assertThatThrownBy(config::validate)
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("problematic_categories");
    }

    @Test
    @DisplayName("a blank report path disables the report")
    void blankReportPath() {
        PipelineConfig config = new PipelineConfig();
        config.setReportOutput("");

        assertThat(config.getReportPath()).isNull();
    }
}
