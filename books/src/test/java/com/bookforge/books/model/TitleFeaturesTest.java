package com.bookforge.books.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TitleFeaturesTest {

    @Test
    @DisplayName("plain title has no flags")
    void plainTitle() {
        TitleFeatures features = TitleFeatures.of("Plain Book");

        assertThat(features.isHasSubtitle()).isFalse();
        assertThat(features.isHasSeries()).isFalse();
        assertThat(features.isStartsWithThe()).isFalse();
        assertThat(features.isHasNumbers()).isFalse();
        assertThat(features.getLength()).isEqualTo(10);
        assertThat(features.getWordCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("subtitle, series and digits are detected")
    void flaggedTitle() {
        TitleFeatures features = TitleFeatures.of("The Black Maria: A Novel (Ghosts #2)");

        assertThat(features.isHasSubtitle()).isTrue();
        assertThat(features.isHasSeries()).isTrue();
        assertThat(features.isStartsWithThe()).isTrue();
        assertThat(features.isHasNumbers()).isTrue();
        assertThat(features.getWordCount()).isEqualTo(7);
    }

    @Test
    @DisplayName("'The' must be a separate leading word")
    void theOnlyAsWord() {
        assertThat(TitleFeatures.of("Theory of Everything").isStartsWithThe()).isFalse();
        assertThat(TitleFeatures.of("the lowercase").isStartsWithThe()).isFalse();
    }

    @Test
    @DisplayName("length counts characters, not UTF-16 units")
    void codePointLength() {
        assertThat(TitleFeatures.of("Café 📚").getLength()).isEqualTo(6);
    }

    @Test
    @DisplayName("word count splits on single spaces")
    void wordCountOnSingleSpaces() {
        assertThat(TitleFeatures.of("a  b").getWordCount()).isEqualTo(3);
    }
}
