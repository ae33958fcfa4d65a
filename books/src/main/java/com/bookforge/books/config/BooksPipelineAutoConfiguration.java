package com.bookforge.books.config;

import com.bookforge.books.cleaning.BookCleaningStage;
import com.bookforge.books.features.BookFeatureStage;
import com.bookforge.books.io.CleanedBookTableStore;
import com.bookforge.books.io.FeaturedBookTableStore;
import com.bookforge.books.io.RawBookTableStore;
import com.bookforge.books.model.CleanedBookRecord;
import com.bookforge.books.model.FeaturedBookRecord;
import com.bookforge.books.model.RawBookRecord;
import com.bookforge.config.PipelineConfig;
import com.bookforge.pipeline.PipelineOrchestrator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Spring configuration that wires the book pipeline beans.
 *
 * <p>{@link PipelineConfig} is bound from the {@code bookforge.*} properties.  The same
 * wiring is done by hand in {@link com.bookforge.books.BooksJob#orchestrator()} for the
 * command-line entry point, which does not start a Spring context.</p>
 */
@Configuration
@EnableConfigurationProperties(PipelineConfig.class)
public class BooksPipelineAutoConfiguration {

    @Bean
    public RawBookTableStore rawBookTableStore() {
        return new RawBookTableStore();
    }

    @Bean
    public CleanedBookTableStore cleanedBookTableStore() {
        return new CleanedBookTableStore();
    }

    @Bean
    public FeaturedBookTableStore featuredBookTableStore() {
        return new FeaturedBookTableStore();
    }

    @Bean
    public BookCleaningStage bookCleaningStage() {
        return new BookCleaningStage();
    }

    @Bean
    public BookFeatureStage bookFeatureStage() {
        return new BookFeatureStage();
    }

    @Bean
    public PipelineOrchestrator<RawBookRecord, CleanedBookRecord, FeaturedBookRecord> booksPipelineOrchestrator(
            RawBookTableStore rawStore,
            CleanedBookTableStore cleanedStore,
            FeaturedBookTableStore featuredStore,
            BookCleaningStage cleaningStage,
            BookFeatureStage featureStage) {
        return new PipelineOrchestrator<>(rawStore, cleanedStore, cleanedStore, featuredStore,
                cleaningStage, featureStage);
    }
}
