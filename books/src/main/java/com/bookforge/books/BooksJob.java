package com.bookforge.books;

import com.bookforge.BookForgeJobBase;
import com.bookforge.books.cleaning.BookCleaningStage;
import com.bookforge.books.features.BookFeatureStage;
import com.bookforge.books.io.CleanedBookTableStore;
import com.bookforge.books.io.FeaturedBookTableStore;
import com.bookforge.books.io.RawBookTableStore;
import com.bookforge.books.model.CleanedBookRecord;
import com.bookforge.books.model.FeaturedBookRecord;
import com.bookforge.books.model.RawBookRecord;
import com.bookforge.pipeline.PipelineOrchestrator;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Entry point for the book cleaning and feature engineering pipeline.
 *
 * <p>Usage:
 * <pre>
 *   java -jar bookforge-books.jar [--config PATH] [--cleaning-only | --features-only]
 *                                 [--create-config PATH] [--info] [--verbose]
 * </pre>
 *
 * <p>If no config path is supplied, the default classpath resource
 * {@code pipeline-config.yaml} is used.</p>
 */
@Slf4j
public class BooksJob extends BookForgeJobBase {

    private static final String DEFAULT_CONFIG = "pipeline-config.yaml";

    @Override
    protected String getDefaultConfigResource() {
        return DEFAULT_CONFIG;
    }

    @Override
    protected String getJobName() {
        return "BookForge Books Pipeline";
    }

    @Override
    protected List<String> describePipeline() {
        return List.of(
                "Step 1 - " + BookCleaningStage.NAME + ":",
                "  * fail on null values outside 'image'",
                "  * assign a unique id to every book",
                "  * replace placeholder categories with the default category",
                "  * convert availability yes/no to 1/0",
                "Step 2 - " + BookFeatureStage.NAME + ":",
                "  * price_range, rating_category, stock_level bands",
                "  * title features: subtitle, series, leading 'The', length, word count, digits",
                "  * popularity_score from rating and normalized stock",
                "  * one-hot category_* columns");
    }

    @Override
    protected PipelineOrchestrator<RawBookRecord, CleanedBookRecord, FeaturedBookRecord> createOrchestrator() {
        return orchestrator();
    }

    /**
     * The book pipeline wired with its default stages and stores.
     */
    public static PipelineOrchestrator<RawBookRecord, CleanedBookRecord, FeaturedBookRecord> orchestrator() {
        CleanedBookTableStore cleanedStore = new CleanedBookTableStore();
        return new PipelineOrchestrator<>(new RawBookTableStore(), cleanedStore, cleanedStore,
                new FeaturedBookTableStore(), new BookCleaningStage(), new BookFeatureStage());
    }

    public static void main(String[] args) {
        System.exit(new BooksJob().run(args));
    }
}
