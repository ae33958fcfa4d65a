package com.bookforge.books.features;

import com.bookforge.books.model.BookColumns;
import com.bookforge.books.model.CleanedBookRecord;
import com.bookforge.books.model.FeaturedBookRecord;
import com.bookforge.books.model.PriceRange;
import com.bookforge.books.model.RatingCategory;
import com.bookforge.books.model.StockLevel;
import com.bookforge.books.model.TitleFeatures;
import com.bookforge.books.schema.BookRecordSchema;
import com.bookforge.config.FeatureConfig;
import com.bookforge.config.PipelineConfig;
import com.bookforge.error.DomainException;
import com.bookforge.error.IntegrityException;
import com.bookforge.error.PipelineException;
import com.bookforge.error.SchemaViolationException;
import com.bookforge.model.StageResult;
import com.bookforge.pipeline.Stage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Derives the feature columns of a cleaned book table.
 *
 * <p>Runs in two passes.  The first fits the table-wide pieces: the one-hot column set
 * ({@link CategoryEncoder}) and the stock range ({@link PopularityScorer}).  The second
 * builds one {@link FeaturedBookRecord} per row from the bucketers, {@link TitleFeatures},
 * the scorer and the encoder.  The input rows are never modified.</p>
 *
 * <p>Out-of-domain values (negative price or stock, rating outside [0,5]) fail the stage
 * with a domain error; nothing is clamped.  An empty table fails with an integrity error,
 * as it does in the cleaning stage.</p>
 */
@Slf4j
public class BookFeatureStage implements Stage<List<CleanedBookRecord>, List<FeaturedBookRecord>> {

    public static final String NAME = "feature_engineering";

    public static final String METRIC_CATEGORY_COLUMNS = "category_columns";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageResult<List<FeaturedBookRecord>> execute(List<CleanedBookRecord> cleaned, PipelineConfig config) {
        log.info("Engineering features for {} rows", cleaned.size());
        try {
            if (cleaned.isEmpty()) {
                throw new IntegrityException("Processed table is empty");
            }
            FeatureConfig features = config.getFeatures();

            // ── Pass 1: table-wide fits ──────────────────────────────────────
            CategoryEncoder encoder = CategoryEncoder.fit(
                    cleaned.stream().map(CleanedBookRecord::getCategory).collect(Collectors.toList()));
            PopularityScorer scorer = PopularityScorer.fit(cleaned, features);
            log.debug("Fitted {} category columns {} and stock range [{}, {}]",
                    encoder.size(), encoder.columnNames(), scorer.getMinStock(), scorer.getMaxStock());

            // ── Pass 2: per-row features ─────────────────────────────────────
            List<FeaturedBookRecord> featured = new ArrayList<>(cleaned.size());
            for (int i = 0; i < cleaned.size(); i++) {
                featured.add(derive(cleaned.get(i), i + 1, features, encoder, scorer));
            }

            BookRecordSchema schema = BookRecordSchema.forConfig(config);
            Set<String> columns = encoder.getColumns().keySet();
            for (int i = 0; i < featured.size(); i++) {
                FeaturedBookRecord row = schema.validateFeatured(featured.get(i), i + 1);
                if (!row.getCategoryFlags().keySet().equals(columns)) {
                    throw new SchemaViolationException("row carries category columns "
                            + row.getCategoryFlags().keySet() + " instead of " + columns, i + 1, BookColumns.CATEGORY);
                }
            }

            logDistributions(featured);

            Map<String, Long> metrics = new LinkedHashMap<>();
            metrics.put(METRIC_ROWS_IN, (long) cleaned.size());
            metrics.put(METRIC_ROWS_OUT, (long) featured.size());
            metrics.put(METRIC_FEATURES_CREATED, (long) (BookColumns.DERIVED.size() + encoder.size()));
            metrics.put(METRIC_CATEGORY_COLUMNS, (long) encoder.size());

            log.info("Feature engineering done: {} rows, {} features created",
                    featured.size(), metrics.get(METRIC_FEATURES_CREATED));
            return StageResult.success(NAME, List.copyOf(featured), metrics);
        } catch (PipelineException e) {
            log.error("Feature engineering failed: {}", e.toError().describe());
            return StageResult.failure(NAME, e.toError());
        }
    }

    private static FeaturedBookRecord derive(CleanedBookRecord book, int rowNumber, FeatureConfig features,
                                             CategoryEncoder encoder, PopularityScorer scorer) {
        try {
            return FeaturedBookRecord.builder()
                    .book(book)
                    .priceRange(PriceRange.of(book.getPrice(), features))
                    .title(TitleFeatures.of(book.getTitle()))
                    .ratingCategory(RatingCategory.of(book.getRating()))
                    .stockLevel(StockLevel.of(book.getStock(), features))
                    .popularityScore(scorer.score(book.getRating(), book.getStock()))
                    .categoryFlags(encoder.encode(book.getCategory()))
                    .build();
        } catch (DomainException e) {
            throw new DomainException(e.getMessage(), rowNumber, e.getColumn());
        }
    }

    private static void logDistributions(List<FeaturedBookRecord> featured) {
        if (!log.isInfoEnabled()) {
            return;
        }
        log.info("  price_range:     {}", distribution(featured, FeaturedBookRecord::getPriceRange, PriceRange.class));
        log.info("  rating_category: {}",
                distribution(featured, FeaturedBookRecord::getRatingCategory, RatingCategory.class));
        log.info("  stock_level:     {}", distribution(featured, FeaturedBookRecord::getStockLevel, StockLevel.class));
        log.info("  title flags:     has_subtitle={}, has_series={}, starts_with_the={}, has_numbers={}",
                count(featured, TitleFeatures::isHasSubtitle),
                count(featured, TitleFeatures::isHasSeries),
                count(featured, TitleFeatures::isStartsWithThe),
                count(featured, TitleFeatures::isHasNumbers));
        double min = featured.stream().mapToDouble(FeaturedBookRecord::getPopularityScore).min().orElse(0);
        double max = featured.stream().mapToDouble(FeaturedBookRecord::getPopularityScore).max().orElse(0);
        double mean = featured.stream().mapToDouble(FeaturedBookRecord::getPopularityScore).average().orElse(0);
        log.info("  popularity_score: min={}, max={}, mean={}",
                String.format("%.3f", min), String.format("%.3f", max), String.format("%.3f", mean));
    }

    private static <E extends Enum<E>> Map<E, Long> distribution(List<FeaturedBookRecord> featured,
                                                                 Function<FeaturedBookRecord, E> feature,
                                                                 Class<E> type) {
        Map<E, Long> counts = new EnumMap<>(type);
        for (FeaturedBookRecord row : featured) {
            counts.merge(feature.apply(row), 1L, Long::sum);
        }
        return counts;
    }

    private static long count(List<FeaturedBookRecord> featured, Predicate<TitleFeatures> flag) {
        return featured.stream().map(FeaturedBookRecord::getTitle).filter(flag).count();
    }
}
