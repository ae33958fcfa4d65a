package com.bookforge.books.schema;

import com.bookforge.books.model.BookColumns;
import com.bookforge.books.model.CleanedBookRecord;
import com.bookforge.books.model.FeaturedBookRecord;
import com.bookforge.books.model.RatingCategory;
import com.bookforge.config.PipelineConfig;
import com.bookforge.error.SchemaViolationException;

import java.util.Map;
import java.util.Set;

/**
 * End-of-stage gate for cleaned and featured book rows.
 *
 * <p>Each {@code validate*} method returns the row unchanged when it satisfies every
 * declared constraint and throws {@link SchemaViolationException} on the first one it
 * breaks.  Stages call it once per row after the whole table is built, so a single bad
 * row fails the stage.</p>
 */
public final class BookRecordSchema {

    private final Set<String> problematicCategories;

    public BookRecordSchema(Set<String> problematicCategories) {
        this.problematicCategories = Set.copyOf(problematicCategories);
    }

    public static BookRecordSchema forConfig(PipelineConfig config) {
        return new BookRecordSchema(Set.copyOf(config.getProblematicCategories()));
    }

    public CleanedBookRecord validateCleaned(CleanedBookRecord row) {
        return validateCleaned(row, null);
    }

    /**
     * @param rowNumber 1-based position in the table, for error context; may be {@code null}
     */
    public CleanedBookRecord validateCleaned(CleanedBookRecord row, Integer rowNumber) {
        if (row == null) {
            throw new SchemaViolationException("row is null", rowNumber, null);
        }
        require(row.getId() != null && !row.getId().isBlank(), "id must be present", rowNumber, BookColumns.ID);
        require(row.getTitle() != null, "title must be present", rowNumber, BookColumns.TITLE);
        require(row.getPrice() != null, "price must be present", rowNumber, BookColumns.PRICE);
        require(row.getPrice().signum() >= 0, "price must be non-negative, got " + row.getPrice(),
                rowNumber, BookColumns.PRICE);
        require(row.getAvailability() == 0 || row.getAvailability() == 1,
                "availability must be 0 or 1, got " + row.getAvailability(), rowNumber, BookColumns.AVAILABILITY);
        require(row.getRating() >= RatingCategory.MIN_RATING && row.getRating() <= RatingCategory.MAX_RATING,
                "rating must be in [0,5], got " + row.getRating(), rowNumber, BookColumns.RATING);
        require(row.getStock() >= 0, "stock must be non-negative, got " + row.getStock(),
                rowNumber, BookColumns.STOCK);
        require(row.getCategory() != null, "category must be present", rowNumber, BookColumns.CATEGORY);
        require(!problematicCategories.contains(row.getCategory()),
                "category '" + row.getCategory() + "' is a placeholder and should have been normalized",
                rowNumber, BookColumns.CATEGORY);
        require(row.getImage() != null, "image must not be null (use an empty string)", rowNumber, BookColumns.IMAGE);
        return row;
    }

    public FeaturedBookRecord validateFeatured(FeaturedBookRecord row) {
        return validateFeatured(row, null);
    }

    /**
     * Validates the cleaned part of the row, then every derived column.
     *
     * @param rowNumber 1-based position in the table, for error context; may be {@code null}
     */
    public FeaturedBookRecord validateFeatured(FeaturedBookRecord row, Integer rowNumber) {
        if (row == null) {
            throw new SchemaViolationException("row is null", rowNumber, null);
        }
        require(row.getBook() != null, "cleaned record must be present", rowNumber, null);
        validateCleaned(row.getBook(), rowNumber);

        require(row.getPriceRange() != null, "price_range must be present", rowNumber, BookColumns.PRICE_RANGE);
        require(row.getRatingCategory() != null, "rating_category must be present",
                rowNumber, BookColumns.RATING_CATEGORY);
        require(row.getStockLevel() != null, "stock_level must be present", rowNumber, BookColumns.STOCK_LEVEL);
        require(row.getTitle() != null, "title features must be present", rowNumber, BookColumns.TITLE_LENGTH);
        require(row.getTitle().getLength() >= 0, "title_length must be non-negative",
                rowNumber, BookColumns.TITLE_LENGTH);
        require(row.getTitle().getWordCount() >= 0, "title_word_count must be non-negative",
                rowNumber, BookColumns.TITLE_WORD_COUNT);

        double score = row.getPopularityScore();
        require(!Double.isNaN(score) && score >= 0.0 && score <= 1.0,
                "popularity_score must be in [0,1], got " + score, rowNumber, BookColumns.POPULARITY_SCORE);

        validateOneHot(row, rowNumber);
        return row;
    }

    private static void validateOneHot(FeaturedBookRecord row, Integer rowNumber) {
        Map<String, Boolean> flags = row.getCategoryFlags();
        require(flags != null && !flags.isEmpty(), "category columns must be present",
                rowNumber, BookColumns.CATEGORY);

        String hot = null;
        for (Map.Entry<String, Boolean> flag : flags.entrySet()) {
            require(flag.getValue() != null, "category flag for '" + flag.getKey() + "' is null",
                    rowNumber, BookColumns.CATEGORY);
            if (flag.getValue()) {
                require(hot == null, "more than one category flag set ('" + hot + "', '" + flag.getKey() + "')",
                        rowNumber, BookColumns.CATEGORY);
                hot = flag.getKey();
            }
        }
        require(hot != null, "no category flag set", rowNumber, BookColumns.CATEGORY);
        require(hot.equals(row.getBook().getCategory()),
                "category flag '" + hot + "' does not match category '" + row.getBook().getCategory() + "'",
                rowNumber, BookColumns.CATEGORY);
    }

    private static void require(boolean condition, String message, Integer rowNumber, String column) {
        if (!condition) {
            throw new SchemaViolationException(message, rowNumber, column);
        }
    }
}
