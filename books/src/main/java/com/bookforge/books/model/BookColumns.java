package com.bookforge.books.model;

import java.util.List;

/**
 * Column names of the three book tables.
 */
public final class BookColumns {

    public static final String ID = "id";
    public static final String TITLE = "title";
    public static final String PRICE = "price";
    public static final String AVAILABILITY = "availability";
    public static final String RATING = "rating";
    public static final String STOCK = "stock";
    public static final String CATEGORY = "category";
    public static final String IMAGE = "image";

    public static final String PRICE_RANGE = "price_range";
    public static final String HAS_SUBTITLE = "has_subtitle";
    public static final String HAS_SERIES = "has_series";
    public static final String STARTS_WITH_THE = "starts_with_the";
    public static final String TITLE_LENGTH = "title_length";
    public static final String TITLE_WORD_COUNT = "title_word_count";
    public static final String HAS_NUMBERS = "has_numbers";
    public static final String RATING_CATEGORY = "rating_category";
    public static final String STOCK_LEVEL = "stock_level";
    public static final String POPULARITY_SCORE = "popularity_score";

    /** Prefix of every one-hot category column. */
    public static final String CATEGORY_PREFIX = "category_";

    /** Columns of the scraped input, in file order. */
    public static final List<String> RAW = List.of(TITLE, PRICE, AVAILABILITY, RATING, STOCK, CATEGORY, IMAGE);

    /** Columns of the processed table, in file order. */
    public static final List<String> PROCESSED =
            List.of(ID, TITLE, PRICE, AVAILABILITY, RATING, STOCK, CATEGORY, IMAGE);

    /** Derived columns that precede the one-hot category columns in the features table. */
    public static final List<String> DERIVED = List.of(
            PRICE_RANGE, HAS_SUBTITLE, HAS_SERIES, STARTS_WITH_THE, TITLE_LENGTH,
            RATING_CATEGORY, STOCK_LEVEL, TITLE_WORD_COUNT, HAS_NUMBERS, POPULARITY_SCORE);

    private BookColumns() {
    }
}
