package com.bookforge.books.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * A cleaned book together with its derived columns.
 *
 * <p>The cleaned record is carried unchanged; every other field is a deterministic
 * function of it and of table-wide statistics (stock range, category set).</p>
 */
@Value
@Builder
public class FeaturedBookRecord {

    CleanedBookRecord book;

    PriceRange priceRange;
    TitleFeatures title;
    RatingCategory ratingCategory;
    StockLevel stockLevel;

    /** In [0,1]. */
    double popularityScore;

    /**
     * One-hot flags keyed by category label, in column order.  Exactly one entry is
     * {@code true}: the one for {@code book.getCategory()}.
     */
    Map<String, Boolean> categoryFlags;
}
