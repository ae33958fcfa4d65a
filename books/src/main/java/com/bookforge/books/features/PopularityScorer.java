package com.bookforge.books.features;

import com.bookforge.books.model.BookColumns;
import com.bookforge.books.model.CleanedBookRecord;
import com.bookforge.books.model.RatingCategory;
import com.bookforge.config.FeatureConfig;
import com.bookforge.error.DomainException;
import lombok.Getter;

import java.util.List;

/**
 * Popularity score: {@code ratingWeight * rating/5 + stockWeight * normalizedStock}.
 *
 * <p>Stock is min-max normalized over the table the scorer was fitted on.  When every row
 * has the same stock the normalized value is 0 for all of them.</p>
 */
public final class PopularityScorer {

    @Getter
    private final int minStock;

    @Getter
    private final int maxStock;

    private final double ratingWeight;
    private final double stockWeight;

    PopularityScorer(int minStock, int maxStock, double ratingWeight, double stockWeight) {
        this.minStock = minStock;
        this.maxStock = maxStock;
        this.ratingWeight = ratingWeight;
        this.stockWeight = stockWeight;
    }

    /**
     * Captures the stock range of {@code table}.
     */
    public static PopularityScorer fit(List<CleanedBookRecord> table, FeatureConfig config) {
        int min = table.stream().mapToInt(CleanedBookRecord::getStock).min().orElse(0);
        int max = table.stream().mapToInt(CleanedBookRecord::getStock).max().orElse(0);
        return new PopularityScorer(min, max, config.getRatingWeight(), config.getStockWeight());
    }

    /**
     * @throws DomainException if the rating is outside [0,5], or the stock is negative or outside the fitted range
     */
    public double score(int rating, int stock) {
        if (rating < RatingCategory.MIN_RATING || rating > RatingCategory.MAX_RATING) {
            throw new DomainException("rating must be in [0,5], got " + rating, null, BookColumns.RATING);
        }
        if (stock < 0 || stock < minStock || stock > maxStock) {
            throw new DomainException("stock " + stock + " outside fitted range [" + minStock + "," + maxStock + "]",
                    null, BookColumns.STOCK);
        }
        return ratingWeight * rating / RatingCategory.MAX_RATING + stockWeight * normalizeStock(stock);
    }

    double normalizeStock(int stock) {
        if (maxStock == minStock) {
            return 0.0;
        }
        return (double) (stock - minStock) / (maxStock - minStock);
    }
}
