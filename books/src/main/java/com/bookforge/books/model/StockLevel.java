package com.bookforge.books.model;

import com.bookforge.config.FeatureConfig;
import com.bookforge.error.DomainException;
import lombok.Getter;

/**
 * Stock bands.  With the default breakpoints: Low up to 5 copies, Medium 6–15, High 16+.
 */
public enum StockLevel {

    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High");

    @Getter
    private final String label;

    StockLevel(String label) {
        this.label = label;
    }

    /**
     * @throws DomainException for a negative stock count
     */
    public static StockLevel of(int stock, FeatureConfig config) {
        if (stock < 0) {
            throw new DomainException("stock must be non-negative, got " + stock, null, BookColumns.STOCK);
        }
        if (stock <= config.getStockLowMax()) {
            return LOW;
        }
        if (stock <= config.getStockMediumMax()) {
            return MEDIUM;
        }
        return HIGH;
    }
}
