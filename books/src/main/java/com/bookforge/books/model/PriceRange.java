package com.bookforge.books.model;

import com.bookforge.config.FeatureConfig;
import com.bookforge.error.DomainException;
import lombok.Getter;

import java.math.BigDecimal;

/**
 * Price bands.  With the default breakpoints: Low up to 20, Medium up to 40, High up
 * to 50, Premium above.  Each breakpoint belongs to the band below it, so the bands
 * cover every non-negative price exactly once.
 */
public enum PriceRange {

    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High"),
    PREMIUM("Premium");

    @Getter
    private final String label;

    PriceRange(String label) {
        this.label = label;
    }

    /**
     * @throws DomainException for a missing or negative price
     */
    public static PriceRange of(BigDecimal price, FeatureConfig config) {
        if (price == null || price.signum() < 0) {
            throw new DomainException("price must be non-negative, got " + price, null, BookColumns.PRICE);
        }
        if (price.compareTo(config.getPriceLowMax()) <= 0) {
            return LOW;
        }
        if (price.compareTo(config.getPriceMediumMax()) <= 0) {
            return MEDIUM;
        }
        if (price.compareTo(config.getPriceHighMax()) <= 0) {
            return HIGH;
        }
        return PREMIUM;
    }
}
