package com.bookforge.config;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Bucket breakpoints and score weights used by the feature stage.
 *
 * <p>Each {@code *Max} value is the inclusive upper bound of its band; anything above
 * the last breakpoint falls into the top band.</p>
 */
@Data
@NoArgsConstructor
public class FeatureConfig {

    /** Upper bound of the "Low" price band. */
    private BigDecimal priceLowMax = new BigDecimal("20");

    /** Upper bound of the "Medium" price band. */
    private BigDecimal priceMediumMax = new BigDecimal("40");

    /** Upper bound of the "High" price band; above it is "Premium". */
    private BigDecimal priceHighMax = new BigDecimal("50");

    /** Upper bound of the "Low" stock level. */
    private int stockLowMax = 5;

    /** Upper bound of the "Medium" stock level; above it is "High". */
    private int stockMediumMax = 15;

    /** Weight of the normalized rating in the popularity score. */
    private double ratingWeight = 0.7;

    /** Weight of the normalized stock in the popularity score. */
    private double stockWeight = 0.3;

    void validate() {
        if (priceLowMax == null || priceMediumMax == null || priceHighMax == null) {
            throw new IllegalArgumentException("price breakpoints must all be set");
        }
        if (priceLowMax.signum() < 0
                || priceLowMax.compareTo(priceMediumMax) >= 0
                || priceMediumMax.compareTo(priceHighMax) >= 0) {
            throw new IllegalArgumentException("price breakpoints must be non-negative and strictly increasing: "
                    + priceLowMax + ", " + priceMediumMax + ", " + priceHighMax);
        }
        if (stockLowMax < 0 || stockLowMax >= stockMediumMax) {
            throw new IllegalArgumentException("stock breakpoints must be non-negative and strictly increasing: "
                    + stockLowMax + ", " + stockMediumMax);
        }
        if (ratingWeight < 0 || stockWeight < 0 || Math.abs(ratingWeight + stockWeight - 1.0) > 1e-9) {
            throw new IllegalArgumentException("popularity weights must be non-negative and sum to 1, got "
                    + ratingWeight + " + " + stockWeight);
        }
    }
}
