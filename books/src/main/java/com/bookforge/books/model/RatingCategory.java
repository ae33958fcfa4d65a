package com.bookforge.books.model;

import com.bookforge.error.DomainException;
import lombok.Getter;

/**
 * Descriptive bands over the 0–5 star rating.  Zero stars (unrated) shares the bottom
 * band with one star.
 */
public enum RatingCategory {

    VERY_LOW("Very Low"),
    LOW("Low"),
    MEDIUM("Medium"),
    HIGH("High"),
    VERY_HIGH("Very High");

    public static final int MIN_RATING = 0;
    public static final int MAX_RATING = 5;

    @Getter
    private final String label;

    RatingCategory(String label) {
        this.label = label;
    }

    /**
     * @throws DomainException if {@code rating} is outside [0,5]
     */
    public static RatingCategory of(int rating) {
        return switch (rating) {
            case 0, 1 -> VERY_LOW;
            case 2 -> LOW;
            case 3 -> MEDIUM;
            case 4 -> HIGH;
            case 5 -> VERY_HIGH;
            default -> throw new DomainException(
                    "rating must be in [" + MIN_RATING + "," + MAX_RATING + "], got " + rating,
                    null, BookColumns.RATING);
        };
    }
}
