package com.bookforge.books.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * One scraped book, exactly as read from the raw table.
 *
 * <p>Every field may be {@code null}: the cleaning stage decides which nulls are fatal.
 * Raw rows carry no identifier; their position in the table is their only identity.</p>
 */
@Value
@Builder
public class RawBookRecord {

    String title;
    BigDecimal price;

    /** {@code "yes"} or {@code "no"} in well-formed input. */
    String availability;

    Integer rating;
    Integer stock;

    /** Free text; may be one of the scraper's placeholder strings. */
    String category;

    /** Image URL; optional. */
    String image;
}
