package com.bookforge.books.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * A book after cleaning: identified, with a binary availability indicator and a
 * normalized category.  No field is {@code null}; {@code image} may be empty.
 */
@Value
@Builder(toBuilder = true)
public class CleanedBookRecord {

    String id;
    String title;
    BigDecimal price;

    /** 1 when the book is available, 0 otherwise. */
    int availability;

    int rating;
    int stock;
    String category;
    String image;
}
