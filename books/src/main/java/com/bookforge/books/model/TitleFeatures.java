package com.bookforge.books.model;

import lombok.Value;

/**
 * Shape flags and counts derived from a book title.
 */
@Value
public class TitleFeatures {

    /** Title contains a colon. */
    boolean hasSubtitle;

    /** Title contains an opening parenthesis, as in "(Series #3)". */
    boolean hasSeries;

    /** Title starts with the word "The". */
    boolean startsWithThe;

    /** Number of characters. */
    int length;

    /** Number of tokens when splitting on single spaces. */
    int wordCount;

    /** Title contains at least one digit. */
    boolean hasNumbers;

    public static TitleFeatures of(String title) {
        boolean hasNumbers = title.codePoints().anyMatch(Character::isDigit);
        return new TitleFeatures(
                title.indexOf(':') >= 0,
                title.indexOf('(') >= 0,
                title.startsWith("The "),
                title.codePointCount(0, title.length()),
                title.split(" ", -1).length,
                hasNumbers);
    }
}
