package com.bookforge.books.features;

import com.bookforge.books.model.BookColumns;
import com.bookforge.error.DomainException;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * One-hot encoding of the category column.
 *
 * <p>{@link #fit} fixes the column set from the distinct categories of a whole table
 * before any row is encoded.  Columns are ordered by category label, so the same set of
 * categories always yields the same columns regardless of row order.  Column names are
 * {@code category_} plus the lower-cased label with spaces turned into underscores and
 * {@code &} into {@code and}; when two labels map to the same name, later labels (in
 * sorted order) get {@code _2}, {@code _3}, ... appended.</p>
 */
public final class CategoryEncoder {

    /** Category label → column name, in column order. */
    private final Map<String, String> columns;

    private CategoryEncoder(Map<String, String> columns) {
        this.columns = Collections.unmodifiableMap(columns);
    }

    public static CategoryEncoder fit(Collection<String> categories) {
        Map<String, String> columns = new LinkedHashMap<>();
        Set<String> taken = new HashSet<>();
        for (String label : new TreeSet<>(categories)) {
            String base = columnName(label);
            String name = base;
            for (int suffix = 2; !taken.add(name); suffix++) {
                name = base + "_" + suffix;
            }
            columns.put(label, name);
        }
        return new CategoryEncoder(columns);
    }

    static String columnName(String label) {
        return BookColumns.CATEGORY_PREFIX
                + label.replace(" ", "_").replace("&", "and").toLowerCase(Locale.ROOT);
    }

    /**
     * Flags for one row, keyed by category label in column order.
     *
     * @throws DomainException if {@code category} was not part of the fitted set
     */
    public Map<String, Boolean> encode(String category) {
        if (!columns.containsKey(category)) {
            throw new DomainException("category '" + category + "' was not seen when the encoder was fitted",
                    null, BookColumns.CATEGORY);
        }
        Map<String, Boolean> flags = new LinkedHashMap<>();
        for (String label : columns.keySet()) {
            flags.put(label, label.equals(category));
        }
        return Collections.unmodifiableMap(flags);
    }

    /** Category label → column name, in column order. */
    public Map<String, String> getColumns() {
        return columns;
    }

    public List<String> columnNames() {
        return List.copyOf(columns.values());
    }

    public int size() {
        return columns.size();
    }
}
