package com.bookforge.io;

import com.bookforge.error.IntegrityException;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Typed access to the cells of a parsed CSV row.
 *
 * <p>Blank cells read as {@code null}; malformed cells raise an {@link IntegrityException}
 * naming the row and column.</p>
 */
public final class CsvCells {

    private CsvCells() {
        // utility class
    }

    public static String text(Map<String, String> row, String column) {
        String value = row.get(column);
        return value == null || value.isBlank() ? null : value;
    }

    public static BigDecimal decimal(Map<String, String> row, String column, int rowNumber) {
        String value = text(row, column);
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new IntegrityException("Unparseable decimal '" + value + "'", rowNumber, column, e);
        }
    }

    public static Integer integer(Map<String, String> row, String column, int rowNumber) {
        String value = text(row, column);
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        try {
            return Integer.valueOf(trimmed);
        } catch (NumberFormatException e) {
            // integral values written as "4.0" by spreadsheet tools
            try {
                return new BigDecimal(trimmed).intValueExact();
            } catch (NumberFormatException | ArithmeticException notIntegral) {
                throw new IntegrityException("Unparseable integer '" + value + "'", rowNumber, column, e);
            }
        }
    }

    /**
     * Like {@link #text} but a blank cell is an error.
     */
    public static String requiredText(Map<String, String> row, String column, int rowNumber) {
        String value = text(row, column);
        if (value == null) {
            throw new IntegrityException("Missing value", rowNumber, column);
        }
        return value;
    }

    public static BigDecimal requiredDecimal(Map<String, String> row, String column, int rowNumber) {
        BigDecimal value = decimal(row, column, rowNumber);
        if (value == null) {
            throw new IntegrityException("Missing value", rowNumber, column);
        }
        return value;
    }

    public static int requiredInteger(Map<String, String> row, String column, int rowNumber) {
        Integer value = integer(row, column, rowNumber);
        if (value == null) {
            throw new IntegrityException("Missing value", rowNumber, column);
        }
        return value;
    }
}
