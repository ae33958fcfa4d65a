package com.bookforge.books.io;

import com.bookforge.books.features.CategoryEncoder;
import com.bookforge.books.model.BookColumns;
import com.bookforge.books.model.FeaturedBookRecord;
import com.bookforge.books.model.TitleFeatures;
import com.bookforge.config.PipelineConfig;
import com.bookforge.io.CsvTables;
import com.bookforge.io.TableWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes the features table: the processed columns, the derived columns, then one
 * {@code category_*} column per category.  Bands are written by label, flags as
 * {@code true}/{@code false}.
 */
@Slf4j
public class FeaturedBookTableStore implements TableWriter<FeaturedBookRecord> {

    @Override
    public void write(Path path, List<FeaturedBookRecord> table, PipelineConfig config) throws IOException {
        // every row carries the same category keys, so the first row fixes the one-hot columns
        Map<String, String> categoryColumns = table.isEmpty()
                ? Map.of()
                : CategoryEncoder.fit(table.get(0).getCategoryFlags().keySet()).getColumns();

        List<String> columns = new ArrayList<>(BookColumns.PROCESSED);
        columns.addAll(BookColumns.DERIVED);
        columns.addAll(categoryColumns.values());

        List<Map<String, String>> rows = new ArrayList<>(table.size());
        for (FeaturedBookRecord record : table) {
            Map<String, String> row = CleanedBookTableStore.toRow(record.getBook());
            TitleFeatures title = record.getTitle();
            row.put(BookColumns.PRICE_RANGE, record.getPriceRange().getLabel());
            row.put(BookColumns.HAS_SUBTITLE, Boolean.toString(title.isHasSubtitle()));
            row.put(BookColumns.HAS_SERIES, Boolean.toString(title.isHasSeries()));
            row.put(BookColumns.STARTS_WITH_THE, Boolean.toString(title.isStartsWithThe()));
            row.put(BookColumns.TITLE_LENGTH, Integer.toString(title.getLength()));
            row.put(BookColumns.RATING_CATEGORY, record.getRatingCategory().getLabel());
            row.put(BookColumns.STOCK_LEVEL, record.getStockLevel().getLabel());
            row.put(BookColumns.TITLE_WORD_COUNT, Integer.toString(title.getWordCount()));
            row.put(BookColumns.HAS_NUMBERS, Boolean.toString(title.isHasNumbers()));
            row.put(BookColumns.POPULARITY_SCORE, Double.toString(record.getPopularityScore()));
            for (Map.Entry<String, Boolean> flag : record.getCategoryFlags().entrySet()) {
                row.put(categoryColumns.get(flag.getKey()), Boolean.toString(flag.getValue()));
            }
            rows.add(row);
        }

        CsvTables.write(path, config.getDelimiterChar(), columns, rows);
        log.info("Saved {} featured book rows ({} columns) to {}", rows.size(), columns.size(), path);
    }
}
