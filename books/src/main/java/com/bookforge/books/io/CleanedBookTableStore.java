package com.bookforge.books.io;

import com.bookforge.books.model.BookColumns;
import com.bookforge.books.model.CleanedBookRecord;
import com.bookforge.config.PipelineConfig;
import com.bookforge.io.CsvCells;
import com.bookforge.io.CsvTable;
import com.bookforge.io.CsvTables;
import com.bookforge.io.TableReader;
import com.bookforge.io.TableWriter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes the processed book table ({@code id,title,price,availability,rating,
 * stock,category,image}).
 *
 * <p>Only {@code image} may be blank when reading back; any other blank cell fails the
 * read.</p>
 */
@Slf4j
public class CleanedBookTableStore implements TableReader<CleanedBookRecord>, TableWriter<CleanedBookRecord> {

    @Override
    public List<CleanedBookRecord> read(Path path, PipelineConfig config) throws IOException {
        CsvTable table = CsvTables.read(path, config.getDelimiterChar());
        CsvTables.requireColumns(path, table, BookColumns.PROCESSED);

        List<CleanedBookRecord> records = new ArrayList<>(table.getRows().size());
        int rowNumber = 0;
        for (Map<String, String> row : table.getRows()) {
            rowNumber++;
            String image = CsvCells.text(row, BookColumns.IMAGE);
            records.add(CleanedBookRecord.builder()
                    .id(CsvCells.requiredText(row, BookColumns.ID, rowNumber))
                    .title(CsvCells.requiredText(row, BookColumns.TITLE, rowNumber))
                    .price(CsvCells.requiredDecimal(row, BookColumns.PRICE, rowNumber))
                    .availability(CsvCells.requiredInteger(row, BookColumns.AVAILABILITY, rowNumber))
                    .rating(CsvCells.requiredInteger(row, BookColumns.RATING, rowNumber))
                    .stock(CsvCells.requiredInteger(row, BookColumns.STOCK, rowNumber))
                    .category(CsvCells.requiredText(row, BookColumns.CATEGORY, rowNumber))
                    .image(image == null ? "" : image)
                    .build());
        }
        log.info("Loaded {} processed book rows from {}", records.size(), path);
        return records;
    }

    @Override
    public void write(Path path, List<CleanedBookRecord> table, PipelineConfig config) throws IOException {
        List<Map<String, String>> rows = new ArrayList<>(table.size());
        for (CleanedBookRecord record : table) {
            rows.add(toRow(record));
        }
        CsvTables.write(path, config.getDelimiterChar(), BookColumns.PROCESSED, rows);
        log.info("Saved {} processed book rows to {}", rows.size(), path);
    }

    static Map<String, String> toRow(CleanedBookRecord record) {
        Map<String, String> row = new LinkedHashMap<>();
        row.put(BookColumns.ID, record.getId());
        row.put(BookColumns.TITLE, record.getTitle());
        row.put(BookColumns.PRICE, record.getPrice().toPlainString());
        row.put(BookColumns.AVAILABILITY, Integer.toString(record.getAvailability()));
        row.put(BookColumns.RATING, Integer.toString(record.getRating()));
        row.put(BookColumns.STOCK, Integer.toString(record.getStock()));
        row.put(BookColumns.CATEGORY, record.getCategory());
        row.put(BookColumns.IMAGE, record.getImage());
        return row;
    }
}
