package com.bookforge.books.io;

import com.bookforge.books.model.BookColumns;
import com.bookforge.books.model.RawBookRecord;
import com.bookforge.config.PipelineConfig;
import com.bookforge.io.CsvCells;
import com.bookforge.io.CsvTable;
import com.bookforge.io.CsvTables;
import com.bookforge.io.TableReader;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the scraped book table.  Blank cells become {@code null}; deciding what a missing
 * value means is left to the cleaning stage.
 */
@Slf4j
public class RawBookTableStore implements TableReader<RawBookRecord> {

    @Override
    public List<RawBookRecord> read(Path path, PipelineConfig config) throws IOException {
        CsvTable table = CsvTables.read(path, config.getDelimiterChar());
        CsvTables.requireColumns(path, table, BookColumns.RAW);

        List<RawBookRecord> records = new ArrayList<>(table.getRows().size());
        int rowNumber = 0;
        for (Map<String, String> row : table.getRows()) {
            rowNumber++;
            records.add(RawBookRecord.builder()
                    .title(CsvCells.text(row, BookColumns.TITLE))
                    .price(CsvCells.decimal(row, BookColumns.PRICE, rowNumber))
                    .availability(CsvCells.text(row, BookColumns.AVAILABILITY))
                    .rating(CsvCells.integer(row, BookColumns.RATING, rowNumber))
                    .stock(CsvCells.integer(row, BookColumns.STOCK, rowNumber))
                    .category(CsvCells.text(row, BookColumns.CATEGORY))
                    .image(CsvCells.text(row, BookColumns.IMAGE))
                    .build());
        }
        log.info("Loaded {} raw book rows from {}", records.size(), path);
        return records;
    }
}
