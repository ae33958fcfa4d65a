package com.bookforge.io;

import com.bookforge.error.IntegrityException;
import com.fasterxml.jackson.core.FormatSchema;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads and writes header-first delimited tables with Jackson's CSV module.
 *
 * <p>Reads are fully materialized. Writes go to a temporary file next to the target and
 * are moved over it only once every row has been written, so an aborted write never
 * leaves a truncated table behind.</p>
 */
@Slf4j
public final class CsvTables {

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();
    private static final TypeReference<Map<String, String>> ROW_TYPE = new TypeReference<>() {};

    private CsvTables() {
        // utility class
    }

    /**
     * Reads a whole table.
     *
     * <p>Blank lines are skipped.</p>
     *
     * @throws IntegrityException if a row cannot be parsed (e.g. more cells than the header) or
     *                            the file is not valid UTF-8
     */
    public static CsvTable read(Path path, char delimiter) throws IOException {
        CsvSchema schema = CsvSchema.emptySchema().withHeader().withColumnSeparator(delimiter);
        List<Map<String, String>> rows = new ArrayList<>();
        List<String> header = new ArrayList<>();

        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             MappingIterator<Map<String, String>> it = CSV_MAPPER.readerFor(ROW_TYPE).with(schema).readValues(reader)) {
            int rowNumber = 0;
            while (true) {
                rowNumber++;
                try {
                    if (!it.hasNextValue()) {
                        break;
                    }
                    rows.add(it.nextValue());
                } catch (JsonProcessingException e) {
                    throw new IntegrityException("Malformed row " + rowNumber + " in " + path + ": "
                            + e.getOriginalMessage(), rowNumber, null, e);
                }
            }
            FormatSchema parsed = it.getParserSchema();
            if (parsed instanceof CsvSchema) {
                for (CsvSchema.Column column : (CsvSchema) parsed) {
                    header.add(column.getName());
                }
            }
        } catch (CharacterCodingException e) {
            // decoding runs ahead of parsing in buffered chunks, so no row number is reported
            throw new IntegrityException(path + " is not valid UTF-8: " + e, null, null, e);
        }

        log.debug("Read {} rows ({} columns) from {}", rows.size(), header.size(), path);
        return new CsvTable(header, rows);
    }

    /**
     * Checks that every column in {@code required} is in the table's header and warns about
     * the ones nobody asked for.  An empty file (no header at all) passes.
     *
     * @throws IntegrityException naming the first missing column
     */
    public static void requireColumns(Path path, CsvTable table, List<String> required) {
        List<String> header = table.getHeader();
        if (header.isEmpty()) {
            return;
        }
        for (String column : required) {
            if (!header.contains(column)) {
                throw new IntegrityException("Missing column '" + column + "' in " + path, null, column);
            }
        }
        Set<String> extra = new LinkedHashSet<>(header);
        required.forEach(extra::remove);
        if (!extra.isEmpty()) {
            log.warn("Ignoring unexpected columns {} in {}", extra, path);
        }
    }

    /**
     * Writes a whole table, replacing any existing file at {@code path}.
     *
     * @param columns header, in output order; row values are looked up by these names
     */
    public static void write(Path path, char delimiter, List<String> columns,
                             List<? extends Map<String, ?>> rows) throws IOException {
        CsvSchema.Builder builder = CsvSchema.builder()
                .setColumnSeparator(delimiter)
                .setUseHeader(true);
        columns.forEach(builder::addColumn);
        CsvSchema schema = builder.build();

        Path target = path.toAbsolutePath();
        Path dir = target.getParent();
        Files.createDirectories(dir);
        Path tmp = Files.createTempFile(dir, "." + target.getFileName() + "-", ".tmp");
        try {
            try (Writer writer = Files.newBufferedWriter(tmp, StandardCharsets.UTF_8);
                 SequenceWriter sequence = CSV_MAPPER.writer(schema).writeValues(writer)) {
                for (Map<String, ?> row : rows) {
                    sequence.write(row);
                }
            }
            moveIntoPlace(tmp, target);
        } finally {
            Files.deleteIfExists(tmp);
        }
        log.debug("Wrote {} rows ({} columns) to {}", rows.size(), columns.size(), target);
    }

    private static void moveIntoPlace(Path tmp, Path target) throws IOException {
        try {
            Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.debug("Atomic move not supported for {}, falling back to replace", target);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
