package com.bookforge.books.cleaning;

import com.bookforge.books.model.BookColumns;
import com.bookforge.books.model.CleanedBookRecord;
import com.bookforge.books.model.RawBookRecord;
import com.bookforge.books.schema.BookRecordSchema;
import com.bookforge.config.PipelineConfig;
import com.bookforge.error.IdentityConflictException;
import com.bookforge.error.IntegrityException;
import com.bookforge.error.PipelineException;
import com.bookforge.error.UnrecognizedValueException;
import com.bookforge.model.StageResult;
import com.bookforge.pipeline.Stage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Repairs and normalizes the raw book table.
 *
 * <p>Steps, each over the whole table before the next starts:
 * <ol>
 *   <li>Null check: any missing value outside {@code image} fails the stage.  Nothing is
 *       imputed.</li>
 *   <li>Identifier assignment: one generated id per row, in row order, checked for
 *       uniqueness.</li>
 *   <li>Category normalization: values found in {@code problematic_categories} (exact,
 *       case-sensitive match) become {@code default_category}.</li>
 *   <li>Availability: {@code "yes"} → 1, {@code "no"} → 0, anything else fails.</li>
 *   <li>Schema gate over every output row.</li>
 * </ol>
 *
 * <p>The stage is all-or-nothing: on failure it returns {@link StageResult#failure} and no
 * table.</p>
 */
@Slf4j
public class BookCleaningStage implements Stage<List<RawBookRecord>, List<CleanedBookRecord>> {

    public static final String NAME = "data_cleaning";

    static final String AVAILABLE = "yes";
    static final String NOT_AVAILABLE = "no";

    /** Columns that must never be null; {@code image} is optional. */
    private static final Map<String, Function<RawBookRecord, Object>> REQUIRED_FIELDS = requiredFields();

    private final Supplier<String> idGenerator;

    public BookCleaningStage() {
        this(() -> UUID.randomUUID().toString());
    }

    /**
     * @param idGenerator source of row identifiers; must produce a fresh value per call
     */
    public BookCleaningStage(Supplier<String> idGenerator) {
        this.idGenerator = idGenerator;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public StageResult<List<CleanedBookRecord>> execute(List<RawBookRecord> raw, PipelineConfig config) {
        log.info("Cleaning {} raw rows", raw.size());
        try {
            if (raw.isEmpty()) {
                throw new IntegrityException("Raw table is empty");
            }

            checkNulls(raw);
            List<String> ids = assignIds(raw.size());

            Set<String> problematic = new HashSet<>(config.getProblematicCategories());
            List<String> categories = new ArrayList<>(raw.size());
            long normalized = 0;
            for (RawBookRecord record : raw) {
                if (problematic.contains(record.getCategory())) {
                    categories.add(config.getDefaultCategory());
                    normalized++;
                } else {
                    categories.add(record.getCategory());
                }
            }
            log.debug("Normalized {} problematic categories to '{}'", normalized, config.getDefaultCategory());

            int[] availability = new int[raw.size()];
            for (int i = 0; i < raw.size(); i++) {
                availability[i] = toIndicator(raw.get(i).getAvailability(), i + 1);
            }

            List<CleanedBookRecord> cleaned = new ArrayList<>(raw.size());
            for (int i = 0; i < raw.size(); i++) {
                RawBookRecord record = raw.get(i);
                cleaned.add(CleanedBookRecord.builder()
                        .id(ids.get(i))
                        .title(record.getTitle())
                        .price(record.getPrice())
                        .availability(availability[i])
                        .rating(record.getRating())
                        .stock(record.getStock())
                        .category(categories.get(i))
                        .image(record.getImage() == null ? "" : record.getImage())
                        .build());
            }

            BookRecordSchema schema = BookRecordSchema.forConfig(config);
            for (int i = 0; i < cleaned.size(); i++) {
                schema.validateCleaned(cleaned.get(i), i + 1);
            }

            Map<String, Long> metrics = new LinkedHashMap<>();
            metrics.put(METRIC_ROWS_IN, (long) raw.size());
            metrics.put(METRIC_ROWS_OUT, (long) cleaned.size());
            metrics.put(METRIC_CATEGORIES_NORMALIZED, normalized);

            log.info("Cleaning done: {} rows, {} categories normalized", cleaned.size(), normalized);
            return StageResult.success(NAME, List.copyOf(cleaned), metrics);
        } catch (PipelineException e) {
            log.error("Cleaning failed: {}", e.toError().describe());
            return StageResult.failure(NAME, e.toError());
        }
    }

    /**
     * Fails with the first column (in file order) that has nulls, reporting how many rows
     * are affected; the message lists every column with nulls.
     */
    private static void checkNulls(List<RawBookRecord> raw) {
        Map<String, Long> nullCounts = new LinkedHashMap<>();
        Map<String, Integer> firstNullRow = new LinkedHashMap<>();
        for (Map.Entry<String, Function<RawBookRecord, Object>> field : REQUIRED_FIELDS.entrySet()) {
            for (int i = 0; i < raw.size(); i++) {
                if (field.getValue().apply(raw.get(i)) == null) {
                    nullCounts.merge(field.getKey(), 1L, Long::sum);
                    firstNullRow.putIfAbsent(field.getKey(), i + 1);
                }
            }
        }
        if (nullCounts.isEmpty()) {
            return;
        }

        String column = nullCounts.keySet().iterator().next();
        String detail = nullCounts.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", "));
        throw new IntegrityException("Null values in column '" + column + "' affecting " + nullCounts.get(column)
                + " row(s); null counts by column: " + detail, firstNullRow.get(column), column);
    }

    private List<String> assignIds(int count) {
        List<String> ids = new ArrayList<>(count);
        Set<String> seen = new HashSet<>(count * 2);
        for (int i = 0; i < count; i++) {
            String id = idGenerator.get();
            if (id == null || !seen.add(id)) {
                throw new IdentityConflictException("Id generator produced a duplicate or null id '" + id + "'",
                        i + 1, BookColumns.ID);
            }
            ids.add(id);
        }
        return ids;
    }

    private static int toIndicator(String token, int rowNumber) {
        if (AVAILABLE.equals(token)) {
            return 1;
        }
        if (NOT_AVAILABLE.equals(token)) {
            return 0;
        }
        throw new UnrecognizedValueException("Unrecognized availability token '" + token
                + "', expected '" + AVAILABLE + "' or '" + NOT_AVAILABLE + "'", rowNumber, BookColumns.AVAILABILITY);
    }

    private static Map<String, Function<RawBookRecord, Object>> requiredFields() {
        Map<String, Function<RawBookRecord, Object>> fields = new LinkedHashMap<>();
        fields.put(BookColumns.TITLE, RawBookRecord::getTitle);
        fields.put(BookColumns.PRICE, RawBookRecord::getPrice);
        fields.put(BookColumns.AVAILABILITY, RawBookRecord::getAvailability);
        fields.put(BookColumns.RATING, RawBookRecord::getRating);
        fields.put(BookColumns.STOCK, RawBookRecord::getStock);
        fields.put(BookColumns.CATEGORY, RawBookRecord::getCategory);
        return fields;
    }
}
