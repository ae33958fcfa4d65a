package com.bookforge.io;

import com.bookforge.error.ErrorKind;
import com.bookforge.error.IntegrityException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvTablesTest {

    @TempDir
    Path tmp;

    @Test
    @DisplayName("reads header and rows, blank cells as empty strings")
    void readsTable() throws IOException {
        Path file = tmp.resolve("in.csv");
        Files.writeString(file, "a,b,c\n1,,x\n2,\"q, r\",y\n");

        CsvTable table = CsvTables.read(file, ',');

        assertThat(table.getHeader()).containsExactly("a", "b", "c");
        assertThat(table.getRows()).hasSize(2);
        assertThat(table.getRows().get(0)).containsEntry("a", "1").containsEntry("b", "").containsEntry("c", "x");
        assertThat(table.getRows().get(1)).containsEntry("b", "q, r");
    }

    @Test
    @DisplayName("honours a custom delimiter")
    void customDelimiter() throws IOException {
        Path file = tmp.resolve("in.csv");
        Files.writeString(file, "a;b\n1;2\n");

        CsvTable table = CsvTables.read(file, ';');

        assertThat(table.getRows()).containsExactly(Map.of("a", "1", "b", "2"));
    }

    @Test
    @DisplayName("a row with more cells than the header is an integrity error")
    void malformedRow() throws IOException {
        Path file = tmp.resolve("in.csv");
        Files.writeString(file, "a,b\n1,2\n1,2,3\n");

        assertThatThrownBy(() -> CsvTables.read(file, ','))
                .isInstanceOf(IntegrityException.class)
                .satisfies(e -> assertThat(((IntegrityException) e).getKind()).isEqualTo(ErrorKind.INTEGRITY));
    }

    @Test
    @DisplayName("requireColumns names the first missing column")
    void missingColumn() {
        CsvTable table = new CsvTable(List.of("a", "c"), List.of());

        assertThatThrownBy(() -> CsvTables.requireColumns(Path.of("t.csv"), table, List.of("a", "b", "c")))
                .isInstanceOf(IntegrityException.class)
                .hasMessageContaining("'b'");
    }

    @Test
    @DisplayName("extra columns are tolerated")
    void extraColumns() {
        CsvTable table = new CsvTable(List.of("a", "b", "extra"), List.of());

        assertThatCode(() -> CsvTables.requireColumns(Path.of("t.csv"), table, List.of("a", "b")))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("write creates parent directories, quotes as needed and leaves no temp file")
    void writesTable() throws IOException {
        Path file = tmp.resolve("out/nested/t.csv");
        Map<String, String> row = new LinkedHashMap<>();
        row.put("b", "has, comma");
        row.put("a", "1");

        CsvTables.write(file, ',', List.of("a", "b"), List.of(row));

        assertThat(Files.readAllLines(file)).containsExactly("a,b", "1,\"has, comma\"");
        try (var files = Files.list(file.getParent())) {
            assertThat(files).containsExactly(file);
        }
    }

    @Test
    @DisplayName("write replaces an existing file")
    void replacesExisting() throws IOException {
        Path file = tmp.resolve("t.csv");
        Files.writeString(file, "old\n");

        CsvTables.write(file, ',', List.of("a"), List.of(Map.of("a", "new")));

        assertThat(Files.readAllLines(file)).containsExactly("a", "new");
    }

    @Test
    @DisplayName("long values and headers are quoted only when they contain a delimiter or quote")
    void longValuesUnquoted() throws IOException {
        Path file = tmp.resolve("t.csv");

        CsvTables.write(file, ',', List.of("category_science_and_nature_and_more"),
                List.of(Map.of("category_science_and_nature_and_more", "A Light in the Attic: Collected Poems")));

        assertThat(Files.readAllLines(file))
                .containsExactly("category_science_and_nature_and_more", "A Light in the Attic: Collected Poems");
    }

    @Test
    @DisplayName("blank lines, including a trailing one, are not rows")
    void skipsBlankLines() throws IOException {
        Path file = tmp.resolve("in.csv");
        Files.writeString(file, "a,b\n1,2\n\n3,4\n\n");

        CsvTable table = CsvTables.read(file, ',');

        assertThat(table.getRows()).containsExactly(Map.of("a", "1", "b", "2"), Map.of("a", "3", "b", "4"));
    }

    @Test
    @DisplayName("a file that is not UTF-8 is an integrity error, not an I/O failure")
    void invalidEncoding() throws IOException {
        Path file = tmp.resolve("latin1.csv");
        Files.write(file, new byte[]{'a', ',', 'b', '\n', '1', ',', (byte) 0xA3, '5', '\n'});

        assertThatThrownBy(() -> CsvTables.read(file, ','))
                .isInstanceOfSatisfying(IntegrityException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.INTEGRITY))
                .hasMessageContaining("UTF-8");
    }
}
