package com.bookforge.books.io;

import com.bookforge.books.features.BookFeatureStage;
import com.bookforge.books.model.CleanedBookRecord;
import com.bookforge.books.model.FeaturedBookRecord;
import com.bookforge.books.model.RawBookRecord;
import com.bookforge.config.PipelineConfig;
import com.bookforge.error.IntegrityException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.bookforge.books.BookFixtures.cleaned;
import static com.bookforge.books.BookFixtures.rawCsv;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BookTableStoresTest {

    @TempDir
    Path tmp;

    private final PipelineConfig config = new PipelineConfig();

    @Test
    @DisplayName("raw rows are parsed with blank cells as null")
    void readsRaw() throws IOException {
        Path file = tmp.resolve("raw.csv");
        Files.writeString(file, rawCsv(
                "\"A Light in the Attic\",51.77,yes,3,22,Poetry,http://img/1.jpg",
                "Untitled,,no,4.0,5,Default,"));

        List<RawBookRecord> rows = new RawBookTableStore().read(file, config);

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).getTitle()).isEqualTo("A Light in the Attic");
        assertThat(rows.get(0).getPrice()).isEqualByComparingTo("51.77");
        assertThat(rows.get(0).getRating()).isEqualTo(3);
        assertThat(rows.get(0).getStock()).isEqualTo(22);
        assertThat(rows.get(1).getPrice()).isNull();
        assertThat(rows.get(1).getRating()).isEqualTo(4);
        assertThat(rows.get(1).getImage()).isNull();
    }

    @Test
    @DisplayName("an unparseable number is an integrity error naming row and column")
    void unparseableNumber() throws IOException {
        Path file = tmp.resolve("raw.csv");
        Files.writeString(file, rawCsv("Book,12.5,yes,three,1,Poetry,"));

        assertThatThrownBy(() -> new RawBookTableStore().read(file, config))
                .isInstanceOfSatisfying(IntegrityException.class, e -> {
                    assertThat(e.getRow()).isEqualTo(1);
                    assertThat(e.getColumn()).isEqualTo("rating");
                });
    }

    @Test
    @DisplayName("a raw file without a required column is rejected")
    void missingRawColumn() throws IOException {
        Path file = tmp.resolve("raw.csv");
        Files.writeString(file, "title,price\nBook,1\n");

        assertThatThrownBy(() -> new RawBookTableStore().read(file, config))
                .isInstanceOf(IntegrityException.class)
                .hasMessageContaining("availability");
    }

    @Test
    @DisplayName("processed table is written in column order and read back unchanged")
    void processedRoundTrip() throws IOException {
        Path file = tmp.resolve("processed/books.csv");
        CleanedBookRecord row = cleaned().title("Sharp Objects, A Novel").price(new BigDecimal("47.82")).build();
        CleanedBookTableStore store = new CleanedBookTableStore();

        store.write(file, List.of(row), config);

        assertThat(Files.readAllLines(file).get(0)).isEqualTo("id,title,price,availability,rating,stock,category,image");
        assertThat(store.read(file, config)).containsExactly(row);
    }

    @Test
    @DisplayName("a blank id in the processed table fails the read")
    void blankProcessedCell() throws IOException {
        Path file = tmp.resolve("books.csv");
        Files.writeString(file, "id,title,price,availability,rating,stock,category,image\n,Book,1,1,1,1,Poetry,\n");

        assertThatThrownBy(() -> new CleanedBookTableStore().read(file, config))
                .isInstanceOfSatisfying(IntegrityException.class, e -> assertThat(e.getColumn()).isEqualTo("id"));
    }

    @Test
    @DisplayName("features table has processed, derived, then one-hot columns")
    void writesFeatures() throws IOException {
        List<FeaturedBookRecord> featured = new BookFeatureStage().execute(List.of(
                cleaned().id("1").title("The Road: A Story").category("Science & Nature").stock(1).build(),
                cleaned().id("2").category("Poetry").stock(3).build()), config).getOutput();
        Path file = tmp.resolve("features/books.csv");

        new FeaturedBookTableStore().write(file, featured, config);

        List<String> lines = Files.readAllLines(file);
        assertThat(lines.get(0)).isEqualTo("id,title,price,availability,rating,stock,category,image,"
                + "price_range,has_subtitle,has_series,starts_with_the,title_length,rating_category,stock_level,"
                + "title_word_count,has_numbers,popularity_score,category_poetry,category_science_and_nature");
        assertThat(lines.get(1)).isEqualTo("1,The Road: A Story,25.0,1,4,1,Science & Nature,,"
                + "Medium,true,false,true,17,High,Low,4,false,0.5599999999999999,false,true");
        assertThat(lines.get(2)).endsWith(",true,false");
    }
}
