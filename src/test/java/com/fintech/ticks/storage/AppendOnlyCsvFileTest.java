package com.fintech.ticks.storage;

import com.fintech.ticks.domain.TickRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("AppendOnlyCsvFile Tests")
class AppendOnlyCsvFileTest {

    private static final String HEADER = "Symbol,Price,Timestamp,WriteTimestamp";

    @TempDir
    Path tempDir;

    private Path path;
    private AppendOnlyCsvFile<TickRecord> file;

    @BeforeEach
    void setUp() throws IOException {
        path = tempDir.resolve("AAPL.csv");
        file = AppendOnlyCsvFile.open(path, TickRecordCodec.INSTANCE);
    }

    @AfterEach
    void tearDown() throws IOException {
        file.close();
    }

    @Test
    @DisplayName("Opening creates an empty file without writing anything")
    void testOpenCreatesBlankFile() {
        assertThat(path).exists();
        assertThat(path).isEmptyFile();
        assertThat(file.hasNoDataRows()).isTrue();
        assertThat(file.readAll()).isEmpty();
    }

    @Test
    @DisplayName("Header is written only while the file is blank")
    void testHeaderWrittenOnce() throws IOException {
        assertThat(file.writeHeaderIfBlank()).isTrue();
        assertThat(file.writeHeaderIfBlank()).isFalse();

        assertThat(Files.readAllLines(path)).containsExactly(HEADER);
        assertThat(file.hasNoDataRows()).isTrue();
    }

    @Test
    @DisplayName("First append writes the header before the row")
    void testAppendWritesHeaderFirst() throws IOException {
        file.append(new TickRecord("AAPL", 172.5, 1L, 2L));
        file.append(new TickRecord("AAPL", 173.5, 3L, 4L));

        assertThat(Files.readAllLines(path)).containsExactly(
            HEADER,
            "AAPL,172.5,1,2",
            "AAPL,173.5,3,4"
        );
    }

    @Test
    @DisplayName("Reopening an existing file appends after the old rows")
    void testReopenAppends() throws IOException {
        file.append(new TickRecord("AAPL", 172.5, 1L, 2L));
        file.close();

        file = AppendOnlyCsvFile.open(path, TickRecordCodec.INSTANCE);
        assertThat(file.writeHeaderIfBlank()).isFalse();
        file.append(new TickRecord("AAPL", 173.5, 3L, 4L));

        assertThat(file.readAll())
            .extracting(TickRecord::price)
            .containsExactly(172.5, 173.5);
        assertThat(Files.readAllLines(path)).filteredOn(HEADER::equals).hasSize(1);
    }

    @Test
    @DisplayName("Reads apply the filter and keep file order")
    void testReadAllWithFilter() {
        for (int i = 0; i < 10; i++) {
            file.append(new TickRecord("AAPL", 100.0 + i, i, i));
        }

        List<TickRecord> even = file.readAll(record -> record.recordedAt() % 2 == 0);

        assertThat(even).extracting(TickRecord::recordedAt).containsExactly(0L, 2L, 4L, 6L, 8L);
    }

    @Test
    @DisplayName("Blank lines are skipped on read-back")
    void testBlankLinesSkipped() throws IOException {
        file.append(new TickRecord("AAPL", 172.5, 1L, 2L));
        Files.writeString(path, "\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        file.append(new TickRecord("AAPL", 173.5, 3L, 4L));

        assertThat(file.readAll()).hasSize(2);
    }

    @Test
    @DisplayName("A malformed row aborts the read with its line number")
    void testMalformedRowFailsFast() throws IOException {
        file.append(new TickRecord("AAPL", 172.5, 1L, 2L));
        Files.writeString(path, "AAPL,not-a-price,3,4\n", StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        file.append(new TickRecord("AAPL", 173.5, 5L, 6L));

        assertThatThrownBy(() -> file.readAll())
            .isInstanceOfSatisfying(MalformedRecordException.class, e -> {
                assertThat(e.getLineNumber()).isEqualTo(3);
                assertThat(e.getRow()).isEqualTo("AAPL,not-a-price,3,4");
                assertThat(e.getFile()).isEqualTo(path);
            })
            .isInstanceOf(TickLogException.class);
    }

    @Test
    @DisplayName("A torn trailing row is cut off on open and later appends stay well-formed")
    void testTornTailTruncatedOnOpen() throws IOException {
        file.close();
        Files.writeString(path, HEADER + "\nAAPL,1.0,0,1705312800000\nAAPL,2.0,0,17053", StandardCharsets.UTF_8);

        file = AppendOnlyCsvFile.open(path, TickRecordCodec.INSTANCE);
        file.append(new TickRecord("AAPL", 172.5, 0L, 1705312805000L));
        file.append(new TickRecord("AAPL", 173.5, 0L, 1705312806000L));

        assertThat(Files.readAllLines(path)).containsExactly(
            HEADER,
            "AAPL,1.0,0,1705312800000",
            "AAPL,172.5,0,1705312805000",
            "AAPL,173.5,0,1705312806000"
        );
        assertThat(file.readAll()).extracting(TickRecord::price).containsExactly(1.0, 172.5, 173.5);
    }

    @Test
    @DisplayName("A file holding only a torn header is emptied and gets a fresh header")
    void testTornHeaderTruncatedOnOpen() throws IOException {
        file.close();
        Files.writeString(path, "Symbol,Pri", StandardCharsets.UTF_8);

        file = AppendOnlyCsvFile.open(path, TickRecordCodec.INSTANCE);

        assertThat(path).isEmptyFile();
        file.append(new TickRecord("AAPL", 172.5, 1L, 2L));
        assertThat(Files.readAllLines(path)).containsExactly(HEADER, "AAPL,172.5,1,2");
    }

    @Test
    @DisplayName("A complete file is left untouched on open")
    void testCompleteFileNotTruncated() throws IOException {
        file.append(new TickRecord("AAPL", 172.5, 1L, 2L));
        file.close();
        long size = Files.size(path);

        file = AppendOnlyCsvFile.open(path, TickRecordCodec.INSTANCE);

        assertThat(Files.size(path)).isEqualTo(size);
    }

    @Test
    @DisplayName("Last data row is parsed, header-only file has none")
    void testReadLast() {
        assertThat(file.readLast()).isEmpty();
        file.writeHeaderIfBlank();
        assertThat(file.readLast()).isEmpty();

        file.append(new TickRecord("AAPL", 172.5, 1L, 2L));
        file.append(new TickRecord("AAPL", 173.5, 3L, 4L));

        assertThat(file.readLast()).contains(new TickRecord("AAPL", 173.5, 3L, 4L));
    }

    @Test
    @DisplayName("Appending to a closed file surfaces a TickLogException")
    void testAppendAfterClose() throws IOException {
        file.close();

        assertThatThrownBy(() -> file.append(new TickRecord("AAPL", 172.5, 1L, 2L)))
            .isInstanceOf(TickLogException.class)
            .hasMessageContaining("AAPL.csv");
    }
}
