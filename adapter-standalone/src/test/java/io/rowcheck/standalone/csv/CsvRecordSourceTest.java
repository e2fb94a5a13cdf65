package io.rowcheck.standalone.csv;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.rowcheck.core.error.RecordReadException;
import io.rowcheck.core.model.Row;
import java.io.StringReader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("Delimited-text record source")
class CsvRecordSourceTest {

    private static List<Row> readAll(String text, CsvDialect dialect) throws Exception {
        List<Row> rows = new ArrayList<>();
        try (CsvRecordSource source = CsvRecordSource.of(new StringReader(text), dialect)) {
            Optional<Row> row;
            while ((row = source.next()).isPresent()) {
                rows.add(row.get());
            }
        }
        return rows;
    }

    @Test
    @DisplayName("Records are numbered from 1 and keep their field order")
    void readsRecordsInOrder() throws Exception {
        List<Row> rows = readAll("1,alice,30\n2,bob,41\n", CsvDialect.DEFAULT);

        assertThat(rows).hasSize(2);
        assertThat(rows.get(0).number()).isEqualTo(1);
        assertThat(rows.get(0).fields()).containsExactly("1", "alice", "30");
        assertThat(rows.get(1).number()).isEqualTo(2);
        assertThat(rows.get(1).header()).isFalse();
    }

    @Test
    @DisplayName("Only the first record is flagged as header when the dialect has one")
    void headerFlaggedOnce() throws Exception {
        List<Row> rows = readAll("id,name\n1,alice\n", new CsvDialect(',', '"', true));

        assertThat(rows.get(0).header()).isTrue();
        assertThat(rows.get(1).header()).isFalse();
    }

    @Test
    @DisplayName("Quoted fields may contain the delimiter")
    void quotedDelimiter() throws Exception {
        List<Row> rows = readAll("1,\"Smith, John\",3\n", CsvDialect.DEFAULT);

        assertThat(rows.get(0).fields()).containsExactly("1", "Smith, John", "3");
    }

    @Test
    @DisplayName("Custom delimiter and quote character")
    void customDialect() throws Exception {
        List<Row> rows = readAll("1|'a|b'|c\n", new CsvDialect('|', '\'', false));

        assertThat(rows.get(0).fields()).containsExactly("1", "a|b", "c");
    }

    @Test
    @DisplayName("Ragged records are read as-is so the field count can be judged")
    void raggedRecords() throws Exception {
        List<Row> rows = readAll("1,2,3\n4,5\n6,7,8,9\n", CsvDialect.DEFAULT);

        assertThat(rows).extracting(Row::fieldCount).containsExactly(3, 2, 4);
    }

    @Test
    @DisplayName("Zero-length lines are skipped")
    void emptyLinesSkipped() throws Exception {
        List<Row> rows = readAll("1,2\n\n3,4\n", CsvDialect.DEFAULT);

        assertThat(rows).hasSize(2);
        assertThat(rows.get(1).number()).isEqualTo(2);
    }

    @Test
    @DisplayName("A whitespace-only line is a record and is left to validation")
    void whitespaceLineKept() throws Exception {
        List<Row> rows = readAll("a,b\n   \nc,d\n", CsvDialect.DEFAULT);

        assertThat(rows).hasSize(3);
        assertThat(rows.get(1).fields()).containsExactly("   ");
        assertThat(rows.get(1).number()).isEqualTo(2);
        assertThat(rows.get(2).fields()).containsExactly("c", "d");
    }

    @Test
    @DisplayName("Empty input yields no records")
    void emptyInput() throws Exception {
        assertThat(readAll("", CsvDialect.DEFAULT)).isEmpty();
    }

    @Test
    @DisplayName("A missing file is reported as a read failure")
    void missingFile() {
        assertThatThrownBy(() -> CsvRecordSource.open(Path.of("no-such-input.csv"), CsvDialect.DEFAULT))
                .isInstanceOf(RecordReadException.class)
                .hasMessageContaining("no-such-input.csv");
    }
}
