package io.rowcheck.standalone.csv;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import io.rowcheck.core.error.RecordReadException;
import io.rowcheck.core.model.Row;
import io.rowcheck.core.spi.RecordSource;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link RecordSource} over delimited text, backed by Jackson's CSV parser. Records are read lazily,
 * one per {@link #next()} call. Zero-length lines are skipped; a line holding only whitespace is a
 * record like any other and goes to validation.
 */
public final class CsvRecordSource implements RecordSource {

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .build();

    private final Reader reader;
    private final MappingIterator<String[]> records;
    private final boolean hasHeader;
    private long number;

    private CsvRecordSource(Reader reader, CsvDialect dialect) throws IOException {
        this.reader = reader;
        this.records = CSV_MAPPER.readerFor(String[].class).with(dialect.toCsvSchema()).readValues(reader);
        this.hasHeader = dialect.hasHeader();
    }

    /**
     * Opens a UTF-8 file.
     *
     * @throws RecordReadException if the file cannot be opened
     */
    public static CsvRecordSource open(Path path, CsvDialect dialect) {
        Objects.requireNonNull(path, "path must not be null");
        try {
            return new CsvRecordSource(Files.newBufferedReader(path, StandardCharsets.UTF_8), dialect);
        } catch (IOException e) {
            throw new RecordReadException("Failed to open input " + path + ": " + e.getMessage(), e, 0);
        }
    }

    /** Reads UTF-8 text from standard input. */
    public static CsvRecordSource stdin(CsvDialect dialect) {
        return of(new InputStreamReader(System.in, StandardCharsets.UTF_8), dialect);
    }

    /**
     * Wraps an open reader; the source takes ownership and closes it.
     *
     * @throws RecordReadException if the reader cannot be read
     */
    public static CsvRecordSource of(Reader reader, CsvDialect dialect) {
        Objects.requireNonNull(reader, "reader must not be null");
        Objects.requireNonNull(dialect, "dialect must not be null");
        try {
            return new CsvRecordSource(reader, dialect);
        } catch (IOException e) {
            throw new RecordReadException("Failed to read input: " + e.getMessage(), e, 0);
        }
    }

    @Override
    public Optional<Row> next() {
        try {
            String[] values;
            do {
                if (!records.hasNextValue()) {
                    return Optional.empty();
                }
                values = records.nextValue();
            } while (isEmptyLine(values));
            number++;
            return Optional.of(new Row(number, Arrays.asList(values), hasHeader && number == 1));
        } catch (IOException | RuntimeJsonMappingException e) {
            throw new RecordReadException(
                    "Failed to parse record " + (number + 1) + ": " + e.getMessage(), e, number + 1);
        }
    }

    private static boolean isEmptyLine(String[] values) {
        return values.length == 0 || (values.length == 1 && values[0].isEmpty());
    }

    @Override
    public void close() throws IOException {
        records.close();
        reader.close();
    }
}
