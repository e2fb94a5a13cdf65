package io.rowcheck.standalone.csv;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import io.rowcheck.core.error.RecordReadException;
import io.rowcheck.core.spi.RecordSink;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * {@link RecordSink} writing delimited text through Jackson's CSV generator. Values are quoted only
 * when they contain the delimiter, the quote character or a line break.
 */
public final class CsvRecordSink implements RecordSink {

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();

    private final SequenceWriter writer;
    private final Writer target;
    private final boolean closeTarget;
    private long written;

    private CsvRecordSink(Writer target, CsvDialect dialect, boolean closeTarget) throws IOException {
        this.target = target;
        this.closeTarget = closeTarget;
        this.writer = CSV_MAPPER
                .writerFor(String[].class)
                .with(dialect.toCsvSchema())
                .without(JsonGenerator.Feature.AUTO_CLOSE_TARGET)
                .writeValues(target);
    }

    /**
     * Creates (or truncates) a UTF-8 file.
     *
     * @throws RecordReadException if the file cannot be created
     */
    public static CsvRecordSink create(Path path, CsvDialect dialect) {
        Objects.requireNonNull(path, "path must not be null");
        try {
            return new CsvRecordSink(Files.newBufferedWriter(path, StandardCharsets.UTF_8), dialect, true);
        } catch (IOException e) {
            throw new RecordReadException("Failed to open output " + path + ": " + e.getMessage(), e, 0);
        }
    }

    /** Writes to a standard stream, which is flushed but never closed. */
    public static CsvRecordSink standardStream(OutputStream stream, CsvDialect dialect) {
        return of(new OutputStreamWriter(stream, StandardCharsets.UTF_8), dialect, false);
    }

    /**
     * Wraps an open writer.
     *
     * @param closeTarget whether {@link #close()} closes {@code target}
     */
    public static CsvRecordSink of(Writer target, CsvDialect dialect, boolean closeTarget) {
        Objects.requireNonNull(target, "target must not be null");
        Objects.requireNonNull(dialect, "dialect must not be null");
        try {
            return new CsvRecordSink(target, dialect, closeTarget);
        } catch (IOException e) {
            throw new RecordReadException("Failed to open output: " + e.getMessage(), e, 0);
        }
    }

    @Override
    public void write(List<String> fields) {
        try {
            writer.write(fields.toArray(new String[0]));
            written++;
        } catch (IOException e) {
            throw new RecordReadException("Failed to write record: " + e.getMessage(), e, written + 1);
        }
    }

    /** Number of records written so far. */
    public long written() {
        return written;
    }

    @Override
    public void close() throws IOException {
        writer.close();
        if (closeTarget) {
            target.close();
        } else {
            target.flush();
        }
    }
}
