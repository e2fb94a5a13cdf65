package io.rowcheck.core.spi;

import java.io.Closeable;
import java.util.List;

/** Accepts records for writing, in the sink's dialect. */
public interface RecordSink extends Closeable {

    /**
     * Writes one record.
     *
     * @throws io.rowcheck.core.error.RecordReadException if the output cannot be written
     */
    void write(List<String> fields);

    /** A sink that drops everything. */
    static RecordSink discard() {
        return new RecordSink() {
            @Override
            public void write(List<String> fields) {}

            @Override
            public void close() {}
        };
    }
}
