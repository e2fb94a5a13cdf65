package io.rowcheck.core.spi;

import io.rowcheck.core.model.Row;
import java.io.Closeable;
import java.util.Optional;

/**
 * Supplies records one at a time, in stream order. Implementations own the dialect (delimiter,
 * quoting) and know which record, if any, is the header row.
 */
public interface RecordSource extends Closeable {

    /**
     * Reads the next record.
     *
     * @return the next row, or empty at end of input
     * @throws io.rowcheck.core.error.RecordReadException if the input cannot be read or parsed
     */
    Optional<Row> next();
}
