package io.rowcheck.core.model;

import java.util.List;
import java.util.Objects;

/**
 * One incoming record.
 *
 * @param number one-based position of the record in its stream
 * @param fields field values in column order
 * @param header whether this record is the stream's header row
 */
public record Row(long number, List<String> fields, boolean header) {

    public Row {
        fields = List.copyOf(Objects.requireNonNull(fields, "fields must not be null"));
    }

    /** Creates a data (non-header) row. */
    public static Row of(long number, List<String> fields) {
        return new Row(number, fields, false);
    }

    public int fieldCount() {
        return fields.size();
    }
}
