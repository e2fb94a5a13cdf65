package io.rowcheck.standalone.csv;

import com.fasterxml.jackson.dataformat.csv.CsvSchema;

/**
 * Delimited-text dialect shared by the record source and sinks.
 *
 * @param delimiter field delimiter
 * @param quoteChar quote character
 * @param hasHeader whether the first record of an input is a header row
 */
public record CsvDialect(char delimiter, char quoteChar, boolean hasHeader) {

    public static final CsvDialect DEFAULT = new CsvDialect(',', '"', false);

    /** Column-less Jackson schema: records are read and written as plain string arrays. */
    CsvSchema toCsvSchema() {
        return CsvSchema.emptySchema().withColumnSeparator(delimiter).withQuoteChar(quoteChar);
    }
}
