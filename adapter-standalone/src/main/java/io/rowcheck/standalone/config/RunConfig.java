package io.rowcheck.standalone.config;

import io.rowcheck.standalone.csv.CsvDialect;

/**
 * Configuration of one validation run.
 *
 * <p>All fields have defaults except {@code input}, which is required. Use {@link #builder()}.
 *
 * @param input              input file path, or {@code -} for stdin
 * @param schema             schema file path; {@code null} means field-count checks only
 * @param delimiter          field delimiter
 * @param quoteChar          quote character
 * @param hasHeader          whether the first record is a header row
 * @param fieldCount         expected fields per record; {@code null} means "fixed by the first record"
 * @param validOutput        destination for valid records: a path, {@code -} (stdout) or {@code none}
 * @param invalidOutput      destination for invalid records: a path, {@code -} (stderr) or {@code none}
 * @param appendErrorMessage append the diagnostic as a trailing field of each invalid record
 * @param loggingFormat      {@code text} or {@code json}
 * @param loggingLevel       root log level
 */
public record RunConfig(
        String input,
        String schema,
        char delimiter,
        char quoteChar,
        boolean hasHeader,
        Integer fieldCount,
        String validOutput,
        String invalidOutput,
        boolean appendErrorMessage,
        String loggingFormat,
        String loggingLevel) {

    /** Output value meaning "standard stream". */
    public static final String STANDARD_STREAM = "-";

    /** Output value meaning "discard". */
    public static final String DISCARD = "none";

    public static Builder builder() {
        return new Builder();
    }

    /** The CSV dialect described by this configuration. */
    public CsvDialect dialect() {
        return new CsvDialect(delimiter, quoteChar, hasHeader);
    }

    /** Builder for {@link RunConfig}. All fields have defaults except {@code input}. */
    public static final class Builder {
        private String input;
        private String schema;
        private char delimiter = ',';
        private char quoteChar = '"';
        private boolean hasHeader;
        private Integer fieldCount;
        private String validOutput = STANDARD_STREAM;
        private String invalidOutput = STANDARD_STREAM;
        private boolean appendErrorMessage;
        private String loggingFormat = "text";
        private String loggingLevel = "INFO";

        Builder() {}

        public Builder input(String input) {
            this.input = input;
            return this;
        }

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder delimiter(char delimiter) {
            this.delimiter = delimiter;
            return this;
        }

        public Builder quoteChar(char quoteChar) {
            this.quoteChar = quoteChar;
            return this;
        }

        public Builder hasHeader(boolean hasHeader) {
            this.hasHeader = hasHeader;
            return this;
        }

        public Builder fieldCount(Integer fieldCount) {
            this.fieldCount = fieldCount;
            return this;
        }

        public Builder validOutput(String validOutput) {
            this.validOutput = validOutput;
            return this;
        }

        public Builder invalidOutput(String invalidOutput) {
            this.invalidOutput = invalidOutput;
            return this;
        }

        public Builder appendErrorMessage(boolean appendErrorMessage) {
            this.appendErrorMessage = appendErrorMessage;
            return this;
        }

        public Builder loggingFormat(String loggingFormat) {
            this.loggingFormat = loggingFormat;
            return this;
        }

        public Builder loggingLevel(String loggingLevel) {
            this.loggingLevel = loggingLevel;
            return this;
        }

        /**
         * Builds the configuration.
         *
         * @throws ConfigLoadException if {@code input} is missing, {@code fieldCount} is not
         *                             positive, or delimiter and quote character coincide
         */
        public RunConfig build() {
            if (input == null || input.isBlank()) {
                throw new ConfigLoadException("Missing required setting: 'input'");
            }
            if (fieldCount != null && fieldCount < 1) {
                throw new ConfigLoadException("'field-count' must be positive but is: " + fieldCount);
            }
            if (delimiter == quoteChar) {
                throw new ConfigLoadException("Delimiter and quote character must differ: '" + delimiter + "'");
            }
            return new RunConfig(
                    input,
                    schema != null && !schema.isBlank() ? schema : null,
                    delimiter,
                    quoteChar,
                    hasHeader,
                    fieldCount,
                    validOutput,
                    invalidOutput,
                    appendErrorMessage,
                    loggingFormat,
                    loggingLevel);
        }
    }
}
