package io.rowcheck.core.error;

/**
 * Thrown by a record source or sink when the underlying stream cannot be read or written, or when
 * the delimited text is syntactically broken (e.g. an unterminated quote).
 */
public final class RecordReadException extends RowCheckException {

    private static final long serialVersionUID = 1L;

    private final long recordNumber;

    public RecordReadException(String message, long recordNumber) {
        super(message, Phase.PROCESSING);
        this.recordNumber = recordNumber;
    }

    public RecordReadException(String message, Throwable cause, long recordNumber) {
        super(message, cause, Phase.PROCESSING);
        this.recordNumber = recordNumber;
    }

    /** One-based number of the record being processed when the error occurred, or {@code 0}. */
    public long recordNumber() {
        return recordNumber;
    }
}
