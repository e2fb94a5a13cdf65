package io.rowcheck.core.error;

/**
 * Abstract parent for schema configuration errors. These are fatal: they are raised once, at
 * startup, before any record is read. Carries a {@code source} field identifying the file or
 * resource that caused the error.
 */
public abstract class SchemaLoadException extends RowCheckException {

    private static final long serialVersionUID = 1L;

    private final String source;

    protected SchemaLoadException(String message, String source) {
        super(message, Phase.LOAD);
        this.source = source;
    }

    protected SchemaLoadException(String message, Throwable cause, String source) {
        super(message, cause, Phase.LOAD);
        this.source = source;
    }

    /** The file path or resource identifier that caused the error, or {@code null}. */
    public String source() {
        return source;
    }
}
