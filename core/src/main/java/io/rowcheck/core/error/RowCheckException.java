package io.rowcheck.core.error;

/**
 * Abstract base for all rowcheck exceptions. Never thrown directly; use the concrete subclasses
 * under {@link SchemaLoadException} or {@link RecordReadException}.
 *
 * <p>Record-level validation failures are not exceptions; they are reported as
 * {@link io.rowcheck.core.model.ValidationOutcome} values.
 */
public abstract class RowCheckException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /** Phase in which the error occurred. */
    public enum Phase {
        LOAD,
        PROCESSING
    }

    private final Phase phase;

    protected RowCheckException(String message, Phase phase) {
        super(message);
        this.phase = phase;
    }

    protected RowCheckException(String message, Throwable cause, Phase phase) {
        super(message, cause);
        this.phase = phase;
    }

    /** Human-readable error description (alias for {@link #getMessage()}). */
    public String detail() {
        return getMessage();
    }

    /** The phase in which the error occurred. */
    public Phase phase() {
        return phase;
    }
}
