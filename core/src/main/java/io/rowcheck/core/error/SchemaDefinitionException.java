package io.rowcheck.core.error;

/**
 * Thrown when a schema document parses but is malformed: wrong top-level shape, unknown or
 * unsupported keys, invalid values, or inconsistent numeric limits.
 *
 * <p>{@link #ruleIndex()} is {@code -1} for structural errors that do not belong to a single rule.
 */
public final class SchemaDefinitionException extends SchemaLoadException {

    private static final long serialVersionUID = 1L;

    private final int ruleIndex;
    private final String key;

    public SchemaDefinitionException(String message, int ruleIndex, String key, String source) {
        super(message, source);
        this.ruleIndex = ruleIndex;
        this.key = key;
    }

    public SchemaDefinitionException(String message, Throwable cause, int ruleIndex, String key, String source) {
        super(message, cause, source);
        this.ruleIndex = ruleIndex;
        this.key = key;
    }

    /** Zero-based index of the offending field rule, or {@code -1}. */
    public int ruleIndex() {
        return ruleIndex;
    }

    /** The offending key, or {@code null} when the error is not tied to a key. */
    public String key() {
        return key;
    }
}
