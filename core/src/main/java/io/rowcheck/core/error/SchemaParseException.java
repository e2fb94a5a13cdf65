package io.rowcheck.core.error;

/** Thrown when a schema file is missing, unreadable or not valid YAML/JSON. */
public final class SchemaParseException extends SchemaLoadException {

    private static final long serialVersionUID = 1L;

    public SchemaParseException(String message, String source) {
        super(message, source);
    }

    public SchemaParseException(String message, Throwable cause, String source) {
        super(message, cause, source);
    }
}
