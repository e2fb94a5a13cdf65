package io.rowcheck.standalone.config;

/**
 * Thrown when the run configuration cannot be loaded: missing file, invalid YAML, or missing or
 * inconsistent settings. Provides a descriptive message suitable for startup error output.
 */
public class ConfigLoadException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
