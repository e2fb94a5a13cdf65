package io.rowcheck.core.model;

import java.util.Objects;

/**
 * Result of validating one record: pass, or fail with the diagnostic of the first failing check.
 *
 * @param valid      whether the record passed every check
 * @param diagnostic failure message; {@code null} when {@code valid}
 */
public record ValidationOutcome(boolean valid, String diagnostic) {

    private static final ValidationOutcome PASS = new ValidationOutcome(true, null);

    public ValidationOutcome {
        if (valid && diagnostic != null) {
            throw new IllegalArgumentException("a passing outcome carries no diagnostic");
        }
        if (!valid) {
            Objects.requireNonNull(diagnostic, "diagnostic must not be null for a failing outcome");
        }
    }

    public static ValidationOutcome pass() {
        return PASS;
    }

    public static ValidationOutcome fail(String diagnostic) {
        return new ValidationOutcome(false, diagnostic);
    }

    public boolean isInvalid() {
        return !valid;
    }
}
