package io.rowcheck.core.model;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Optional;

/**
 * Numeric classification of a column ({@code numericKind} in the schema document). Resolved once
 * per {@link FieldRule} at schema-load time; each constant carries its own coercion.
 *
 * <p>Coercion ignores surrounding whitespace. Non-finite spellings ({@code nan}, {@code inf}) are
 * not numbers for either kind.
 */
public enum NumericKind {
    INTEGER("integer") {
        @Override
        public BigDecimal coerce(String raw) {
            String text = normalize(raw);
            if (text == null) {
                return null;
            }
            try {
                return new BigDecimal(new BigInteger(text));
            } catch (NumberFormatException e) {
                return null;
            }
        }
    },

    FLOAT("float") {
        @Override
        public BigDecimal coerce(String raw) {
            String text = normalize(raw);
            if (text == null) {
                return null;
            }
            try {
                return new BigDecimal(text);
            } catch (NumberFormatException e) {
                return null;
            }
        }
    },

    /** Text column. Declaring it is allowed but enables no numeric checks. */
    STRING("string") {
        @Override
        public BigDecimal coerce(String raw) {
            return null;
        }
    };

    private final String keyword;

    NumericKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Coerces a raw field value to a number of this kind.
     *
     * @return the numeric value, or {@code null} if {@code raw} is not a number of this kind
     */
    public abstract BigDecimal coerce(String raw);

    /** The keyword used for this kind in schema documents. */
    public String keyword() {
        return keyword;
    }

    /** {@code true} for {@link #INTEGER} and {@link #FLOAT}. */
    public boolean isNumeric() {
        return this != STRING;
    }

    /** Resolves a schema keyword ({@code integer}, {@code float}, {@code string}). Case-sensitive. */
    public static Optional<NumericKind> fromKeyword(String keyword) {
        if (keyword == null) {
            return Optional.empty();
        }
        for (NumericKind kind : values()) {
            if (kind.keyword.equals(keyword)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }

    private static String normalize(String raw) {
        if (raw == null) {
            return null;
        }
        String text = raw.strip();
        return text.isEmpty() ? null : text;
    }
}
