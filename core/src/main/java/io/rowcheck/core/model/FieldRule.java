package io.rowcheck.core.model;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.math.BigDecimal;
import java.util.Objects;

/**
 * Validated constraints for one column position.
 *
 * <p>The numeric extension ({@code numericKind}, {@code numericMinimum}, {@code numericMaximum}) is
 * evaluated by the record validator itself. Everything else lives in {@code structural}, the
 * per-column JSON Schema handed to the generic structural validator.
 *
 * @param index          zero-based column position
 * @param title          optional column title, used in diagnostics
 * @param description    optional free-text description
 * @param required       whether the record must be long enough to contain this column
 * @param numericKind    declared numeric kind, or {@code null} if none was declared
 * @param numericMinimum inclusive lower bound, pre-parsed to {@code numericKind}, or {@code null}
 * @param numericMaximum inclusive upper bound, pre-parsed to {@code numericKind}, or {@code null}
 * @param structural     JSON Schema fragment for the generic structural validator; copied in and out
 */
public record FieldRule(
        int index,
        String title,
        String description,
        boolean required,
        NumericKind numericKind,
        BigDecimal numericMinimum,
        BigDecimal numericMaximum,
        ObjectNode structural) {

    public FieldRule {
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative: " + index);
        }
        structural = Objects.requireNonNull(structural, "structural must not be null").deepCopy();
        if ((numericMinimum != null || numericMaximum != null) && (numericKind == null || !numericKind.isNumeric())) {
            throw new IllegalArgumentException("numeric limits require an integer or float numericKind");
        }
    }

    /** A copy of this column's JSON Schema fragment. */
    @Override
    public ObjectNode structural() {
        return structural.deepCopy();
    }

    /** Whether values in this column must coerce to a number. */
    public boolean isNumeric() {
        return numericKind != null && numericKind.isNumeric();
    }

    /** Whether this rule declares a numeric minimum or maximum. */
    public boolean hasNumericLimits() {
        return numericMinimum != null || numericMaximum != null;
    }

    /** Column label for diagnostics: {@code field 2 (age)} or {@code field 2}. */
    public String label() {
        return title == null ? "field " + index : "field " + index + " (" + title + ")";
    }
}
