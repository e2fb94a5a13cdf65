package io.rowcheck.core.engine;

import io.rowcheck.core.model.FieldRule;
import io.rowcheck.core.model.Row;
import io.rowcheck.core.model.Schema;
import io.rowcheck.core.model.ValidationOutcome;
import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalInt;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classifies records as valid or invalid under a field-count contract and an optional
 * {@link Schema}.
 *
 * <p>Per-record evaluation order, stopping at the first failure:
 * <ol>
 * <li>field count (the first record fixes the expected count unless one was configured);</li>
 * <li>header rows are accepted here and skip the schema checks;</li>
 * <li>numeric type of every numeric column;</li>
 * <li>numeric range against {@code numericMinimum}/{@code numericMaximum};</li>
 * <li>generic structural checks (type, length, pattern, enum, required).</li>
 * </ol>
 * The numeric checks run first because their messages are more specific than the generic
 * engine's, which only sees opaque strings.
 *
 * <p>Not thread-safe: the expected field count and the last diagnostic are plain fields. Use one
 * instance per record stream.
 */
public final class RecordValidator {

    private static final Logger LOG = LoggerFactory.getLogger(RecordValidator.class);

    private final Schema schema;
    private final StructuralValidator structural;
    private Integer expectedFieldCount;
    private String lastError;

    private RecordValidator(Schema schema, Integer expectedFieldCount) {
        this.schema = schema;
        this.structural = schema != null ? schema.structuralValidator() : null;
        this.expectedFieldCount = expectedFieldCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Runs the full per-record check sequence.
     *
     * @param row the record to check
     * @return the outcome; on failure it carries the first failing check's diagnostic
     */
    public ValidationOutcome validate(Row row) {
        Objects.requireNonNull(row, "row must not be null");
        ValidationOutcome count = checkFieldCount(row.fieldCount());
        if (row.header()) {
            return remember(ValidationOutcome.pass());
        }
        if (count.isInvalid()) {
            LOG.debug("Record {} rejected: {}", row.number(), count.diagnostic());
            return count;
        }
        ValidationOutcome outcome = checkSchema(row.fields());
        if (outcome.isInvalid()) {
            LOG.debug("Record {} rejected: {}", row.number(), outcome.diagnostic());
        }
        return outcome;
    }

    /**
     * Checks a record's field count against the contract. The first call fixes the contract when
     * no count was configured; later calls never change it.
     */
    public ValidationOutcome checkFieldCount(int actualCount) {
        if (expectedFieldCount == null) {
            expectedFieldCount = actualCount;
            LOG.debug("Expected field count fixed from first record: {}", actualCount);
        }
        if (actualCount != expectedFieldCount) {
            return remember(ValidationOutcome.fail(Diagnostics.badFieldCount(expectedFieldCount, actualCount)));
        }
        return remember(ValidationOutcome.pass());
    }

    /**
     * Checks a record against the schema: numeric type, then numeric range, then the generic
     * structural checks. Passes trivially when no schema is configured.
     */
    public ValidationOutcome checkSchema(List<String> fields) {
        Objects.requireNonNull(fields, "fields must not be null");
        if (schema == null) {
            return remember(ValidationOutcome.pass());
        }
        String diagnostic = checkNumericKinds(fields);
        if (diagnostic == null) {
            diagnostic = checkNumericLimits(fields);
        }
        if (diagnostic == null) {
            diagnostic = structural.firstViolation(fields).orElse(null);
        }
        return remember(diagnostic == null ? ValidationOutcome.pass() : ValidationOutcome.fail(diagnostic));
    }

    private String checkNumericKinds(List<String> fields) {
        for (FieldRule rule : schema.rules()) {
            if (!rule.isNumeric()) {
                continue;
            }
            if (rule.index() >= fields.size()) {
                return Diagnostics.missingField(rule, fields.size());
            }
            String value = fields.get(rule.index());
            if (rule.numericKind().coerce(value) == null) {
                return Diagnostics.failedNumericKind(rule, value);
            }
        }
        return null;
    }

    private String checkNumericLimits(List<String> fields) {
        for (FieldRule rule : schema.rules()) {
            if (!rule.hasNumericLimits()) {
                continue;
            }
            // numeric-kind check already guaranteed presence and coercibility
            String value = fields.get(rule.index());
            BigDecimal number = rule.numericKind().coerce(value);
            if (rule.numericMinimum() != null && number.compareTo(rule.numericMinimum()) < 0) {
                return Diagnostics.belowMinimum(rule, value);
            }
            if (rule.numericMaximum() != null && number.compareTo(rule.numericMaximum()) > 0) {
                return Diagnostics.aboveMaximum(rule, value);
            }
        }
        return null;
    }

    private ValidationOutcome remember(ValidationOutcome outcome) {
        lastError = outcome.diagnostic();
        return outcome;
    }

    /** Diagnostic of the most recent check, or {@code null} if it passed. */
    public String lastError() {
        return lastError;
    }

    /** The field-count contract, empty until configured or fixed by the first record. */
    public OptionalInt expectedFieldCount() {
        return expectedFieldCount == null ? OptionalInt.empty() : OptionalInt.of(expectedFieldCount);
    }

    public Optional<Schema> schema() {
        return Optional.ofNullable(schema);
    }

    /** Builder for {@link RecordValidator}. Both settings are optional. */
    public static final class Builder {
        private Schema schema;
        private Integer expectedFieldCount;

        Builder() {}

        public Builder schema(Schema schema) {
            this.schema = schema;
            return this;
        }

        /** Pre-configures the field-count contract; {@code null} means "adopt from first record". */
        public Builder expectedFieldCount(Integer expectedFieldCount) {
            if (expectedFieldCount != null && expectedFieldCount < 1) {
                throw new IllegalArgumentException("expectedFieldCount must be positive: " + expectedFieldCount);
            }
            this.expectedFieldCount = expectedFieldCount;
            return this;
        }

        public RecordValidator build() {
            return new RecordValidator(schema, expectedFieldCount);
        }
    }
}
