package io.rowcheck.core.engine;

import io.rowcheck.core.model.Row;
import io.rowcheck.core.model.RunStats;
import io.rowcheck.core.model.ValidationOutcome;
import io.rowcheck.core.spi.RecordSink;
import io.rowcheck.core.spi.RecordSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single pass over a record stream: each record is read, validated, routed to the valid or invalid
 * sink, and dropped before the next one is read. Invalid records never stop the pass.
 *
 * <p>The header row is accepted without schema checks and written to the valid sink.
 */
public final class ValidationRun {

    private static final Logger LOG = LoggerFactory.getLogger(ValidationRun.class);

    private final RecordValidator validator;
    private final RecordSink validSink;
    private final RecordSink invalidSink;
    private final boolean appendErrorMessage;

    /**
     * @param validator          validator for this stream; not shared with other streams
     * @param validSink          receives accepted records
     * @param invalidSink        receives rejected records
     * @param appendErrorMessage append the diagnostic as an extra trailing field of invalid records
     */
    public ValidationRun(
            RecordValidator validator, RecordSink validSink, RecordSink invalidSink, boolean appendErrorMessage) {
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.validSink = Objects.requireNonNull(validSink, "validSink must not be null");
        this.invalidSink = Objects.requireNonNull(invalidSink, "invalidSink must not be null");
        this.appendErrorMessage = appendErrorMessage;
    }

    /**
     * Drains the source.
     *
     * @return tallies for the run
     * @throws io.rowcheck.core.error.RecordReadException if the source or a sink fails
     */
    public RunStats run(RecordSource source) {
        Objects.requireNonNull(source, "source must not be null");
        RunStats stats = RunStats.EMPTY;
        Optional<Row> next;
        while ((next = source.next()).isPresent()) {
            Row row = next.get();
            ValidationOutcome outcome = validator.validate(row);
            if (outcome.valid()) {
                validSink.write(row.fields());
                stats = stats.withValid();
            } else {
                invalidSink.write(annotate(row, outcome));
                stats = stats.withInvalid();
            }
        }
        LOG.info("Validation complete: read={}, valid={}, invalid={}", stats.read(), stats.valid(), stats.invalid());
        return stats;
    }

    private List<String> annotate(Row row, ValidationOutcome outcome) {
        if (!appendErrorMessage) {
            return row.fields();
        }
        List<String> fields = new ArrayList<>(row.fieldCount() + 1);
        fields.addAll(row.fields());
        fields.add(outcome.diagnostic());
        return fields;
    }
}
