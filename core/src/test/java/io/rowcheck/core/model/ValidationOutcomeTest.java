package io.rowcheck.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link ValidationOutcome} and {@link RunStats}. */
class ValidationOutcomeTest {

    @Test
    void passHasNoDiagnostic() {
        var outcome = ValidationOutcome.pass();

        assertThat(outcome.valid()).isTrue();
        assertThat(outcome.isInvalid()).isFalse();
        assertThat(outcome.diagnostic()).isNull();
    }

    @Test
    void failCarriesDiagnostic() {
        var outcome = ValidationOutcome.fail("bad field count - should be 3 but is: 2");

        assertThat(outcome.valid()).isFalse();
        assertThat(outcome.diagnostic()).isEqualTo("bad field count - should be 3 but is: 2");
    }

    @Test
    void failRequiresDiagnostic() {
        assertThatThrownBy(() -> ValidationOutcome.fail(null))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("diagnostic must not be null");
    }

    @Test
    void passRejectsDiagnostic() {
        assertThatThrownBy(() -> new ValidationOutcome(true, "oops")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void runStatsAccumulate() {
        RunStats stats = RunStats.EMPTY.withValid().withInvalid().withValid();

        assertThat(stats).isEqualTo(new RunStats(3, 2, 1));
        assertThat(stats.isEmpty()).isFalse();
        assertThat(stats.hasInvalid()).isTrue();
        assertThat(RunStats.EMPTY.isEmpty()).isTrue();
    }

    @Test
    void rowCopiesFields() {
        var fields = new ArrayList<>(List.of("a", "b"));
        Row row = Row.of(1, fields);
        fields.add("c");

        assertThat(row.fieldCount()).isEqualTo(2);
        assertThat(row.header()).isFalse();
    }
}
