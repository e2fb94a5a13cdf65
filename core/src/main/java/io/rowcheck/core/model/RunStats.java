package io.rowcheck.core.model;

/**
 * Tallies of one validation run.
 *
 * @param read    records read, header included
 * @param valid   records accepted (header included)
 * @param invalid records rejected
 */
public record RunStats(long read, long valid, long invalid) {

    public static final RunStats EMPTY = new RunStats(0, 0, 0);

    public boolean isEmpty() {
        return read == 0;
    }

    public boolean hasInvalid() {
        return invalid > 0;
    }

    RunStats plus(boolean accepted) {
        return accepted ? new RunStats(read + 1, valid + 1, invalid) : new RunStats(read + 1, valid, invalid + 1);
    }

    /** Returns new tallies with one more accepted record. */
    public RunStats withValid() {
        return plus(true);
    }

    /** Returns new tallies with one more rejected record. */
    public RunStats withInvalid() {
        return plus(false);
    }
}
