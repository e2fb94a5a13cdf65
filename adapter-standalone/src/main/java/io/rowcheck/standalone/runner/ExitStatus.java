package io.rowcheck.standalone.runner;

import io.rowcheck.core.model.RunStats;

/** Process exit statuses, following the BSD {@code sysexits.h} codes. */
public enum ExitStatus {
    /** Input had records and all of them were valid. */
    SUCCESS(0),

    /** At least one record was invalid. */
    INVALID_DATA(65),

    /** The input held no records. */
    NO_DATA(66),

    /** Reading input or writing output failed mid-stream. */
    IO_ERROR(74),

    /** Run configuration or schema was rejected before any record was read. */
    CONFIG_ERROR(78);

    private final int code;

    ExitStatus(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /** Maps the tallies of a completed run. */
    public static ExitStatus of(RunStats stats) {
        if (stats.isEmpty()) {
            return NO_DATA;
        }
        return stats.hasInvalid() ? INVALID_DATA : SUCCESS;
    }
}
