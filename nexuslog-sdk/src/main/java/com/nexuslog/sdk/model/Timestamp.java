package com.nexuslog.sdk.model;

/**
 * Wall-clock instant with nanosecond precision, split the way the formatter consumes it.
 *
 * @param seconds seconds since the Unix epoch
 * @param nanos   nanoseconds within the second, {@code 0 <= nanos < 1_000_000_000}
 */
public record Timestamp(long seconds, int nanos) {

    public static final int NANOS_PER_SECOND = 1_000_000_000;

    public Timestamp {
        if (nanos < 0 || nanos >= NANOS_PER_SECOND) {
            throw new IllegalArgumentException("nanos must be in [0, 1e9), got: " + nanos);
        }
    }

    /**
     * Returns this timestamp shifted forward by {@code deltaNanos}, carrying into seconds.
     */
    public Timestamp plusNanos(long deltaNanos) {
        long total = nanos + deltaNanos;
        return new Timestamp(seconds + Math.floorDiv(total, NANOS_PER_SECOND),
                (int) Math.floorMod(total, NANOS_PER_SECOND));
    }
}
