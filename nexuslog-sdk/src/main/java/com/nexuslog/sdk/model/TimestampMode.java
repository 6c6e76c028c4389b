package com.nexuslog.sdk.model;

/**
 * How a sink renders the {@code time=} field. Fixed per sink at creation.
 */
public enum TimestampMode {
    /** {@code 2024-01-15T10:30:00.123456+01:00} in the sink's zone */
    CALENDAR,
    /** {@code 1705311000.123456789} */
    UNIX
}
