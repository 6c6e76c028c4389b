package com.nexuslog.sdk.model;

/**
 * Log severity, ordered from least to most severe.
 */
public enum Level {
    TRACE("trace"),
    DEBUG("debug"),
    INFO("info"),
    WARN("warn"),
    ERROR("error");

    private final String value;

    Level(String value) {
        this.value = value;
    }

    /**
     * Lowercase label written into the {@code level=} field of every line.
     */
    public String getValue() {
        return value;
    }

    public boolean isAtLeast(Level threshold) {
        return ordinal() >= threshold.ordinal();
    }

    public static Level fromValue(String value) {
        for (Level level : Level.values()) {
            if (level.value.equalsIgnoreCase(value)) {
                return level;
            }
        }
        if ("warning".equalsIgnoreCase(value)) {
            return WARN;
        }
        throw new IllegalArgumentException("Unknown Level: " + value);
    }
}
