package com.nexuslog.sdk.model;

import java.util.Objects;

/**
 * One structured log record. Immutable; handed to the sink worker exactly once.
 */
public final class LogEntry {

    private final Timestamp timestamp;
    private final String name;
    private final Level level;
    private final LogMessage message;

    public LogEntry(Timestamp timestamp, String name, Level level, LogMessage message) {
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.name = name;
        this.level = Objects.requireNonNull(level, "level");
        this.message = Objects.requireNonNull(message, "message");
    }

    public Timestamp getTimestamp() {
        return timestamp;
    }

    /**
     * Logger name, or {@code null} when the logger was built without one.
     */
    public String getName() {
        return name;
    }

    public Level getLevel() {
        return level;
    }

    public LogMessage getMessage() {
        return message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        LogEntry that = (LogEntry) o;
        return timestamp.equals(that.timestamp)
                && Objects.equals(name, that.name)
                && level == that.level
                && message.equals(that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(timestamp, name, level, message);
    }

    @Override
    public String toString() {
        return "LogEntry{" +
                "timestamp=" + timestamp +
                ", name='" + name + '\'' +
                ", level=" + level +
                ", message='" + message + '\'' +
                '}';
    }
}
