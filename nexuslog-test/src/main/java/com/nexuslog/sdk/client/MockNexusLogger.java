package com.nexuslog.sdk.client;

import com.nexuslog.sdk.model.Level;
import com.nexuslog.sdk.model.LogEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory NexusLogger for tests. Entries that pass the level filter are captured instead
 * of being written; no sink or writer thread is created.
 */
public class MockNexusLogger extends NexusLogger {

    private final CopyOnWriteArrayList<LogEntry> capturedEntries = new CopyOnWriteArrayList<>();

    public MockNexusLogger() {
        this(null, Level.TRACE);
    }

    public MockNexusLogger(String name) {
        this(name, Level.TRACE);
    }

    public MockNexusLogger(String name, Level level) {
        super(NexusLogger.builder()
                .name(name)
                .level(level)
                .registerShutdownHook(false),
                false);
    }

    @Override
    protected void append(LogEntry entry) {
        capturedEntries.add(entry);
    }

    public List<LogEntry> getCapturedEntries() {
        return Collections.unmodifiableList(capturedEntries);
    }

    public List<String> getMessages() {
        List<String> messages = new ArrayList<>(capturedEntries.size());
        for (LogEntry entry : capturedEntries) {
            messages.add(entry.getMessage().asString());
        }
        return messages;
    }

    public List<LogEntry> getEntriesAt(Level level) {
        List<LogEntry> matches = new ArrayList<>();
        for (LogEntry entry : capturedEntries) {
            if (entry.getLevel() == level) {
                matches.add(entry);
            }
        }
        return matches;
    }

    public void reset() {
        capturedEntries.clear();
    }

    public void assertEntryCount(int expected) {
        int actual = capturedEntries.size();
        if (actual != expected) {
            throw new AssertionError("Expected " + expected + " entries but found " + actual);
        }
    }

    public void assertLogged(Level level, String message) {
        for (LogEntry entry : capturedEntries) {
            if (entry.getLevel() == level && message.equals(entry.getMessage().asString())) {
                return;
            }
        }
        throw new AssertionError("Expected " + level.getValue() + " entry with message '" + message + "'");
    }
}
