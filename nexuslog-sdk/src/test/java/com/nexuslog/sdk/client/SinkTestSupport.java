package com.nexuslog.sdk.client;

import com.nexuslog.sdk.model.Level;
import com.nexuslog.sdk.model.LogEntry;
import com.nexuslog.sdk.model.LogMessage;
import com.nexuslog.sdk.model.Timestamp;
import com.nexuslog.sdk.model.TimestampMode;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.List;
import java.util.function.BooleanSupplier;

final class SinkTestSupport {

    // 2024-01-15T10:00:00Z
    static final long JAN_15_MORNING = 1_705_312_800L;

    private SinkTestSupport() {
    }

    static SinkConfig fileConfig(Path path, int capacity, int batchSize) {
        return new SinkConfig(SinkKey.forPath(path), TimestampMode.UNIX, ZoneOffset.UTC,
                capacity, batchSize, new ByteArrayOutputStream());
    }

    static LogEntry entry(long seconds, int nanos, String message) {
        return new LogEntry(new Timestamp(seconds, nanos), "test", Level.INFO, LogMessage.of(message));
    }

    static LogEntry entry(String message) {
        return entry(JAN_15_MORNING, 0, message);
    }

    static List<String> readLines(Path file) throws IOException {
        return Files.readAllLines(file, StandardCharsets.UTF_8);
    }

    static boolean waitUntil(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        long deadline = System.nanoTime() + timeout.toNanos();
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(10);
        }
        return condition.getAsBoolean();
    }
}
