package com.nexuslog.sdk.format;

import com.nexuslog.sdk.model.Level;
import com.nexuslog.sdk.model.LogEntry;
import com.nexuslog.sdk.model.Timestamp;
import com.nexuslog.sdk.model.TimestampMode;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Renders entries as single {@code key=value} lines.
 *
 * <pre>
 * CALENDAR: time=2024-01-15T10:30:00.123456+01:00 level=info name=api msg="started"
 * UNIX:     time=1705311000.123456789 level=info name=api msg="started"
 * </pre>
 *
 * <p>The message is copied byte for byte; quotes and newlines inside it are not escaped.
 * Not thread-safe: each sink worker owns one instance.</p>
 */
public final class LineFormatter {

    private static final byte[] NAME_KEY = " name=".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] MSG_OPEN = " msg=\"".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] MSG_CLOSE = "\"\n".getBytes(StandardCharsets.US_ASCII);
    private static final byte[] LEVEL_KEY = " level=".getBytes(StandardCharsets.US_ASCII);

    private static final Map<Level, byte[]> LEVEL_LABELS = new EnumMap<>(Level.class);

    static {
        for (Level level : Level.values()) {
            LEVEL_LABELS.put(level, level.getValue().getBytes(StandardCharsets.US_ASCII));
        }
    }

    private final TimestampMode mode;
    private final SecondCache cache;
    private final byte[] digits = new byte[9];

    private String lastName;
    private byte[] lastNameBytes;

    public LineFormatter(TimestampMode mode, ZoneId zone) {
        this.mode = Objects.requireNonNull(mode, "mode");
        this.cache = new SecondCache(Objects.requireNonNull(zone, "zone"));
    }

    /**
     * Local calendar date of {@code timestamp} in this formatter's zone.
     */
    public LocalDate dateOf(Timestamp timestamp) {
        cache.update(timestamp.seconds());
        return cache.date();
    }

    public void format(LogEntry entry, OutputStream out) throws IOException {
        Timestamp ts = entry.getTimestamp();
        cache.update(ts.seconds());

        if (mode == TimestampMode.UNIX) {
            out.write(cache.unixPrefix());
            writePadded(out, ts.nanos(), 9);
            out.write(LEVEL_KEY);
        } else {
            out.write(cache.calendarPrefix());
            writePadded(out, ts.nanos() / 1_000, 6);
            out.write(cache.offsetSuffix());
        }
        out.write(LEVEL_LABELS.get(entry.getLevel()));

        String name = entry.getName();
        if (name != null) {
            out.write(NAME_KEY);
            out.write(nameBytes(name));
        }
        out.write(MSG_OPEN);
        entry.getMessage().writeTo(out);
        out.write(MSG_CLOSE);
    }

    public byte[] format(LogEntry entry) {
        ByteArrayOutputStream out = new ByteArrayOutputStream(128);
        try {
            format(entry, out);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    private byte[] nameBytes(String name) {
        if (!name.equals(lastName)) {
            lastName = name;
            lastNameBytes = name.getBytes(StandardCharsets.UTF_8);
        }
        return lastNameBytes;
    }

    private void writePadded(OutputStream out, int value, int width) throws IOException {
        for (int i = width - 1; i >= 0; i--) {
            digits[i] = (byte) ('0' + value % 10);
            value /= 10;
        }
        out.write(digits, 0, width);
    }
}
