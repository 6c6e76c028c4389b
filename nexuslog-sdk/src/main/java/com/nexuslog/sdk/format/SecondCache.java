package com.nexuslog.sdk.format;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;

/**
 * Consumer-side cache of everything in a line that only changes once per second.
 *
 * <p>Consecutive entries mostly share their whole second, so the calendar breakdown, the
 * local offset and the rendered prefixes are recomputed only when the second advances.</p>
 */
final class SecondCache {

    private final ZoneId zone;

    private boolean primed;
    private long second;
    private LocalDate date;
    private byte[] calendarPrefix;
    private byte[] offsetSuffix;
    private byte[] unixPrefix;

    SecondCache(ZoneId zone) {
        this.zone = zone;
    }

    void update(long epochSecond) {
        if (primed && second == epochSecond) {
            return;
        }
        ZonedDateTime local = Instant.ofEpochSecond(epochSecond).atZone(zone);
        date = local.toLocalDate();

        StringBuilder sb = new StringBuilder(32);
        sb.append("time=");
        pad(sb, local.getYear(), 4).append('-');
        pad(sb, local.getMonthValue(), 2).append('-');
        pad(sb, local.getDayOfMonth(), 2).append('T');
        pad(sb, local.getHour(), 2).append(':');
        pad(sb, local.getMinute(), 2).append(':');
        pad(sb, local.getSecond(), 2).append('.');
        calendarPrefix = sb.toString().getBytes(StandardCharsets.US_ASCII);

        int offset = local.getOffset().getTotalSeconds();
        int abs = Math.abs(offset);
        sb.setLength(0);
        sb.append(offset >= 0 ? '+' : '-');
        pad(sb, abs / 3600, 2).append(':');
        pad(sb, (abs % 3600) / 60, 2).append(" level=");
        offsetSuffix = sb.toString().getBytes(StandardCharsets.US_ASCII);

        unixPrefix = ("time=" + epochSecond + ".").getBytes(StandardCharsets.US_ASCII);

        second = epochSecond;
        primed = true;
    }

    LocalDate date() {
        return date;
    }

    byte[] calendarPrefix() {
        return calendarPrefix;
    }

    byte[] offsetSuffix() {
        return offsetSuffix;
    }

    byte[] unixPrefix() {
        return unixPrefix;
    }

    private static StringBuilder pad(StringBuilder sb, int value, int width) {
        String digits = Integer.toString(value);
        for (int i = digits.length(); i < width; i++) {
            sb.append('0');
        }
        return sb.append(digits);
    }
}
