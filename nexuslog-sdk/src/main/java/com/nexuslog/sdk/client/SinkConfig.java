package com.nexuslog.sdk.client;

import com.nexuslog.sdk.model.TimestampMode;

import java.io.OutputStream;
import java.time.ZoneId;
import java.util.Objects;

/**
 * Settings a shared sink is created with. The first logger to resolve a key decides them.
 */
final class SinkConfig {

    private final SinkKey key;
    private final TimestampMode timestampMode;
    private final ZoneId zone;
    private final int transportCapacity;
    private final int batchSize;
    private final OutputStream console;

    SinkConfig(SinkKey key, TimestampMode timestampMode, ZoneId zone,
               int transportCapacity, int batchSize, OutputStream console) {
        this.key = Objects.requireNonNull(key, "key");
        this.timestampMode = Objects.requireNonNull(timestampMode, "timestampMode");
        this.zone = Objects.requireNonNull(zone, "zone");
        this.transportCapacity = transportCapacity;
        this.batchSize = batchSize;
        this.console = Objects.requireNonNull(console, "console");
    }

    SinkKey getKey() {
        return key;
    }

    TimestampMode getTimestampMode() {
        return timestampMode;
    }

    ZoneId getZone() {
        return zone;
    }

    int getTransportCapacity() {
        return transportCapacity;
    }

    int getBatchSize() {
        return batchSize;
    }

    OutputStream getConsole() {
        return console;
    }

    boolean sameSettings(SinkConfig other) {
        return timestampMode == other.timestampMode
                && zone.equals(other.zone)
                && transportCapacity == other.transportCapacity
                && batchSize == other.batchSize;
    }

    @Override
    public String toString() {
        return "SinkConfig{key=" + key + ", timestampMode=" + timestampMode + ", zone=" + zone
                + ", transportCapacity=" + transportCapacity + ", batchSize=" + batchSize + '}';
    }
}
