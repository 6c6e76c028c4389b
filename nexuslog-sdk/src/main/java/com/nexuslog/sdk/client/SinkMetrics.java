package com.nexuslog.sdk.client;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Counters for one shared sink. Producers only touch {@code entriesDropped}.
 */
public final class SinkMetrics {

    private final AtomicLong entriesWritten = new AtomicLong(0);
    private final AtomicLong batchesReceived = new AtomicLong(0);
    private final AtomicLong flushes = new AtomicLong(0);
    private final AtomicLong rotations = new AtomicLong(0);
    private final AtomicLong entriesDropped = new AtomicLong(0);

    void entryWritten() {
        entriesWritten.incrementAndGet();
    }

    void batchReceived() {
        batchesReceived.incrementAndGet();
    }

    void flushed() {
        flushes.incrementAndGet();
    }

    void rotated() {
        rotations.incrementAndGet();
    }

    void dropped(int entries) {
        if (entries > 0) {
            entriesDropped.addAndGet(entries);
        }
    }

    public Snapshot snapshot() {
        return new Snapshot(entriesWritten.get(), batchesReceived.get(), flushes.get(),
                rotations.get(), entriesDropped.get());
    }

    /**
     * Metrics snapshot
     */
    public static class Snapshot {
        public final long entriesWritten;
        public final long batchesReceived;
        public final long flushes;
        public final long rotations;
        public final long entriesDropped;

        Snapshot(long entriesWritten, long batchesReceived, long flushes,
                 long rotations, long entriesDropped) {
            this.entriesWritten = entriesWritten;
            this.batchesReceived = batchesReceived;
            this.flushes = flushes;
            this.rotations = rotations;
            this.entriesDropped = entriesDropped;
        }

        @Override
        public String toString() {
            return String.format("Metrics{written=%d, batches=%d, flushes=%d, rotations=%d, dropped=%d}",
                    entriesWritten, batchesReceived, flushes, rotations, entriesDropped);
        }
    }
}
