package com.nexuslog.sdk.time;

import com.nexuslog.sdk.model.Timestamp;

/**
 * Wall clock pinned to one instant; the monotonic clock keeps running so cached stamps
 * drift forward from it by real elapsed time.
 */
public class FixedTimeSource implements TimeSource {

    private final Timestamp wallClock;

    public FixedTimeSource(long epochSeconds, int nanos) {
        this.wallClock = new Timestamp(epochSeconds, nanos);
    }

    @Override
    public Timestamp wallClock() {
        return wallClock;
    }

    @Override
    public long monotonicNanos() {
        return System.nanoTime();
    }
}
