package com.nexuslog.sdk.time;

import com.nexuslog.sdk.model.Timestamp;

import java.time.Clock;
import java.time.Instant;

/**
 * Reads the two clocks the runtime needs: wall-clock time for timestamps, and a monotonic
 * counter for measuring elapsed time between wall-clock reads.
 */
public interface TimeSource {

    Timestamp wallClock();

    long monotonicNanos();

    static TimeSource system() {
        return SystemTimeSource.INSTANCE;
    }

    final class SystemTimeSource implements TimeSource {
        static final SystemTimeSource INSTANCE = new SystemTimeSource();

        private final Clock clock = Clock.systemUTC();

        private SystemTimeSource() {
        }

        @Override
        public Timestamp wallClock() {
            Instant now = clock.instant();
            return new Timestamp(now.getEpochSecond(), now.getNano());
        }

        @Override
        public long monotonicNanos() {
            return System.nanoTime();
        }
    }
}
