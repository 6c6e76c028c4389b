package com.nexuslog.sdk.time;

import com.nexuslog.sdk.model.Timestamp;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CachedClockTest {

    private TimeSource source;

    @BeforeEach
    void setUp() {
        source = mock(TimeSource.class);
    }

    @Test
    void derivesWallTimeFromMonotonicDeltaWithinOneSecond() {
        when(source.wallClock()).thenReturn(new Timestamp(100, 500_000_000));
        when(source.monotonicNanos()).thenReturn(1_000L, 1_000L, 600_001_000L);

        CachedClock clock = new CachedClock(source);

        assertEquals(new Timestamp(100, 500_000_000), clock.now());
        assertEquals(new Timestamp(101, 100_000_000), clock.now());
        verify(source, times(1)).wallClock();
    }

    @Test
    void resyncsOnceOneSecondHasElapsed() {
        when(source.wallClock()).thenReturn(new Timestamp(100, 0), new Timestamp(250, 42));
        when(source.monotonicNanos()).thenReturn(0L, 0L, 1_000_000_000L, 1_000_000_000L);

        CachedClock clock = new CachedClock(source);

        assertEquals(new Timestamp(100, 0), clock.now());
        // exactly one second later: the wall clock is read again
        assertEquals(new Timestamp(250, 42), clock.now());
        verify(source, times(2)).wallClock();
    }

    @Test
    void justUnderOneSecondStillUsesAnchor() {
        when(source.wallClock()).thenReturn(new Timestamp(100, 0));
        when(source.monotonicNanos()).thenReturn(0L, 0L, 999_999_999L);

        CachedClock clock = new CachedClock(source);
        clock.now();

        assertEquals(new Timestamp(100, 999_999_999), clock.now());
        verify(source, times(1)).wallClock();
    }

    @Test
    void eachThreadKeepsItsOwnAnchor() throws Exception {
        CachedClock clock = new CachedClock(new FixedTimeSource(1_000, 0));
        clock.now();

        AtomicReference<Timestamp> fromOtherThread = new AtomicReference<>();
        Thread other = new Thread(() -> fromOtherThread.set(clock.now()));
        other.start();
        other.join();

        assertEquals(1_000, fromOtherThread.get().seconds());
    }

    @Test
    void systemClockIsCloseToCurrentTime() {
        long before = System.currentTimeMillis() / 1000;
        Timestamp now = CachedClock.system().now();
        long after = System.currentTimeMillis() / 1000;

        assertTrue(now.seconds() >= before - 1 && now.seconds() <= after + 1);
    }
}
