package com.nexuslog.sdk.time;

import com.nexuslog.sdk.model.Timestamp;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * Producer-side timestamp cache.
 *
 * <p>Each thread keeps an anchor: a monotonic reading and the wall-clock time taken at that
 * reading. Within one second of the anchor, {@link #now()} derives wall time from the
 * monotonic delta alone; after that it re-reads the wall clock and moves the anchor. A wall
 * clock adjustment between resyncs is therefore picked up at most one second late.</p>
 */
public final class CachedClock {

    static final long RESYNC_INTERVAL_NANOS = TimeUnit.SECONDS.toNanos(1);

    private static final CachedClock SYSTEM = new CachedClock(TimeSource.system());

    private final ThreadLocal<Anchor> anchors;

    public CachedClock(TimeSource source) {
        Objects.requireNonNull(source, "source");
        this.anchors = ThreadLocal.withInitial(() -> new Anchor(source));
    }

    public static CachedClock system() {
        return SYSTEM;
    }

    public static CachedClock of(TimeSource source) {
        return source == TimeSource.system() ? SYSTEM : new CachedClock(source);
    }

    public Timestamp now() {
        return anchors.get().now();
    }

    private static final class Anchor {
        private final TimeSource source;
        private long monotonicAnchor;
        private Timestamp wallAnchor;

        Anchor(TimeSource source) {
            this.source = source;
            resync();
        }

        Timestamp now() {
            long elapsed = source.monotonicNanos() - monotonicAnchor;
            if (elapsed >= RESYNC_INTERVAL_NANOS || elapsed < 0) {
                return resync();
            }
            return wallAnchor.plusNanos(elapsed);
        }

        private Timestamp resync() {
            wallAnchor = source.wallClock();
            monotonicAnchor = source.monotonicNanos();
            return wallAnchor;
        }
    }
}
