package com.nexuslog.sdk.client;

import com.nexuslog.sdk.model.Level;
import com.nexuslog.sdk.model.LogEntry;
import com.nexuslog.sdk.model.LogMessage;
import com.nexuslog.sdk.model.TimestampMode;
import com.nexuslog.sdk.time.CachedClock;
import com.nexuslog.sdk.time.TimeSource;

import java.io.OutputStream;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneId;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * NexusLogger - asynchronous structured logger handle
 *
 * <p>Log calls never perform I/O. Each call is filtered by level, stamped from a per-thread
 * cached clock, and appended to a batch owned by the calling thread; full batches go to the
 * sink's writer thread over a bounded queue. When that queue is full the caller waits
 * rather than losing entries.</p>
 *
 * <h2>Features:</h2>
 * <ul>
 *   <li><b>Shared sinks</b> - loggers built for the same file (or for stdout) share one
 *       writer thread and one open file</li>
 *   <li><b>Daily rotation</b> - {@code app.log} is written as {@code app_YYYYMMDD.log}</li>
 *   <li><b>Bounded staleness</b> - buffered output reaches the file within about a second</li>
 *   <li><b>Graceful shutdown</b> - closing the last logger of a sink drains and joins its writer</li>
 * </ul>
 *
 * <h2>Usage:</h2>
 * <pre>{@code
 * try (NexusLogger logger = NexusLogger.builder()
 *         .name("orders")
 *         .path("logs/orders.log")
 *         .level(Level.DEBUG)
 *         .build()) {
 *     logger.info("order accepted");
 * }
 * }</pre>
 *
 * <p>Entries sit in the calling thread's batch until it fills. Threads that stop logging
 * should call {@link #flush()} so their last entries are written; {@link #close()} flushes
 * the closing thread's batch only.</p>
 */
public class NexusLogger implements AutoCloseable {

    private final String name;
    private final AtomicInteger minLevel;
    private final int inlineCapacity;
    private final CachedClock clock;
    private final SinkRegistry registry;
    private final SharedSink sink;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private NexusLogger(Builder builder) {
        this(builder, true);
    }

    /**
     * @param attachSink false to build a logger without a sink, for subclasses that
     *                   override {@link #append(LogEntry)}
     */
    protected NexusLogger(Builder builder, boolean attachSink) {
        this.name = builder.name;
        this.minLevel = new AtomicInteger(builder.level.ordinal());
        this.inlineCapacity = builder.inlineCapacity;
        this.clock = CachedClock.of(builder.timeSource);
        this.registry = builder.registry;
        if (attachSink) {
            this.sink = registry.resolve(builder.toSinkConfig());
            if (builder.registerShutdownHook) {
                registry.registerShutdownHook();
            }
        } else {
            this.sink = null;
        }
    }

    /**
     * Create a new builder
     */
    public static Builder builder() {
        return new Builder();
    }

    // ========================================================================
    // Public API
    // ========================================================================

    public boolean isEnabled(Level level) {
        return level.ordinal() >= minLevel.get();
    }

    /**
     * Record {@code message} at {@code level}. Returns without I/O unless the calling
     * thread's batch filled up and the sink's queue is full.
     */
    public void log(Level level, String message) {
        if (level.ordinal() < minLevel.get() || closed.get()) {
            return;
        }
        LogMessage rendered = LogMessage.of(message, inlineCapacity);
        append(new LogEntry(clock.now(), name, level, rendered));
    }

    public void trace(String message) {
        log(Level.TRACE, message);
    }

    public void debug(String message) {
        log(Level.DEBUG, message);
    }

    public void info(String message) {
        log(Level.INFO, message);
    }

    public void warn(String message) {
        log(Level.WARN, message);
    }

    public void error(String message) {
        log(Level.ERROR, message);
    }

    public Level getLevel() {
        return Level.values()[minLevel.get()];
    }

    /**
     * Change the minimum level. Safe to call while other threads are logging.
     */
    public void setLevel(Level level) {
        minLevel.set(Objects.requireNonNull(level, "level").ordinal());
    }

    /**
     * Logger name, or {@code null}
     */
    public String getName() {
        return name;
    }

    /**
     * Key of the sink this logger writes to, or {@code null} for a detached logger.
     */
    public SinkKey getSinkKey() {
        return sink != null ? sink.getKey() : null;
    }

    /**
     * Get metrics of the underlying sink
     */
    public SinkMetrics.Snapshot getMetrics() {
        return sink != null ? sink.getMetrics() : new SinkMetrics().snapshot();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Send the calling thread's pending entries and ask the writer to flush its buffer.
     * Does not wait for the write to happen.
     */
    public void flush() {
        if (sink != null && !closed.get()) {
            sink.flush();
        }
    }

    /**
     * Shutdown the logger. Same as {@link #close()}.
     */
    public void shutdown() {
        close();
    }

    /**
     * Send the calling thread's pending entries and give up this logger's share of the
     * sink. Closing the last logger of a sink blocks until its writer has drained and
     * stopped. Further calls on this logger are ignored.
     */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (sink != null) {
            sink.detachThread();
            registry.release(sink);
        }
    }

    /**
     * Hand a filtered, stamped entry to the sink.
     */
    protected void append(LogEntry entry) {
        sink.push(entry);
    }

    // ========================================================================
    // Builder
    // ========================================================================

    public static class Builder {
        private String name;
        private Path path;
        private Level level = Level.INFO;
        private TimestampMode timestampMode = TimestampMode.CALENDAR;
        private ZoneId zone = ZoneId.systemDefault();
        private int transportCapacity = 65_536;
        private int inlineCapacity = LogMessage.DEFAULT_INLINE_CAPACITY;
        private int batchSize = 32;
        private SinkRegistry registry = SinkRegistry.global();
        private TimeSource timeSource = TimeSource.system();
        private boolean registerShutdownHook = true;
        private OutputStream console = System.out;

        protected Builder() {
        }

        /**
         * Set the logger name written as {@code name=} (default: none)
         */
        public Builder name(String name) {
            this.name = name;
            return this;
        }

        /**
         * Set the file to log to; {@code null} logs to stdout (default: stdout).
         * The file is rotated daily as {@code stem_YYYYMMDD.ext}.
         */
        public Builder path(Path path) {
            this.path = path;
            return this;
        }

        public Builder path(String path) {
            this.path = path != null ? Paths.get(path) : null;
            return this;
        }

        /**
         * Set the minimum level (default: INFO)
         */
        public Builder level(Level level) {
            this.level = level;
            return this;
        }

        /**
         * Set how the sink renders time (default: CALENDAR).
         * Only applies when this logger creates the sink.
         */
        public Builder timestampMode(TimestampMode timestampMode) {
            this.timestampMode = timestampMode;
            return this;
        }

        /**
         * Set the zone for calendar timestamps and rotation dates (default: system zone).
         * Only applies when this logger creates the sink.
         */
        public Builder zone(ZoneId zone) {
            this.zone = zone;
            return this;
        }

        /**
         * Set the sink queue capacity in directives (default: 65,536).
         * Only applies when this logger creates the sink.
         */
        public Builder transportCapacity(int transportCapacity) {
            this.transportCapacity = transportCapacity;
            return this;
        }

        /**
         * Set the largest UTF-8 message size kept inline (default: 256 bytes)
         */
        public Builder inlineCapacity(int inlineCapacity) {
            this.inlineCapacity = inlineCapacity;
            return this;
        }

        /**
         * Set the number of entries a thread batches before sending (default: 32).
         * Only applies when this logger creates the sink.
         */
        public Builder batchSize(int batchSize) {
            this.batchSize = batchSize;
            return this;
        }

        /**
         * Use a private registry instead of the process-wide one
         */
        public Builder registry(SinkRegistry registry) {
            this.registry = registry;
            return this;
        }

        /**
         * Provide the clocks timestamps are read from (advanced usage/testing)
         */
        public Builder timeSource(TimeSource timeSource) {
            this.timeSource = timeSource;
            return this;
        }

        /**
         * Enable/disable the JVM shutdown hook that drains all sinks (default: true)
         */
        public Builder registerShutdownHook(boolean register) {
            this.registerShutdownHook = register;
            return this;
        }

        Builder console(OutputStream console) {
            this.console = console;
            return this;
        }

        SinkConfig toSinkConfig() {
            SinkKey key = path != null ? SinkKey.forPath(path) : SinkKey.CONSOLE;
            return new SinkConfig(key, timestampMode, zone, transportCapacity, batchSize, console);
        }

        public NexusLogger build() {
            validate();
            return new NexusLogger(this);
        }

        protected void validate() {
            Objects.requireNonNull(level, "level");
            Objects.requireNonNull(timestampMode, "timestampMode");
            Objects.requireNonNull(zone, "zone");
            Objects.requireNonNull(registry, "registry");
            Objects.requireNonNull(timeSource, "timeSource");
            if (transportCapacity < 1) {
                throw new IllegalArgumentException("transportCapacity must be >= 1, got: " + transportCapacity);
            }
            if (inlineCapacity < 1) {
                throw new IllegalArgumentException("inlineCapacity must be >= 1, got: " + inlineCapacity);
            }
            if (batchSize < 1) {
                throw new IllegalArgumentException("batchSize must be >= 1, got: " + batchSize);
            }
        }
    }
}
