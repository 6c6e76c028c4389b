package com.nexuslog.sdk.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Table of live shared sinks, keyed by {@link SinkKey}.
 *
 * <p>The registry does not keep a sink alive: a sink lives while loggers hold references to
 * it, and an entry whose sink has lost its last reference is never handed out again. All
 * access goes through one monitor; it is only taken when loggers are built or closed.</p>
 */
public final class SinkRegistry {

    private static final Logger log = LoggerFactory.getLogger(SinkRegistry.class);

    private static final SinkRegistry GLOBAL = new SinkRegistry();

    private final Map<SinkKey, SharedSink> sinks = new HashMap<>();
    private Thread shutdownHook;

    /**
     * Process-wide registry used by loggers that do not name their own.
     */
    public static SinkRegistry global() {
        return GLOBAL;
    }

    /**
     * Return a retained reference to the live sink for {@code config}'s key, creating and
     * starting a new one if there is none.
     */
    SharedSink resolve(SinkConfig config) {
        synchronized (sinks) {
            SharedSink existing = sinks.get(config.getKey());
            if (existing != null && existing.tryRetain()) {
                if (!existing.getConfig().sameSettings(config)) {
                    log.debug("Sink {} already exists with {}, ignoring requested {}",
                            config.getKey(), existing.getConfig(), config);
                }
                return existing;
            }
            SharedSink created = new SharedSink(config);
            sinks.put(config.getKey(), created);
            return created;
        }
    }

    /**
     * Release one reference; the last release stops the sink and waits for its writer.
     */
    void release(SharedSink sink) {
        synchronized (sinks) {
            if (!sink.release()) {
                return;
            }
            sinks.remove(sink.getKey(), sink);
        }
        sink.stop();
    }

    /**
     * Number of registered sinks that still have owners.
     */
    public int activeSinkCount() {
        synchronized (sinks) {
            int count = 0;
            for (SharedSink sink : sinks.values()) {
                if (sink.referenceCount() > 0) {
                    count++;
                }
            }
            return count;
        }
    }

    public boolean isActive(SinkKey key) {
        synchronized (sinks) {
            SharedSink sink = sinks.get(key);
            return sink != null && sink.referenceCount() > 0;
        }
    }

    /**
     * Drain and stop every registered sink, whoever still references it. Loggers on a
     * stopped sink silently discard further entries.
     */
    public void shutdownAll() {
        List<SharedSink> toStop;
        synchronized (sinks) {
            toStop = new ArrayList<>(sinks.values());
            sinks.clear();
        }
        if (!toStop.isEmpty()) {
            log.info("Shutting down {} NexusLog sink(s)", toStop.size());
        }
        for (SharedSink sink : toStop) {
            sink.stop();
        }
    }

    /**
     * Install a JVM shutdown hook running {@link #shutdownAll()}. Only the first call
     * installs it.
     */
    void registerShutdownHook() {
        synchronized (sinks) {
            if (shutdownHook != null) {
                return;
            }
            shutdownHook = new Thread(this::shutdownAll, "nexuslog-shutdown");
            try {
                Runtime.getRuntime().addShutdownHook(shutdownHook);
            } catch (IllegalStateException e) {
                // JVM is already shutting down
                log.debug("Could not register shutdown hook: {}", e.getMessage());
            }
        }
    }

    boolean hasShutdownHook() {
        synchronized (sinks) {
            return shutdownHook != null;
        }
    }
}
