package com.nexuslog.sdk.client;

import com.nexuslog.sdk.model.LogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One writer thread and its bounded transport, shared by every logger aimed at the same
 * {@link SinkKey}.
 *
 * <p>Producers append entries to a batch owned by the calling thread and hand the batch over
 * when it is full. Sending blocks while the transport is full. Once the writer has stopped,
 * for any reason, the transport is disconnected and every send becomes a counted no-op.</p>
 *
 * <p>Lifetime is reference counted; {@link SinkRegistry} retains and releases it.</p>
 */
public final class SharedSink {

    private static final Logger log = LoggerFactory.getLogger(SharedSink.class);

    static final long SEND_RECHECK_MS = 100;

    private final SinkConfig config;
    private final BlockingQueue<Directive> transport;
    private final SinkMetrics metrics = new SinkMetrics();
    private final ThreadLocal<List<LogEntry>> batches;
    private final AtomicInteger references = new AtomicInteger(1);
    private final Thread worker;
    private final Object stopLock = new Object();

    private volatile boolean disconnected;
    private boolean started;
    private boolean stopped;

    SharedSink(SinkConfig config) {
        this(config, true);
    }

    SharedSink(SinkConfig config, boolean startWorker) {
        this.config = config;
        this.transport = new ArrayBlockingQueue<>(config.getTransportCapacity());
        this.batches = ThreadLocal.withInitial(() -> new ArrayList<>(config.getBatchSize()));
        LogWorker logWorker = new LogWorker(config, transport, metrics);
        this.worker = new Thread(() -> {
            try {
                logWorker.run();
            } finally {
                disconnect();
            }
        }, "nexuslog-writer-" + config.getKey());
        this.worker.setDaemon(true);
        if (startWorker) {
            start();
        }
    }

    void start() {
        synchronized (stopLock) {
            if (started || stopped) {
                return;
            }
            started = true;
            worker.start();
        }
        log.info("NexusLog sink started - target: {}, mode: {}, transport capacity: {}",
                config.getKey(), config.getTimestampMode(), config.getTransportCapacity());
    }

    public SinkKey getKey() {
        return config.getKey();
    }

    SinkConfig getConfig() {
        return config;
    }

    public SinkMetrics.Snapshot getMetrics() {
        return metrics.snapshot();
    }

    public boolean isDisconnected() {
        return disconnected;
    }

    public boolean isWorkerAlive() {
        return worker.isAlive();
    }

    int getQueueDepth() {
        return transport.size();
    }

    // ========================================================================
    // Producer side
    // ========================================================================

    /**
     * Append to the calling thread's batch, sending it once it holds {@code batchSize} entries.
     */
    void push(LogEntry entry) {
        if (disconnected) {
            discardThreadBatch(1);
            return;
        }
        List<LogEntry> batch = batches.get();
        batch.add(entry);
        if (batch.size() >= config.getBatchSize()) {
            batches.set(new ArrayList<>(config.getBatchSize()));
            send(Directive.writeBatch(batch));
        }
    }

    /**
     * Send whatever the calling thread has batched so far.
     */
    void flushThreadBatch() {
        if (disconnected) {
            discardThreadBatch(0);
            return;
        }
        List<LogEntry> batch = batches.get();
        if (!batch.isEmpty()) {
            batches.set(new ArrayList<>(config.getBatchSize()));
            send(Directive.writeBatch(batch));
        }
    }

    /**
     * Send the calling thread's partial batch and forget the thread's batch slot. Called when
     * the thread's logger is closed.
     */
    void detachThread() {
        flushThreadBatch();
        batches.remove();
    }

    /**
     * Count the calling thread's pending entries, plus {@code extra}, as dropped and free its slot.
     */
    private void discardThreadBatch(int extra) {
        metrics.dropped(batches.get().size() + extra);
        batches.remove();
    }

    /**
     * Send the calling thread's partial batch followed by a {@code FLUSH}.
     */
    void flush() {
        flushThreadBatch();
        send(Directive.FLUSH);
    }

    /**
     * Blocking put that gives up once the writer is gone, so a stopped sink can never
     * stall the caller.
     */
    void send(Directive directive) {
        if (disconnected) {
            metrics.dropped(directive.entryCount());
            return;
        }
        try {
            while (!transport.offer(directive, SEND_RECHECK_MS, TimeUnit.MILLISECONDS)) {
                if (disconnected) {
                    metrics.dropped(directive.entryCount());
                    return;
                }
            }
            // the writer may have stopped while this send waited for space
            if (disconnected && transport.remove(directive)) {
                metrics.dropped(directive.entryCount());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            metrics.dropped(directive.entryCount());
        }
    }

    // ========================================================================
    // Reference counting
    // ========================================================================

    /**
     * Take another reference unless the count already reached zero.
     */
    boolean tryRetain() {
        while (true) {
            int current = references.get();
            if (current <= 0) {
                return false;
            }
            if (references.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /**
     * Drop one reference.
     *
     * @return true if that was the last one
     */
    boolean release() {
        int remaining = references.decrementAndGet();
        if (remaining < 0) {
            throw new IllegalStateException("Sink " + config.getKey() + " released more often than retained");
        }
        return remaining == 0;
    }

    int referenceCount() {
        return references.get();
    }

    // ========================================================================
    // Shutdown
    // ========================================================================

    /**
     * Send {@code EXIT} and wait for the writer to drain and terminate. Idempotent.
     */
    void stop() {
        synchronized (stopLock) {
            if (stopped) {
                return;
            }
            stopped = true;
            if (!started) {
                disconnect();
                return;
            }
            log.info("NexusLog sink stopping - target: {}, {} directives queued",
                    config.getKey(), transport.size());
            send(Directive.EXIT);
            try {
                worker.join();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for sink {} to drain", config.getKey());
                return;
            }
        }
        log.info("NexusLog sink stopped - target: {}, {}", config.getKey(), metrics.snapshot());
    }

    private void disconnect() {
        disconnected = true;
        List<Directive> abandoned = new ArrayList<>();
        transport.drainTo(abandoned);
        for (Directive directive : abandoned) {
            metrics.dropped(directive.entryCount());
        }
    }
}
