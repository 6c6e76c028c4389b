package com.nexuslog.sdk.client;

import com.nexuslog.sdk.exception.SinkException;
import com.nexuslog.sdk.format.LineFormatter;
import com.nexuslog.sdk.format.RotatedFileNames;
import com.nexuslog.sdk.model.LogEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.LocalDate;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Single consumer of a sink's transport: formats entries, rotates files by local date, and
 * flushes at least once a second while anything is buffered.
 *
 * <p>Runs until it takes an {@code EXIT} directive, then flushes, closes its file and stops.
 * Any I/O failure is fatal for the sink: it is logged once and the worker stops without
 * retrying.</p>
 */
final class LogWorker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(LogWorker.class);

    static final long POLL_TIMEOUT_MS = 1_000;
    static final long FLUSH_INTERVAL_NANOS = TimeUnit.SECONDS.toNanos(1);
    static final int OUTPUT_BUFFER_BYTES = 1024 * 1024;

    private final SinkConfig config;
    private final BlockingQueue<Directive> transport;
    private final SinkMetrics metrics;
    private final LineFormatter formatter;

    private OutputStream output;
    private Path currentPath;
    private LocalDate currentDate;
    private long lastFlushNanos;

    LogWorker(SinkConfig config, BlockingQueue<Directive> transport, SinkMetrics metrics) {
        this.config = config;
        this.transport = transport;
        this.metrics = metrics;
        this.formatter = new LineFormatter(config.getTimestampMode(), config.getZone());
    }

    @Override
    public void run() {
        log.debug("Sink writer started: {}", config.getKey());
        try {
            runLoop();
            flushOutput();
            log.debug("Sink writer stopped: {}", config.getKey());
        } catch (SinkException e) {
            log.error("Sink {} failed, further entries will be discarded", config.getKey(), e);
        } catch (RuntimeException e) {
            log.error("Unexpected error in sink writer {}", config.getKey(), e);
        } finally {
            closeOutput();
        }
    }

    private void runLoop() {
        lastFlushNanos = System.nanoTime();
        boolean running = true;
        while (running) {
            Directive directive;
            try {
                directive = transport.poll(POLL_TIMEOUT_MS, TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.debug("Sink writer interrupted: {}", config.getKey());
                return;
            }

            if (directive != null) {
                switch (directive.getKind()) {
                    case WRITE_BATCH:
                        metrics.batchReceived();
                        writeBatch(directive.getBatch());
                        break;
                    case FLUSH:
                        flushOutput();
                        break;
                    case EXIT:
                        running = false;
                        break;
                    default:
                        throw new IllegalStateException("Unknown directive: " + directive.getKind());
                }
            }

            if (running && System.nanoTime() - lastFlushNanos >= FLUSH_INTERVAL_NANOS) {
                flushOutput();
            }
        }
    }

    private void writeBatch(List<LogEntry> batch) {
        for (LogEntry entry : batch) {
            writeEntry(entry);
        }
    }

    private void writeEntry(LogEntry entry) {
        if (config.getKey().isConsole()) {
            if (output == null) {
                output = new BufferedOutputStream(config.getConsole(), OUTPUT_BUFFER_BYTES);
            }
        } else {
            LocalDate date = formatter.dateOf(entry.getTimestamp());
            if (!date.equals(currentDate)) {
                rotate(date);
            }
        }

        try {
            formatter.format(entry, output);
        } catch (IOException e) {
            throw new SinkException("Failed to write log entry", currentPath, e);
        }
        metrics.entryWritten();
    }

    private void rotate(LocalDate date) {
        Path next = RotatedFileNames.forDate(config.getKey().getPath().toString(), date);
        closeFile();
        try {
            Path parent = next.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            output = new BufferedOutputStream(
                    Files.newOutputStream(next, StandardOpenOption.CREATE,
                            StandardOpenOption.APPEND, StandardOpenOption.WRITE),
                    OUTPUT_BUFFER_BYTES);
        } catch (IOException e) {
            throw new SinkException("Failed to open log file: " + next, next, e);
        }
        currentPath = next;
        currentDate = date;
        metrics.rotated();
        log.debug("Sink {} now writing to {}", config.getKey(), next);
    }

    private void flushOutput() {
        lastFlushNanos = System.nanoTime();
        if (output == null) {
            return;
        }
        try {
            output.flush();
        } catch (IOException e) {
            throw new SinkException("Failed to flush log output", currentPath, e);
        }
        metrics.flushed();
    }

    private void closeFile() {
        if (output == null) {
            return;
        }
        OutputStream previous = output;
        output = null;
        try {
            previous.close();
        } catch (IOException e) {
            throw new SinkException("Failed to close log file: " + currentPath, currentPath, e);
        }
    }

    /**
     * Releases whatever the worker holds on the way out. Console streams are flushed, never
     * closed; failures here are reported but no longer fatal.
     */
    private void closeOutput() {
        if (output == null) {
            return;
        }
        try {
            if (config.getKey().isConsole()) {
                output.flush();
            } else {
                output.close();
            }
        } catch (IOException e) {
            log.warn("Failed to release output for sink {}: {}", config.getKey(), e.getMessage());
        } finally {
            output = null;
        }
    }
}
