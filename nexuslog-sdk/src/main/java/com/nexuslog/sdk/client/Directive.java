package com.nexuslog.sdk.client;

import com.nexuslog.sdk.model.LogEntry;

import java.util.List;
import java.util.Objects;

/**
 * Message carried by a sink's transport. Data and control share the one queue, so a
 * {@code FLUSH} or {@code EXIT} is seen only after everything its sender queued before it.
 */
final class Directive {

    enum Kind {
        WRITE_BATCH,
        FLUSH,
        EXIT
    }

    static final Directive FLUSH = new Directive(Kind.FLUSH, List.of());
    static final Directive EXIT = new Directive(Kind.EXIT, List.of());

    private final Kind kind;
    private final List<LogEntry> batch;

    private Directive(Kind kind, List<LogEntry> batch) {
        this.kind = kind;
        this.batch = batch;
    }

    static Directive writeBatch(List<LogEntry> batch) {
        return new Directive(Kind.WRITE_BATCH, Objects.requireNonNull(batch, "batch"));
    }

    Kind getKind() {
        return kind;
    }

    /**
     * Entries of a {@code WRITE_BATCH}; empty for control directives.
     */
    List<LogEntry> getBatch() {
        return batch;
    }

    int entryCount() {
        return batch.size();
    }
}
