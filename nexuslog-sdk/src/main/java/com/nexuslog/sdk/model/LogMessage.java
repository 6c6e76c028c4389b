package com.nexuslog.sdk.model;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.CharBuffer;
import java.nio.charset.CharsetEncoder;
import java.nio.charset.CoderResult;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * Rendered text of one log record.
 *
 * <p>Messages whose UTF-8 encoding fits the inline capacity are encoded once into the calling
 * thread's scratch buffer and kept as bytes, so the worker writes them without re-encoding.
 * Anything larger, or anything that is not well-formed UTF-16, keeps the {@code String} as
 * given, in full. {@link #asString()} always returns the caller's text and no content is ever
 * truncated. Unpaired surrogates are written as {@code ?}.</p>
 */
public abstract class LogMessage {

    public static final int DEFAULT_INLINE_CAPACITY = 256;

    private static final ThreadLocal<Scratch> SCRATCH = ThreadLocal.withInitial(Scratch::new);

    LogMessage() {
    }

    /**
     * Build a message, choosing the inline form when {@code text} is well-formed and encodes
     * to at most {@code inlineCapacity} bytes.
     */
    public static LogMessage of(String text, int inlineCapacity) {
        Objects.requireNonNull(text, "text");
        if (inlineCapacity < 1) {
            throw new IllegalArgumentException("inlineCapacity must be >= 1, got: " + inlineCapacity);
        }
        // every UTF-16 unit encodes to at least one byte
        if (text.length() > inlineCapacity) {
            return new Heap(text);
        }
        byte[] encoded = SCRATCH.get().encode(text, inlineCapacity);
        return encoded != null ? new Inline(encoded) : new Heap(text);
    }

    public static LogMessage of(String text) {
        return of(text, DEFAULT_INLINE_CAPACITY);
    }

    public abstract boolean isInline();

    public abstract String asString();

    public abstract int utf8Length();

    public abstract void writeTo(OutputStream out) throws IOException;

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogMessage)) return false;
        return asString().equals(((LogMessage) o).asString());
    }

    @Override
    public int hashCode() {
        return asString().hashCode();
    }

    @Override
    public String toString() {
        return asString();
    }

    private static final class Inline extends LogMessage {
        private final byte[] utf8;

        Inline(byte[] utf8) {
            this.utf8 = utf8;
        }

        @Override
        public boolean isInline() {
            return true;
        }

        @Override
        public String asString() {
            return new String(utf8, StandardCharsets.UTF_8);
        }

        @Override
        public int utf8Length() {
            return utf8.length;
        }

        @Override
        public void writeTo(OutputStream out) throws IOException {
            out.write(utf8);
        }
    }

    private static final class Heap extends LogMessage {
        private final String text;

        Heap(String text) {
            this.text = text;
        }

        @Override
        public boolean isInline() {
            return false;
        }

        @Override
        public String asString() {
            return text;
        }

        @Override
        public int utf8Length() {
            return text.getBytes(StandardCharsets.UTF_8).length;
        }

        @Override
        public void writeTo(OutputStream out) throws IOException {
            out.write(text.getBytes(StandardCharsets.UTF_8));
        }
    }

    /**
     * Per-thread fixed buffer the inline form is rendered into.
     */
    private static final class Scratch {
        private final CharsetEncoder encoder = StandardCharsets.UTF_8.newEncoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT);
        private ByteBuffer buffer = ByteBuffer.allocate(DEFAULT_INLINE_CAPACITY);

        /**
         * @return the encoded bytes, or {@code null} if they do not fit or the text is malformed
         */
        byte[] encode(String text, int capacity) {
            if (buffer.capacity() != capacity) {
                buffer = ByteBuffer.allocate(capacity);
            }
            buffer.clear();
            encoder.reset();
            CoderResult result = encoder.encode(CharBuffer.wrap(text), buffer, true);
            if (result.isOverflow() || result.isError()) {
                return null;
            }
            if (encoder.flush(buffer).isOverflow()) {
                return null;
            }
            return Arrays.copyOf(buffer.array(), buffer.position());
        }
    }
}
