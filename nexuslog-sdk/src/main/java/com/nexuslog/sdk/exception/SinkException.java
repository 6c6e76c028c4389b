package com.nexuslog.sdk.exception;

import java.nio.file.Path;

/**
 * Fatal failure of a sink's output. The worker that raises it stops for good.
 */
public class SinkException extends RuntimeException {

    private final Path path;

    public SinkException(String message) {
        super(message);
        this.path = null;
    }

    public SinkException(String message, Throwable cause) {
        super(message, cause);
        this.path = null;
    }

    public SinkException(String message, Path path, Throwable cause) {
        super(message, cause);
        this.path = path;
    }

    /**
     * File the failure concerns, or {@code null} for console sinks.
     */
    public Path getPath() {
        return path;
    }
}
