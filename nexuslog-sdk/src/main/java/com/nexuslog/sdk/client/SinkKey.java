package com.nexuslog.sdk.client;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Identity of a physical sink: an absolute, normalized file path, or standard output.
 * Loggers whose keys are equal share one writer thread and one open file.
 */
public final class SinkKey {

    public static final SinkKey CONSOLE = new SinkKey(null);

    private final Path path;

    private SinkKey(Path path) {
        this.path = path;
    }

    public static SinkKey forPath(Path path) {
        Objects.requireNonNull(path, "path");
        return new SinkKey(path.toAbsolutePath().normalize());
    }

    public boolean isConsole() {
        return path == null;
    }

    /**
     * Resolved file template, or {@code null} for {@link #CONSOLE}.
     */
    public Path getPath() {
        return path;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(path, ((SinkKey) o).path);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(path);
    }

    @Override
    public String toString() {
        return isConsole() ? "stdout" : path.toString();
    }
}
