package net.convertcompress.support.sandbox;

import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Grant to read or write one path, released exactly once on {@link #close()}.
 * Use with try-with-resources so every exit path releases it.
 */
public final class ScopedAccessToken implements AutoCloseable {

    private final Path path;
    private final SandboxAccessManager owner;
    private final AtomicBoolean released = new AtomicBoolean(false);

    ScopedAccessToken(Path path, SandboxAccessManager owner) {
        this.path = path;
        this.owner = owner;
    }

    public Path path() {
        return path;
    }

    public boolean isReleased() {
        return released.get();
    }

    @Override
    public void close() {
        if (released.compareAndSet(false, true)) {
            owner.release(path);
        }
    }
}
