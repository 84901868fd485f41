package net.convertcompress.exception;

import jakarta.annotation.Nullable;
import java.nio.file.Path;

/**
 * Base exception for failures while loading, transforming or exporting one image.
 * Subclasses identify the failing stage so the per-asset worker boundary can log and
 * count them without inspecting messages.
 */
public abstract class ImageProcessingException extends RuntimeException {

    @Nullable
    private final Path path;
    private final ProcessingFailure failure;

    protected ImageProcessingException(String message, @Nullable Path path,
                                       ProcessingFailure failure, @Nullable Throwable cause) {
        super(message, cause);
        this.path = path;
        this.failure = failure;
    }

    /** Path the failing stage was working on, when one is known. */
    @Nullable
    public Path getPath() {
        return path;
    }

    public ProcessingFailure getFailure() {
        return failure;
    }
}
