package net.convertcompress.exception;

import java.nio.file.Path;

/**
 * Source could not be read or decoded.
 * RETRYABLE: No (the same file will fail again until it changes)
 */
public class ImageLoadException extends ImageProcessingException {

    public ImageLoadException(Path path, String detail) {
        this(path, detail, null);
    }

    public ImageLoadException(Path path, String detail, Throwable cause) {
        super("Failed to load image " + path + ": " + detail, path, ProcessingFailure.LOAD_FAILED, cause);
    }
}
