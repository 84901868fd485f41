package net.convertcompress.exception;

import java.nio.file.Path;

/**
 * Encoding failed or the encoded bytes could not be committed to the destination.
 * RETRYABLE: Maybe (a full disk or a locked file may clear up)
 */
public class ImageExportException extends ImageProcessingException {

    public ImageExportException(Path path, String detail) {
        this(path, detail, null);
    }

    public ImageExportException(Path path, String detail, Throwable cause) {
        super(path == null ? "Failed to export image: " + detail : "Failed to export image " + path + ": " + detail,
              path, ProcessingFailure.EXPORT_FAILED, cause);
    }
}
