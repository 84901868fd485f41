package net.convertcompress.exception;

import java.nio.file.Path;

/**
 * A scoped access token could not be obtained for the path.
 * RETRYABLE: No (the user has to grant access first)
 */
public class PermissionDeniedException extends ImageProcessingException {

    public PermissionDeniedException(Path path) {
        super("Access denied for " + path, path, ProcessingFailure.PERMISSION_DENIED, null);
    }
}
