package net.convertcompress.exception;

import java.nio.file.Path;

/**
 * One operation of the chain could not be applied.
 * RETRYABLE: No
 */
public class ImageTransformException extends ImageProcessingException {

    private final String operation;

    public ImageTransformException(String operation, String detail) {
        this(operation, detail, null);
    }

    public ImageTransformException(String operation, String detail, Throwable cause) {
        this(operation, "Failed to apply " + operation + ": " + detail, ProcessingFailure.TRANSFORM_FAILED, cause);
    }

    protected ImageTransformException(String operation, String message, ProcessingFailure failure, Throwable cause) {
        super(message, (Path) null, failure, cause);
        this.operation = operation;
    }

    public String getOperation() {
        return operation;
    }
}
