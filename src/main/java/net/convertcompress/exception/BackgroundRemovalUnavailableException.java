package net.convertcompress.exception;

/**
 * The codec has no background removal capability.
 * RETRYABLE: No (capability is fixed for the process lifetime)
 */
public class BackgroundRemovalUnavailableException extends ImageTransformException {

    public BackgroundRemovalUnavailableException(String detail) {
        super("RemoveBackground", "Background removal unavailable: " + detail,
              ProcessingFailure.BACKGROUND_REMOVAL_UNAVAILABLE, null);
    }
}
