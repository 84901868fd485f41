package net.convertcompress.processing.operation;

import net.convertcompress.codec.EditableImage;
import net.convertcompress.codec.TransformRequest;

/**
 * Masks out the background. Fails with
 * {@link net.convertcompress.exception.BackgroundRemovalUnavailableException} when the
 * codec lacks the capability.
 */
public final class RemoveBackgroundOperation implements ImageOperation {

    @Override
    public EditableImage apply(EditableImage image, OperationContext context) {
        return context.codec().transform(image, new TransformRequest.RemoveBackground());
    }

    @Override
    public String name() {
        return "RemoveBackground";
    }
}
