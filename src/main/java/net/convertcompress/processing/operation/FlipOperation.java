package net.convertcompress.processing.operation;

import net.convertcompress.codec.EditableImage;
import net.convertcompress.codec.TransformRequest;
import net.convertcompress.model.image.FlipAxis;

public final class FlipOperation implements ImageOperation {

    private final FlipAxis axis;

    public FlipOperation(FlipAxis axis) {
        if (axis == null) {
            throw new IllegalArgumentException("Flip axis is required");
        }
        this.axis = axis;
    }

    public FlipAxis axis() {
        return axis;
    }

    @Override
    public EditableImage apply(EditableImage image, OperationContext context) {
        return context.codec().transform(image, new TransformRequest.Flip(axis));
    }

    @Override
    public String name() {
        return "Flip(" + axis + ")";
    }

    @Override
    public boolean affectsOutputSize() {
        return false;
    }
}
