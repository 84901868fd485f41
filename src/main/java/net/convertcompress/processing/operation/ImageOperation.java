package net.convertcompress.processing.operation;

import net.convertcompress.codec.EditableImage;

/**
 * One stateless transform step. Instances are shared read-only across concurrent
 * pipelines, so implementations must not hold mutable state.
 */
public interface ImageOperation {

    /**
     * @throws net.convertcompress.exception.ImageTransformException when the step cannot be applied
     */
    EditableImage apply(EditableImage image, OperationContext context);

    /** Name used in logs and transform errors. */
    String name();

    /** Whether the step can change the encoded byte size; flips cannot. */
    default boolean affectsOutputSize() {
        return true;
    }
}
