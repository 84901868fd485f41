package net.convertcompress.processing.operation;

import java.util.OptionalInt;
import net.convertcompress.codec.EditableImage;
import net.convertcompress.codec.TransformRequest;
import net.convertcompress.model.image.ImageFormat;
import net.convertcompress.model.image.PixelSize;

/**
 * Forces the image onto an allowed square size for icon-style formats. A no-op when the
 * format is unrestricted or the image already has a valid size.
 */
public final class ConstrainToFormatSizeOperation implements ImageOperation {

    private final ImageFormat format;

    public ConstrainToFormatSizeOperation(ImageFormat format) {
        if (format == null) {
            throw new IllegalArgumentException("Constrain operation needs a target format");
        }
        this.format = format;
    }

    public ImageFormat format() {
        return format;
    }

    @Override
    public EditableImage apply(EditableImage image, OperationContext context) {
        PixelSize current = image.pixelSize();
        if (context.formats().isValidPixelSize(current, format)) {
            return image;
        }
        OptionalInt side = context.formats().suggestedSquareSide(format, current);
        if (side.isEmpty()) {
            return image;
        }
        return context.codec().transform(image, new TransformRequest.Scale(PixelSize.square(side.getAsInt())));
    }

    @Override
    public String name() {
        return "ConstrainToFormatSize(" + format + ")";
    }
}
