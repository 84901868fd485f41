package net.convertcompress.processing.operation;

import jakarta.annotation.Nullable;
import net.convertcompress.codec.EditableImage;
import net.convertcompress.codec.TransformRequest;
import net.convertcompress.model.image.PixelSize;
import net.convertcompress.processing.ResizeMath;

/**
 * Resize by percentage or to pixel dimensions.
 */
public final class ResizeOperation implements ImageOperation {

    private final ResizeMode mode;
    private final double percent;
    @Nullable
    private final Integer width;
    @Nullable
    private final Integer height;

    private ResizeOperation(ResizeMode mode, double percent, @Nullable Integer width, @Nullable Integer height) {
        this.mode = mode;
        this.percent = percent;
        this.width = width;
        this.height = height;
    }

    /** {@code 0.5} halves both sides; values below 0.01, NaN included, are treated as 0.01. */
    public static ResizeOperation percent(double percent) {
        double clamped = Double.isNaN(percent) ? ResizeMath.MIN_SCALE : Math.max(percent, ResizeMath.MIN_SCALE);
        return new ResizeOperation(ResizeMode.PERCENT, clamped, null, null);
    }

    /** At least one side must be given; a single side keeps the aspect ratio. */
    public static ResizeOperation pixels(@Nullable Integer width, @Nullable Integer height) {
        boolean hasWidth = width != null && width > 0;
        boolean hasHeight = height != null && height > 0;
        if (!hasWidth && !hasHeight) {
            throw new IllegalArgumentException("Pixel resize needs a width or a height");
        }
        return new ResizeOperation(ResizeMode.PIXELS, 1.0, hasWidth ? width : null, hasHeight ? height : null);
    }

    public ResizeMode mode() {
        return mode;
    }

    /** Target for an image of the given size. */
    public PixelSize targetSize(PixelSize current) {
        return mode == ResizeMode.PERCENT
            ? ResizeMath.percent(current, percent, false)
            : ResizeMath.pixels(current, width, height, false);
    }

    @Override
    public EditableImage apply(EditableImage image, OperationContext context) {
        PixelSize target = targetSize(image.pixelSize());
        if (target.equals(image.pixelSize())) {
            return image;
        }
        return context.codec().transform(image, new TransformRequest.Scale(target));
    }

    @Override
    public String name() {
        return mode == ResizeMode.PERCENT
            ? "Resize(" + percent + ")"
            : "Resize(" + (width == null ? "auto" : width) + "x" + (height == null ? "auto" : height) + ")";
    }

    public enum ResizeMode {
        PERCENT,
        PIXELS
    }
}
