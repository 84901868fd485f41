package net.convertcompress.codec;

import java.awt.image.BufferedImage;
import net.convertcompress.model.image.ImageMetadata;
import net.convertcompress.model.image.PixelSize;

/**
 * {@link EditableImage} backed by an AWT raster, produced by {@link ImageIoCodec}.
 */
record BufferedEditableImage(BufferedImage image, ImageMetadata metadata) implements EditableImage {

    @Override
    public PixelSize pixelSize() {
        return new PixelSize(image.getWidth(), image.getHeight());
    }

    BufferedEditableImage withImage(BufferedImage replacement) {
        return new BufferedEditableImage(replacement, metadata);
    }
}
