package net.convertcompress.processing;

import net.convertcompress.model.image.ImageFormat;
import net.convertcompress.model.image.PixelSize;

/**
 * Output of one pipeline run: encoded bytes and the format actually used.
 */
public record EncodedImage(byte[] data, ImageFormat format, PixelSize pixelSize) {

    public long sizeInBytes() {
        return data.length;
    }
}
