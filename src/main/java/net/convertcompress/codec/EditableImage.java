package net.convertcompress.codec;

import net.convertcompress.model.image.ImageMetadata;
import net.convertcompress.model.image.PixelSize;

/**
 * A decoded, upright image held in memory by an {@link ImageCodec}.
 *
 * <p>Instances are opaque to the pipeline; only the codec that produced them can
 * transform or encode them.</p>
 */
public interface EditableImage {

    PixelSize pixelSize();

    /** Metadata read from the source at decode time. */
    ImageMetadata metadata();
}
