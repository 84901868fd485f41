package net.convertcompress.codec;

import java.nio.file.Path;
import net.convertcompress.exception.ImageExportException;
import net.convertcompress.exception.ImageLoadException;
import net.convertcompress.exception.ImageTransformException;
import net.convertcompress.model.image.PixelSize;

/**
 * Pixel-level collaborator behind the processing engine: decoding, primitive transforms,
 * encoding and capability reporting. Implementations must be safe for concurrent use by
 * independent pipelines.
 */
public interface ImageCodec {

    /**
     * Decodes a source file, applying any stored orientation so the pixels come back upright.
     *
     * @throws ImageLoadException when the file cannot be read or decoded
     */
    EditableImage decode(Path source);

    /**
     * Applies one primitive transform and returns the resulting image.
     *
     * @throws ImageTransformException when the transform cannot be applied, including
     *         {@link net.convertcompress.exception.BackgroundRemovalUnavailableException}
     */
    EditableImage transform(EditableImage image, TransformRequest request);

    /**
     * Encodes an image to bytes in the requested format.
     *
     * @throws ImageExportException when encoding fails
     */
    byte[] encode(EditableImage image, EncodeRequest request);

    /** Formats this codec can read and write. Must not throw. */
    CodecCapabilities queryCapabilities();

    /**
     * Upright pixel size of a source. Codecs that can read headers without decoding
     * should override this.
     */
    default PixelSize readPixelSize(Path source) {
        return decode(source).pixelSize();
    }
}
