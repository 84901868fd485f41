package net.convertcompress.codec;

import jakarta.annotation.Nullable;
import net.convertcompress.model.image.ImageFormat;
import net.convertcompress.model.image.ImageMetadata;

/**
 * Everything a codec needs to encode one image.
 *
 * @param format resolved, writable output format
 * @param quality clamped quality in {@code [0.01, 1.0]}, or null for the format default
 * @param stripMetadata whether source metadata was dropped
 * @param metadata metadata to write; already filtered for {@code stripMetadata} with orientation upright
 */
public record EncodeRequest(
    ImageFormat format,
    @Nullable Double quality,
    boolean stripMetadata,
    ImageMetadata metadata
) {

    public EncodeRequest {
        if (format == null) {
            throw new IllegalArgumentException("Encode format is required");
        }
        metadata = metadata == null ? ImageMetadata.empty() : metadata;
    }
}
