package net.convertcompress.service.format;

import java.util.List;
import java.util.Set;
import net.convertcompress.model.image.ImageFormat;

/**
 * Static facts about a known format, independent of what the codec can do.
 *
 * @param format the format
 * @param displayName user-facing name
 * @param extensions known file extensions, preferred first
 * @param lossy encoding honours a quality setting
 * @param lossless encoding preserves pixels exactly
 * @param alpha the format stores transparency
 * @param metadata metadata entries survive encoding
 * @param allowedSquareSides fixed square sides, empty when unrestricted
 */
record FormatDescriptor(
    ImageFormat format,
    String displayName,
    List<String> extensions,
    boolean lossy,
    boolean lossless,
    boolean alpha,
    boolean metadata,
    Set<Integer> allowedSquareSides
) {

    String preferredExtension() {
        return extensions.get(0);
    }
}
