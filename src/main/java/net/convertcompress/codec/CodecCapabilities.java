package net.convertcompress.codec;

import java.util.Set;
import net.convertcompress.model.image.ImageFormat;

/**
 * Formats a codec can decode and encode.
 */
public record CodecCapabilities(Set<ImageFormat> readable, Set<ImageFormat> writable) {

    public static final CodecCapabilities NONE = new CodecCapabilities(Set.of(), Set.of());

    public CodecCapabilities {
        readable = readable == null ? Set.of() : Set.copyOf(readable);
        writable = writable == null ? Set.of() : Set.copyOf(writable);
    }
}
