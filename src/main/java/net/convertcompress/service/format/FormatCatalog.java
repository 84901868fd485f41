package net.convertcompress.service.format;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import net.convertcompress.model.image.ImageFormat;

/**
 * Known formats and their static attributes.
 */
final class FormatCatalog {

    static final Set<Integer> ICO_SIDES = Set.of(16, 24, 32, 48, 64, 128, 256);
    static final Set<Integer> ICNS_SIDES = Set.of(16, 32, 64, 128, 256, 512, 1024);

    /** Writable formats listed first, in this order, before the rest sorted by name. */
    static final List<ImageFormat> PREFERRED_ORDER = List.of(
        ImageFormat.JPEG, ImageFormat.PNG, ImageFormat.HEIC, ImageFormat.TIFF, ImageFormat.BMP, ImageFormat.GIF);

    private static final List<FormatDescriptor> DESCRIPTORS = List.of(
        new FormatDescriptor(ImageFormat.JPEG, "JPEG", List.of("jpg", "jpeg", "jpe"), true, false, false, true, Set.of()),
        new FormatDescriptor(ImageFormat.PNG, "PNG", List.of("png"), false, true, true, true, Set.of()),
        new FormatDescriptor(ImageFormat.GIF, "GIF", List.of("gif"), false, true, true, false, Set.of()),
        new FormatDescriptor(ImageFormat.BMP, "BMP", List.of("bmp", "dib"), false, true, false, false, Set.of()),
        new FormatDescriptor(ImageFormat.TIFF, "TIFF", List.of("tiff", "tif"), false, true, true, true, Set.of()),
        new FormatDescriptor(ImageFormat.WBMP, "WBMP", List.of("wbmp"), false, true, false, false, Set.of()),
        new FormatDescriptor(ImageFormat.WEBP, "WebP", List.of("webp"), true, false, true, true, Set.of()),
        new FormatDescriptor(ImageFormat.HEIC, "HEIC", List.of("heic", "heif"), true, false, true, true, Set.of()),
        new FormatDescriptor(ImageFormat.ICO, "ICO", List.of("ico"), false, true, true, false, ICO_SIDES),
        new FormatDescriptor(ImageFormat.ICNS, "ICNS", List.of("icns"), false, true, true, false, ICNS_SIDES)
    );

    private static final Map<ImageFormat, FormatDescriptor> BY_FORMAT = DESCRIPTORS.stream()
        .collect(Collectors.toUnmodifiableMap(FormatDescriptor::format, Function.identity()));

    private static final Map<String, ImageFormat> BY_EXTENSION = DESCRIPTORS.stream()
        .flatMap(descriptor -> descriptor.extensions().stream().map(ext -> Map.entry(ext, descriptor.format())))
        .collect(Collectors.toUnmodifiableMap(Map.Entry::getKey, Map.Entry::getValue));

    private FormatCatalog() {
    }

    static List<FormatDescriptor> all() {
        return DESCRIPTORS;
    }

    static Optional<FormatDescriptor> describe(ImageFormat format) {
        return Optional.ofNullable(format == null ? null : BY_FORMAT.get(format));
    }

    static Optional<ImageFormat> forExtension(String extension) {
        if (extension == null || extension.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_EXTENSION.get(extension.toLowerCase(Locale.ROOT)));
    }
}
