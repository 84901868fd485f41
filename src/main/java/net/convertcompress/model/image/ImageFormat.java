package net.convertcompress.model.image;

import java.util.Locale;
import java.util.Map;

/**
 * An image format, identified by its MIME type.
 *
 * <p>Only the identifier is stored; display names, extensions and capabilities are
 * derived from {@link net.convertcompress.service.format.FormatCapabilityResolver}.
 * Unknown identifiers are legal and simply resolve to "no capabilities".</p>
 *
 * @param identifier normalized, lower-case MIME type such as {@code image/jpeg}
 */
public record ImageFormat(String identifier) {

    public static final ImageFormat JPEG = new ImageFormat("image/jpeg");
    public static final ImageFormat PNG = new ImageFormat("image/png");
    public static final ImageFormat GIF = new ImageFormat("image/gif");
    public static final ImageFormat BMP = new ImageFormat("image/bmp");
    public static final ImageFormat TIFF = new ImageFormat("image/tiff");
    public static final ImageFormat WBMP = new ImageFormat("image/vnd.wap.wbmp");
    public static final ImageFormat WEBP = new ImageFormat("image/webp");
    public static final ImageFormat HEIC = new ImageFormat("image/heic");
    public static final ImageFormat ICO = new ImageFormat("image/x-icon");
    public static final ImageFormat ICNS = new ImageFormat("image/icns");

    private static final Map<String, String> ALIASES = Map.ofEntries(
        Map.entry("image/jpg", JPEG.identifier),
        Map.entry("image/pjpeg", JPEG.identifier),
        Map.entry("image/x-png", PNG.identifier),
        Map.entry("image/x-bmp", BMP.identifier),
        Map.entry("image/x-ms-bmp", BMP.identifier),
        Map.entry("image/x-windows-bmp", BMP.identifier),
        Map.entry("image/tif", TIFF.identifier),
        Map.entry("image/x-tiff", TIFF.identifier),
        Map.entry("image/vnd.microsoft.icon", ICO.identifier),
        Map.entry("image/ico", ICO.identifier),
        Map.entry("image/x-icns", ICNS.identifier),
        Map.entry("image/heif", HEIC.identifier),
        Map.entry("image/x-webp", WEBP.identifier)
    );

    public ImageFormat {
        if (identifier == null || identifier.isBlank()) {
            throw new IllegalArgumentException("Format identifier must not be blank");
        }
    }

    /**
     * Builds a format from a raw MIME type, folding known aliases onto one identifier.
     */
    public static ImageFormat of(String rawIdentifier) {
        if (rawIdentifier == null || rawIdentifier.isBlank()) {
            throw new IllegalArgumentException("Format identifier must not be blank");
        }
        String normalized = rawIdentifier.split(";")[0].trim().toLowerCase(Locale.ROOT);
        return new ImageFormat(ALIASES.getOrDefault(normalized, normalized));
    }

    /**
     * Returns the MIME subtype, e.g. {@code jpeg} for {@code image/jpeg}.
     */
    public String subtype() {
        int slash = identifier.lastIndexOf('/');
        return slash >= 0 ? identifier.substring(slash + 1) : identifier;
    }

    @Override
    public String toString() {
        return identifier;
    }
}
