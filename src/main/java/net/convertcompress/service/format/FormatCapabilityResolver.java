package net.convertcompress.service.format;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import net.convertcompress.codec.CodecCapabilities;
import net.convertcompress.codec.ImageCodec;
import net.convertcompress.model.image.FormatCapabilities;
import net.convertcompress.model.image.ImageFormat;
import net.convertcompress.model.image.PixelSize;
import net.convertcompress.util.LoggingUtils;
import net.convertcompress.util.PathUtils;
import org.springframework.stereotype.Service;

/**
 * Answers format questions for the pipeline: what can be read and written, which format
 * an export actually uses, which sizes icon-style formats accept, and which extension a
 * format gets on disk.
 *
 * <p>The codec is queried once, on first use, and the result is frozen into an immutable
 * capability table for the lifetime of the process. None of the query methods throw;
 * missing data reads as "unsupported" or "unrestricted".</p>
 */
@Slf4j
@Service
public class FormatCapabilityResolver {

    private static final String FALLBACK_EXTENSION = "img";
    private static final Pattern SIMPLE_EXTENSION = Pattern.compile("[a-z0-9]{1,5}");

    private final ImageCodec codec;
    private volatile Map<ImageFormat, FormatCapabilities> table;

    public FormatCapabilityResolver(ImageCodec codec) {
        this.codec = codec;
    }

    public boolean supportsReading(ImageFormat format) {
        return capabilities(format).readable();
    }

    public boolean supportsWriting(ImageFormat format) {
        return capabilities(format).writable();
    }

    /** Capability row for a format; unknown formats get {@link FormatCapabilities#NONE}. */
    public FormatCapabilities capabilities(ImageFormat format) {
        if (format == null) {
            return FormatCapabilities.NONE;
        }
        return table().getOrDefault(format, FormatCapabilities.NONE);
    }

    public Set<ImageFormat> readableFormats() {
        Set<ImageFormat> readable = new LinkedHashSet<>();
        table().forEach((format, caps) -> {
            if (caps.readable()) {
                readable.add(format);
            }
        });
        return Set.copyOf(readable);
    }

    /**
     * Writable formats, common ones first (JPEG, PNG, HEIC, TIFF, BMP, GIF), the rest by
     * display name.
     */
    public List<ImageFormat> writableFormats() {
        List<ImageFormat> writable = new ArrayList<>();
        table().forEach((format, caps) -> {
            if (caps.writable()) {
                writable.add(format);
            }
        });
        writable.sort(Comparator
            .comparingInt(FormatCapabilityResolver::preferredRank)
            .thenComparing(this::displayName, String.CASE_INSENSITIVE_ORDER));
        return List.copyOf(writable);
    }

    /**
     * Format an export will actually be encoded in. The requested format wins when
     * writable; with no request the source extension decides. Anything unwritable falls
     * back to PNG, then JPEG, then the first writable format. Never fails.
     */
    public ImageFormat resolveActualFormat(ImageFormat requested, Path source) {
        ImageFormat candidate = requested != null
            ? requested
            : formatForPath(source).orElse(ImageFormat.PNG);
        if (supportsWriting(candidate)) {
            return candidate;
        }
        if (supportsWriting(ImageFormat.PNG)) {
            return ImageFormat.PNG;
        }
        if (supportsWriting(ImageFormat.JPEG)) {
            return ImageFormat.JPEG;
        }
        List<ImageFormat> writable = writableFormats();
        if (!writable.isEmpty()) {
            return writable.get(0);
        }
        log.warn("Codec reports no writable formats; defaulting to {}", ImageFormat.JPEG);
        return ImageFormat.JPEG;
    }

    /** Known format for a path's extension, regardless of codec support. */
    public Optional<ImageFormat> formatForPath(Path path) {
        if (path == null) {
            return Optional.empty();
        }
        return FormatCatalog.forExtension(PathUtils.extension(path));
    }

    /** Allowed square sides for icon-style formats; empty when any size is accepted. */
    public Optional<Set<Integer>> sizeRestrictions(ImageFormat format) {
        FormatCapabilities caps = capabilities(format);
        return caps.isSizeRestricted() ? Optional.of(caps.allowedSquareSides()) : Optional.empty();
    }

    public boolean isValidPixelSize(PixelSize size, ImageFormat format) {
        if (size == null || size.isEmpty()) {
            return false;
        }
        Optional<Set<Integer>> restrictions = sizeRestrictions(format);
        if (restrictions.isEmpty()) {
            return true;
        }
        return size.isSquare() && restrictions.get().contains(size.width());
    }

    /**
     * Allowed side nearest to the source's shorter side, ties going to the larger side.
     * Empty for unrestricted formats.
     */
    public OptionalInt suggestedSquareSide(ImageFormat format, PixelSize sourceSize) {
        Optional<Set<Integer>> restrictions = sizeRestrictions(format);
        if (restrictions.isEmpty()) {
            return OptionalInt.empty();
        }
        List<Integer> sides = new ArrayList<>(restrictions.get());
        sides.sort(Comparator.naturalOrder());
        if (sourceSize == null || sourceSize.isEmpty()) {
            return OptionalInt.of(sides.get(sides.size() - 1));
        }
        int reference = sourceSize.minSide();
        int best = sides.get(0);
        for (int side : sides) {
            if (Math.abs(side - reference) <= Math.abs(best - reference)) {
                best = side;
            }
        }
        return OptionalInt.of(best);
    }

    /**
     * Extension written for a format: JPEG is always {@code jpg}; unknown formats use a
     * short MIME subtype, else {@code img}.
     */
    public String preferredExtension(ImageFormat format) {
        if (format == null) {
            return FALLBACK_EXTENSION;
        }
        Optional<FormatDescriptor> descriptor = FormatCatalog.describe(format);
        if (descriptor.isPresent()) {
            return descriptor.get().preferredExtension();
        }
        String subtype = format.subtype().toLowerCase(Locale.ROOT);
        if (subtype.startsWith("x-")) {
            subtype = subtype.substring(2);
        }
        return SIMPLE_EXTENSION.matcher(subtype).matches() ? subtype : FALLBACK_EXTENSION;
    }

    public String displayName(ImageFormat format) {
        if (format == null) {
            return "Unknown";
        }
        return FormatCatalog.describe(format)
            .map(FormatDescriptor::displayName)
            .orElseGet(() -> format.subtype().toUpperCase(Locale.ROOT));
    }

    private static int preferredRank(ImageFormat format) {
        int index = FormatCatalog.PREFERRED_ORDER.indexOf(format);
        return index >= 0 ? index : FormatCatalog.PREFERRED_ORDER.size();
    }

    private Map<ImageFormat, FormatCapabilities> table() {
        Map<ImageFormat, FormatCapabilities> current = table;
        if (current == null) {
            synchronized (this) {
                current = table;
                if (current == null) {
                    current = buildTable(queryCodec());
                    table = current;
                }
            }
        }
        return current;
    }

    private CodecCapabilities queryCodec() {
        try {
            CodecCapabilities reported = codec.queryCapabilities();
            return reported != null ? reported : CodecCapabilities.NONE;
        } catch (RuntimeException e) {
            LoggingUtils.warn(log, e, "Codec capability query failed; treating every format as unsupported");
            return CodecCapabilities.NONE;
        }
    }

    private static Map<ImageFormat, FormatCapabilities> buildTable(CodecCapabilities reported) {
        Map<ImageFormat, FormatCapabilities> built = new HashMap<>();
        for (FormatDescriptor descriptor : FormatCatalog.all()) {
            ImageFormat format = descriptor.format();
            built.put(format, new FormatCapabilities(
                reported.readable().contains(format),
                reported.writable().contains(format),
                descriptor.lossy(),
                descriptor.lossless(),
                descriptor.alpha(),
                descriptor.metadata(),
                descriptor.allowedSquareSides()));
        }
        Set<ImageFormat> uncatalogued = new LinkedHashSet<>(reported.readable());
        uncatalogued.addAll(reported.writable());
        for (ImageFormat format : uncatalogued) {
            built.computeIfAbsent(format, unknown -> new FormatCapabilities(
                reported.readable().contains(unknown),
                reported.writable().contains(unknown),
                false, false, false, false, Set.of()));
        }
        log.debug("Format capability table: {}", built);
        return Map.copyOf(built);
    }
}
