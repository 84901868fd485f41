package net.convertcompress.model.image;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Source metadata carried alongside a decoded image.
 *
 * @param entries textual metadata entries keyed by name, in source order
 * @param orientation orientation recorded in the source file
 * @param exif raw EXIF block ({@code Exif\0\0} header plus TIFF structure) from a JPEG
 *             source, or null
 */
public record ImageMetadata(Map<String, String> entries, Orientation orientation, byte[] exif) {

    public static final String ORIENTATION_KEY = "Orientation";

    public ImageMetadata {
        entries = entries == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(entries));
        orientation = orientation == null ? Orientation.UP : orientation;
        exif = exif == null || exif.length == 0 ? null : exif.clone();
    }

    public ImageMetadata(Map<String, String> entries, Orientation orientation) {
        this(entries, orientation, null);
    }

    public static ImageMetadata empty() {
        return new ImageMetadata(Map.of(), Orientation.UP, null);
    }

    /**
     * Metadata to write for an encode. Stripping yields no metadata at all. Otherwise the
     * source entries and EXIF block are kept and orientation is forced upright, since
     * pixels were normalized at decode time; codecs writing the EXIF block reset its
     * orientation tag to match.
     */
    public ImageMetadata forOutput(boolean stripMetadata) {
        if (stripMetadata) {
            return empty();
        }
        Map<String, String> output = new LinkedHashMap<>(entries);
        output.put(ORIENTATION_KEY, String.valueOf(Orientation.UP.exifValue()));
        return new ImageMetadata(output, Orientation.UP, exif);
    }

    @Override
    public byte[] exif() {
        return exif == null ? null : exif.clone();
    }

    public boolean hasExif() {
        return exif != null;
    }

    public boolean isEmpty() {
        return entries.isEmpty() && orientation == Orientation.UP && exif == null;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof ImageMetadata that)) {
            return false;
        }
        return entries.equals(that.entries) && orientation == that.orientation && Arrays.equals(exif, that.exif);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entries, orientation) * 31 + Arrays.hashCode(exif);
    }

    @Override
    public String toString() {
        return "ImageMetadata[entries=" + entries + ", orientation=" + orientation
            + ", exif=" + (exif == null ? "none" : exif.length + " bytes") + "]";
    }
}
