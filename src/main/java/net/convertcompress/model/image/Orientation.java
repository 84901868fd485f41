package net.convertcompress.model.image;

/**
 * EXIF/TIFF orientation tag values.
 *
 * <p>{@link #UP} is the only value ever written to encoded output.</p>
 */
public enum Orientation {
    UP(1),
    UP_MIRRORED(2),
    DOWN(3),
    DOWN_MIRRORED(4),
    LEFT_MIRRORED(5),
    RIGHT(6),
    RIGHT_MIRRORED(7),
    LEFT(8);

    private final int exifValue;

    Orientation(int exifValue) {
        this.exifValue = exifValue;
    }

    public int exifValue() {
        return exifValue;
    }

    /**
     * Maps a raw tag value, treating anything out of range as upright.
     */
    public static Orientation fromExifValue(int value) {
        for (Orientation orientation : values()) {
            if (orientation.exifValue == value) {
                return orientation;
            }
        }
        return UP;
    }

    /** Whether width and height swap once the orientation is applied. */
    public boolean swapsDimensions() {
        return exifValue >= LEFT_MIRRORED.exifValue;
    }
}
