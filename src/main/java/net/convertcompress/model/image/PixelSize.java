package net.convertcompress.model.image;

/**
 * Width and height of an image in pixels.
 *
 * @param width horizontal pixel count, never negative
 * @param height vertical pixel count, never negative
 */
public record PixelSize(int width, int height) {

    public static final PixelSize ZERO = new PixelSize(0, 0);

    public PixelSize {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("Pixel dimensions must be non-negative: " + width + "x" + height);
        }
    }

    public static PixelSize square(int side) {
        return new PixelSize(side, side);
    }

    public boolean isSquare() {
        return width == height;
    }

    public boolean isEmpty() {
        return width == 0 || height == 0;
    }

    public int minSide() {
        return Math.min(width, height);
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
