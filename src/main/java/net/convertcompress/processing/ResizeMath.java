package net.convertcompress.processing;

import jakarta.annotation.Nullable;
import net.convertcompress.model.image.PixelSize;

/**
 * Target-size arithmetic shared by the resize operation, estimation and thumbnails.
 * Every result is at least 1x1.
 */
public final class ResizeMath {

    public static final double MIN_SCALE = 0.01;

    private ResizeMath() {
    }

    /**
     * Scales both sides by {@code percent} (1.0 keeps the size), never below {@link #MIN_SCALE}.
     *
     * @param noUpscale cap the factor at 1.0
     */
    public static PixelSize percent(PixelSize source, double percent, boolean noUpscale) {
        double scale = Math.max(percent, MIN_SCALE);
        if (noUpscale) {
            scale = Math.min(scale, 1.0);
        }
        return new PixelSize(scaled(source.width(), scale), scaled(source.height(), scale));
    }

    /**
     * Pixel-mode target. One given side keeps the aspect ratio; both given are used as is;
     * none keeps the source size.
     *
     * @param noUpscale shrink the target proportionally so it never exceeds the source
     */
    public static PixelSize pixels(PixelSize source, @Nullable Integer width, @Nullable Integer height, boolean noUpscale) {
        Integer w = positiveOrNull(width);
        Integer h = positiveOrNull(height);
        PixelSize target;
        if (w == null && h == null) {
            return source;
        } else if (w != null && h != null) {
            target = new PixelSize(w, h);
        } else if (w != null) {
            double ratio = source.width() == 0 ? 1.0 : (double) w / source.width();
            target = new PixelSize(w, scaled(source.height(), ratio));
        } else {
            double ratio = source.height() == 0 ? 1.0 : (double) h / source.height();
            target = new PixelSize(scaled(source.width(), ratio), h);
        }
        if (noUpscale && (target.width() > source.width() || target.height() > source.height())) {
            double factor = Math.min(
                (double) source.width() / target.width(),
                (double) source.height() / target.height());
            target = new PixelSize(scaled(target.width(), factor), scaled(target.height(), factor));
        }
        return target;
    }

    /** Largest size fitting within a {@code maxSide} square, keeping the aspect ratio. */
    public static PixelSize fitWithin(PixelSize source, int maxSide) {
        int longest = Math.max(source.width(), source.height());
        if (longest <= maxSide || longest == 0) {
            return source;
        }
        double factor = (double) maxSide / longest;
        return new PixelSize(scaled(source.width(), factor), scaled(source.height(), factor));
    }

    private static int scaled(int value, double factor) {
        return (int) Math.max(1L, Math.round(value * factor));
    }

    private static Integer positiveOrNull(Integer value) {
        return value != null && value > 0 ? value : null;
    }
}
