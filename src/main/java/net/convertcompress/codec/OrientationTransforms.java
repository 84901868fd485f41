package net.convertcompress.codec;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.AffineTransform;
import java.awt.image.BufferedImage;
import net.convertcompress.model.image.FlipAxis;
import net.convertcompress.model.image.Orientation;

/**
 * Geometric helpers shared by decode-time orientation and flip transforms.
 */
final class OrientationTransforms {

    private OrientationTransforms() {
    }

    static BufferedImage upright(BufferedImage source, Orientation orientation) {
        if (orientation == null || orientation == Orientation.UP) {
            return source;
        }
        int w = source.getWidth();
        int h = source.getHeight();
        AffineTransform tx = new AffineTransform();
        switch (orientation) {
            case UP_MIRRORED -> {
                tx.translate(w, 0);
                tx.scale(-1, 1);
            }
            case DOWN -> {
                tx.translate(w, h);
                tx.rotate(Math.PI);
            }
            case DOWN_MIRRORED -> {
                tx.translate(0, h);
                tx.scale(1, -1);
            }
            case LEFT_MIRRORED -> {
                tx.rotate(Math.PI / 2);
                tx.scale(1, -1);
            }
            case RIGHT -> {
                tx.translate(h, 0);
                tx.rotate(Math.PI / 2);
            }
            case RIGHT_MIRRORED -> {
                tx.translate(h, w);
                tx.scale(-1, 1);
                tx.rotate(3 * Math.PI / 2);
            }
            case LEFT -> {
                tx.translate(0, w);
                tx.rotate(3 * Math.PI / 2);
            }
            default -> {
                return source;
            }
        }
        int targetWidth = orientation.swapsDimensions() ? h : w;
        int targetHeight = orientation.swapsDimensions() ? w : h;
        return draw(source, tx, targetWidth, targetHeight);
    }

    static BufferedImage flip(BufferedImage source, FlipAxis axis) {
        int w = source.getWidth();
        int h = source.getHeight();
        AffineTransform tx = new AffineTransform();
        if (axis == FlipAxis.HORIZONTAL) {
            tx.translate(w, 0);
            tx.scale(-1, 1);
        } else {
            tx.translate(0, h);
            tx.scale(1, -1);
        }
        return draw(source, tx, w, h);
    }

    static BufferedImage scale(BufferedImage source, int width, int height) {
        BufferedImage target = new BufferedImage(width, height, workingType(source));
        Graphics2D g = target.createGraphics();
        try {
            g.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
            g.drawImage(source, 0, 0, width, height, null);
        } finally {
            g.dispose();
        }
        return target;
    }

    static int workingType(BufferedImage source) {
        return source.getColorModel().hasAlpha() ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
    }

    private static BufferedImage draw(BufferedImage source, AffineTransform tx, int width, int height) {
        BufferedImage target = new BufferedImage(width, height, workingType(source));
        Graphics2D g = target.createGraphics();
        try {
            g.drawImage(source, tx, null);
        } finally {
            g.dispose();
        }
        return target;
    }
}
