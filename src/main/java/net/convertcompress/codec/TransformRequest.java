package net.convertcompress.codec;

import net.convertcompress.model.image.FlipAxis;
import net.convertcompress.model.image.PixelSize;

/**
 * Primitive pixel transforms a codec has to provide. Operations decide the parameters;
 * the codec only executes them.
 */
public sealed interface TransformRequest
    permits TransformRequest.Scale, TransformRequest.Flip, TransformRequest.RemoveBackground {

    /** Short name used in logs and transform errors. */
    String describe();

    record Scale(PixelSize target) implements TransformRequest {
        public Scale {
            if (target == null || target.isEmpty()) {
                throw new IllegalArgumentException("Scale target must be at least 1x1");
            }
        }

        @Override
        public String describe() {
            return "Scale(" + target + ")";
        }
    }

    record Flip(FlipAxis axis) implements TransformRequest {
        public Flip {
            if (axis == null) {
                throw new IllegalArgumentException("Flip axis is required");
            }
        }

        @Override
        public String describe() {
            return "Flip(" + axis + ")";
        }
    }

    record RemoveBackground() implements TransformRequest {
        @Override
        public String describe() {
            return "RemoveBackground";
        }
    }
}
