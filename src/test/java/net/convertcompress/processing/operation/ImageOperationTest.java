package net.convertcompress.processing.operation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import net.convertcompress.codec.EditableImage;
import net.convertcompress.codec.TransformRequest;
import net.convertcompress.model.image.FlipAxis;
import net.convertcompress.model.image.ImageFormat;
import net.convertcompress.model.image.ImageMetadata;
import net.convertcompress.model.image.PixelSize;
import net.convertcompress.service.format.FormatCapabilityResolver;
import net.convertcompress.testutil.FakeImageCodec;
import org.junit.jupiter.api.Test;

class ImageOperationTest {

    private final FakeImageCodec codec = new FakeImageCodec();
    private final OperationContext context = new OperationContext(codec, new FormatCapabilityResolver(codec));

    @Test
    void should_SkipCodec_When_ResizeKeepsSize() {
        EditableImage image = image(400, 200);

        assertThat(ResizeOperation.percent(1.0).apply(image, context)).isSameAs(image);
        assertThat(codec.transforms()).isEmpty();
    }

    @Test
    void should_ScaleToTarget_When_ResizingByPixels() {
        EditableImage resized = ResizeOperation.pixels(100, null).apply(image(400, 200), context);

        assertThat(resized.pixelSize()).isEqualTo(new PixelSize(100, 50));
        assertThat(codec.transforms()).containsExactly(new TransformRequest.Scale(new PixelSize(100, 50)));
    }

    @Test
    void should_RejectMissingDimensions_When_CreatingPixelResize() {
        assertThatThrownBy(() -> ResizeOperation.pixels(null, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void should_ClampToMinimumScale_When_PercentIsZeroNegativeOrNaN() {
        PixelSize source = new PixelSize(1000, 500);

        assertThat(ResizeOperation.percent(0).targetSize(source)).isEqualTo(new PixelSize(10, 5));
        assertThat(ResizeOperation.percent(-3).targetSize(source)).isEqualTo(new PixelSize(10, 5));
        assertThat(ResizeOperation.percent(Double.NaN).targetSize(source)).isEqualTo(new PixelSize(10, 5));
    }

    @Test
    void should_SnapToAllowedSquare_When_FormatIsRestricted() {
        ConstrainToFormatSizeOperation constrain = new ConstrainToFormatSizeOperation(ImageFormat.ICO);

        assertThat(constrain.apply(image(300, 200), context).pixelSize()).isEqualTo(PixelSize.square(256));

        EditableImage valid = image(64, 64);
        assertThat(constrain.apply(valid, context)).isSameAs(valid);
        EditableImage unrestricted = image(300, 200);
        assertThat(new ConstrainToFormatSizeOperation(ImageFormat.PNG).apply(unrestricted, context))
            .isSameAs(unrestricted);
    }

    @Test
    void should_ReportSizeNeutral_When_Flipping() {
        FlipOperation flip = new FlipOperation(FlipAxis.HORIZONTAL);

        flip.apply(image(10, 10), context);

        assertThat(flip.affectsOutputSize()).isFalse();
        assertThat(new RemoveBackgroundOperation().affectsOutputSize()).isTrue();
        assertThat(codec.transforms()).containsExactly(new TransformRequest.Flip(FlipAxis.HORIZONTAL));
    }

    private static EditableImage image(int width, int height) {
        return new FakeImageCodec.FakeImage(new PixelSize(width, height), ImageMetadata.empty());
    }
}
