package net.convertcompress.processing;

import static org.assertj.core.api.Assertions.assertThat;

import net.convertcompress.model.image.PixelSize;
import org.junit.jupiter.api.Test;

class ResizeMathTest {

    private static final PixelSize SOURCE = new PixelSize(1000, 500);

    @Test
    void should_ScaleBothSides_When_ResizingByPercent() {
        assertThat(ResizeMath.percent(SOURCE, 0.5, false)).isEqualTo(new PixelSize(500, 250));
        assertThat(ResizeMath.percent(SOURCE, 2.0, false)).isEqualTo(new PixelSize(2000, 1000));
        assertThat(ResizeMath.percent(SOURCE, 2.0, true)).isEqualTo(SOURCE);
    }

    @Test
    void should_ClampToMinimumScale_When_PercentIsTiny() {
        assertThat(ResizeMath.percent(SOURCE, 0.0001, false)).isEqualTo(new PixelSize(10, 5));
        assertThat(ResizeMath.percent(new PixelSize(10, 10), 0.01, false)).isEqualTo(new PixelSize(1, 1));
    }

    @Test
    void should_KeepAspectRatio_When_OnlyOneSideGiven() {
        assertThat(ResizeMath.pixels(SOURCE, 200, null, false)).isEqualTo(new PixelSize(200, 100));
        assertThat(ResizeMath.pixels(SOURCE, null, 100, false)).isEqualTo(new PixelSize(200, 100));
        assertThat(ResizeMath.pixels(SOURCE, 300, 300, false)).isEqualTo(new PixelSize(300, 300));
        assertThat(ResizeMath.pixels(SOURCE, null, 0, false)).isEqualTo(SOURCE);
    }

    @Test
    void should_ShrinkProportionally_When_UpscaleIsForbidden() {
        assertThat(ResizeMath.pixels(SOURCE, 2000, 2000, true)).isEqualTo(new PixelSize(500, 500));
        assertThat(ResizeMath.pixels(SOURCE, 4000, null, true)).isEqualTo(SOURCE);
    }

    @Test
    void should_FitLongestSide_When_ComputingThumbnailSize() {
        assertThat(ResizeMath.fitWithin(SOURCE, 100)).isEqualTo(new PixelSize(100, 50));
        assertThat(ResizeMath.fitWithin(new PixelSize(4000, 3), 100)).isEqualTo(new PixelSize(100, 1));
        assertThat(ResizeMath.fitWithin(new PixelSize(80, 60), 100)).isEqualTo(new PixelSize(80, 60));
    }
}
