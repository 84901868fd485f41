package net.convertcompress.processing;

import java.nio.file.Path;
import lombok.Builder;
import lombok.Value;
import net.convertcompress.model.image.ImageFormat;
import net.convertcompress.processing.operation.ResizeOperation.ResizeMode;

/**
 * User-facing export settings a pipeline is built from.
 */
@Value
@Builder(toBuilder = true)
public class PipelineSettings {

    @Builder.Default
    ResizeMode resizeMode = ResizeMode.PERCENT;

    // 1.0 means "no resize" in percent mode
    @Builder.Default
    double resizePercent = 1.0;

    Integer pixelWidth;
    Integer pixelHeight;

    // null keeps the source format
    ImageFormat targetFormat;

    // null uses the format default
    Double quality;

    boolean stripMetadata;
    boolean flipHorizontal;
    boolean flipVertical;
    boolean removeBackground;

    // null writes next to the source
    Path exportDirectory;

    public static PipelineSettings defaults() {
        return PipelineSettings.builder().build();
    }

    public boolean requestsResize() {
        if (resizeMode == ResizeMode.PIXELS) {
            return (pixelWidth != null && pixelWidth > 0) || (pixelHeight != null && pixelHeight > 0);
        }
        return resizePercent != 1.0;
    }
}
