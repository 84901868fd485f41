package net.convertcompress.processing;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import net.convertcompress.codec.ImageCodec;
import net.convertcompress.config.ProcessingProperties;
import net.convertcompress.model.image.FlipAxis;
import net.convertcompress.processing.operation.ConstrainToFormatSizeOperation;
import net.convertcompress.processing.operation.FlipOperation;
import net.convertcompress.processing.operation.ImageOperation;
import net.convertcompress.processing.operation.RemoveBackgroundOperation;
import net.convertcompress.processing.operation.ResizeOperation;
import net.convertcompress.processing.operation.ResizeOperation.ResizeMode;
import net.convertcompress.service.format.FormatCapabilityResolver;
import net.convertcompress.support.sandbox.SandboxAccessManager;
import org.springframework.stereotype.Component;

/**
 * Turns {@link PipelineSettings} into a {@link ProcessingPipeline}.
 *
 * <p>Operation order is fixed: resize, format-size constraint, vertical flip, horizontal
 * flip, background removal. The estimation variant drops flips and background removal,
 * which never change the byte size enough to matter.</p>
 */
@Component
public class PipelineBuilder {

    private final ImageCodec codec;
    private final FormatCapabilityResolver formats;
    private final SandboxAccessManager access;
    private final Path scratchDirectory;

    public PipelineBuilder(ImageCodec codec, FormatCapabilityResolver formats,
                           SandboxAccessManager access, ProcessingProperties properties) {
        this.codec = codec;
        this.formats = formats;
        this.access = access;
        this.scratchDirectory = properties.getDestination().getTempRoot();
    }

    public ProcessingPipeline build(PipelineSettings settings) {
        return withOperations(settings, operationsFor(settings, false));
    }

    public ProcessingPipeline buildForEstimation(PipelineSettings settings) {
        return withOperations(settings, operationsFor(settings, true));
    }

    /**
     * Pipeline with an explicit operation list; the settings only supply output options.
     */
    public ProcessingPipeline withOperations(PipelineSettings settings, List<ImageOperation> operations) {
        return ProcessingPipeline.builder()
            .operations(operations)
            .stripMetadata(settings.isStripMetadata())
            .targetFormat(settings.getTargetFormat())
            .quality(settings.getQuality())
            .exportDirectory(settings.getExportDirectory())
            .scratchDirectory(scratchDirectory)
            .codec(codec)
            .formats(formats)
            .access(access)
            .build();
    }

    List<ImageOperation> operationsFor(PipelineSettings settings, boolean estimation) {
        List<ImageOperation> operations = new ArrayList<>();
        if (settings.requestsResize()) {
            operations.add(settings.getResizeMode() == ResizeMode.PIXELS
                ? ResizeOperation.pixels(settings.getPixelWidth(), settings.getPixelHeight())
                : ResizeOperation.percent(settings.getResizePercent()));
        }
        if (settings.getTargetFormat() != null && formats.sizeRestrictions(settings.getTargetFormat()).isPresent()) {
            operations.add(new ConstrainToFormatSizeOperation(settings.getTargetFormat()));
        }
        if (estimation) {
            return operations;
        }
        if (settings.isFlipVertical()) {
            operations.add(new FlipOperation(FlipAxis.VERTICAL));
        }
        if (settings.isFlipHorizontal()) {
            operations.add(new FlipOperation(FlipAxis.HORIZONTAL));
        }
        if (settings.isRemoveBackground()) {
            operations.add(new RemoveBackgroundOperation());
        }
        return operations;
    }
}
