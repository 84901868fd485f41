package net.convertcompress.application.destination;

import java.nio.file.Path;
import net.convertcompress.config.ProcessingProperties;
import net.convertcompress.model.DestinationPlan;
import net.convertcompress.model.ImageAsset;
import net.convertcompress.model.image.ImageFormat;
import net.convertcompress.processing.ProcessingPipeline;
import net.convertcompress.service.format.FormatCapabilityResolver;
import net.convertcompress.util.PathUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Computes where an asset's output goes. Planning is a pure function of its inputs and
 * performs no filesystem access, so the orchestrator can preflight collisions before any
 * decode or encode work.
 *
 * <ul>
 *   <li>explicit export directory: {@code <exportDirectory>/<stem>.<ext>}</li>
 *   <li>source under the temp root (pasted or dragged in): {@code <downloads>/<stem>.<ext>}</li>
 *   <li>otherwise next to the source: {@code <sourceDirectory>/<stem>.<ext>}</li>
 * </ul>
 */
@Component
public class DestinationPlanner {

    private final FormatCapabilityResolver formats;
    private final Path tempRoot;
    private final Path downloadsDirectory;

    @Autowired
    public DestinationPlanner(FormatCapabilityResolver formats, ProcessingProperties properties) {
        this(formats, properties.getDestination().getTempRoot(), properties.getDestination().getDownloadsDirectory());
    }

    public DestinationPlanner(FormatCapabilityResolver formats, Path tempRoot, Path downloadsDirectory) {
        this.formats = formats;
        this.tempRoot = tempRoot;
        this.downloadsDirectory = downloadsDirectory != null
            ? downloadsDirectory
            : Path.of(System.getProperty("user.home"));
    }

    public DestinationPlan plan(Path source, ImageFormat format, Path exportDirectory) {
        String stem = PathUtils.stem(source);
        String extension = formats.preferredExtension(format);
        Path directory;
        if (exportDirectory != null) {
            directory = exportDirectory;
        } else if (isTempSourced(source)) {
            directory = downloadsDirectory;
        } else {
            directory = PathUtils.parentDirectory(source);
        }
        return new DestinationPlan(directory.resolve(stem + "." + extension), directory, stem, extension);
    }

    /** Plan for an asset run through {@code pipeline}. */
    public DestinationPlan plan(ImageAsset asset, ProcessingPipeline pipeline) {
        Path source = asset.originalPath();
        return plan(source, pipeline.resolveFormat(source), pipeline.exportDirectory());
    }

    public Path plannedDestination(ImageAsset asset, ProcessingPipeline pipeline) {
        return plan(asset, pipeline).path();
    }

    public boolean isTempSourced(Path source) {
        return tempRoot != null && PathUtils.isUnder(source, tempRoot);
    }
}
