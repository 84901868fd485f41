package net.convertcompress.processing;

import jakarta.annotation.Nullable;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.List;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import net.convertcompress.codec.EditableImage;
import net.convertcompress.codec.EncodeRequest;
import net.convertcompress.codec.ImageCodec;
import net.convertcompress.exception.ImageExportException;
import net.convertcompress.exception.ImageLoadException;
import net.convertcompress.exception.ImageProcessingException;
import net.convertcompress.exception.ImageTransformException;
import net.convertcompress.model.ImageAsset;
import net.convertcompress.model.image.ImageFormat;
import net.convertcompress.processing.operation.ImageOperation;
import net.convertcompress.processing.operation.OperationContext;
import net.convertcompress.service.format.FormatCapabilityResolver;
import net.convertcompress.support.sandbox.ScopedAccessToken;
import net.convertcompress.support.sandbox.SandboxAccessManager;
import net.convertcompress.util.PathUtils;

/**
 * Ordered operation chain plus output settings, executed on one source at a time.
 *
 * <p>A pipeline is immutable once built and holds only stateless operations, so one
 * instance is shared by every worker of a batch. Operations run strictly in list order;
 * the chain never reorders them. Any failure aborts the run for that source without
 * writing anything.</p>
 */
@Slf4j
public final class ProcessingPipeline {

    public static final double MIN_QUALITY = 0.01;
    public static final double MAX_QUALITY = 1.0;

    private final List<ImageOperation> operations;
    private final boolean stripMetadata;
    @Nullable
    private final ImageFormat targetFormat;
    @Nullable
    private final Double quality;
    @Nullable
    private final Path exportDirectory;
    private final Path scratchDirectory;
    private final ImageCodec codec;
    private final FormatCapabilityResolver formats;
    private final SandboxAccessManager access;
    private final OperationContext context;

    @Builder
    private ProcessingPipeline(List<ImageOperation> operations, boolean stripMetadata,
                               @Nullable ImageFormat targetFormat, @Nullable Double quality,
                               @Nullable Path exportDirectory, Path scratchDirectory,
                               ImageCodec codec, FormatCapabilityResolver formats, SandboxAccessManager access) {
        if (codec == null || formats == null || access == null) {
            throw new IllegalArgumentException("Pipeline requires a codec, a format resolver and an access manager");
        }
        this.operations = operations == null ? List.of() : List.copyOf(operations);
        this.stripMetadata = stripMetadata;
        this.targetFormat = targetFormat;
        this.quality = clampQuality(quality);
        this.exportDirectory = exportDirectory;
        this.scratchDirectory = scratchDirectory != null
            ? scratchDirectory
            : Path.of(System.getProperty("java.io.tmpdir"));
        this.codec = codec;
        this.formats = formats;
        this.access = access;
        this.context = new OperationContext(codec, formats);
    }

    /**
     * Decodes {@code source} upright, applies every operation in order and encodes the
     * result in the resolved format.
     *
     * @throws ImageProcessingException for load, transform, export or permission failures
     */
    public EncodedImage execute(Path source) {
        try (ScopedAccessToken ignored = access.acquire(source)) {
            EditableImage image = decode(source);
            for (ImageOperation operation : operations) {
                image = applyStep(operation, image);
            }
            ImageFormat format = resolveFormat(source);
            EncodeRequest request = new EncodeRequest(format, quality, stripMetadata,
                image.metadata().forOutput(stripMetadata));
            byte[] data = encode(image, request, source);
            return new EncodedImage(data, format, image.pixelSize());
        }
    }

    /** Runs the chain on an asset's original source. */
    public EncodedImage render(ImageAsset asset) {
        return execute(asset.originalPath());
    }

    /**
     * Renders an asset into the scratch directory as {@code <stem>_tmp_<8 hex>.<ext>}
     * without touching its destination. The caller owns the returned file.
     */
    public Path renderToTemporaryFile(ImageAsset asset) {
        EncodedImage encoded = render(asset);
        Path target = PathUtils.temporarySibling(scratchDirectory,
            PathUtils.stem(asset.originalPath()), formats.preferredExtension(encoded.format()));
        try {
            Files.createDirectories(scratchDirectory);
            Files.write(target, encoded.data(), StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return target;
        } catch (IOException e) {
            throw new ImageExportException(target, e.getMessage(), e);
        }
    }

    /** Format an encode of {@code source} will use. */
    public ImageFormat resolveFormat(Path source) {
        return formats.resolveActualFormat(targetFormat, source);
    }

    /**
     * Clamps a quality hint into {@code [0.01, 1.0]}; null and NaN mean "format default".
     */
    public static Double clampQuality(@Nullable Double requested) {
        if (requested == null || requested.isNaN()) {
            return null;
        }
        return Math.max(MIN_QUALITY, Math.min(MAX_QUALITY, requested));
    }

    public List<ImageOperation> operations() {
        return operations;
    }

    public boolean stripMetadata() {
        return stripMetadata;
    }

    @Nullable
    public ImageFormat targetFormat() {
        return targetFormat;
    }

    @Nullable
    public Double quality() {
        return quality;
    }

    @Nullable
    public Path exportDirectory() {
        return exportDirectory;
    }

    private EditableImage decode(Path source) {
        try {
            return codec.decode(source);
        } catch (ImageProcessingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ImageLoadException(source, e.getMessage(), e);
        }
    }

    private EditableImage applyStep(ImageOperation operation, EditableImage image) {
        try {
            EditableImage result = operation.apply(image, context);
            log.trace("{} -> {}", operation.name(), result.pixelSize());
            return result;
        } catch (ImageProcessingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ImageTransformException(operation.name(), e.getMessage(), e);
        }
    }

    private byte[] encode(EditableImage image, EncodeRequest request, Path source) {
        try {
            return codec.encode(image, request);
        } catch (ImageProcessingException e) {
            throw e;
        } catch (RuntimeException e) {
            throw new ImageExportException(source, e.getMessage(), e);
        }
    }
}
