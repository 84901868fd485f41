package net.convertcompress.model;

import jakarta.annotation.Nullable;
import java.nio.file.Path;
import java.util.UUID;
import net.convertcompress.model.image.PixelSize;

/**
 * One user image under management.
 *
 * <p>Records are immutable. A successful apply produces a new record through
 * {@link #withCommittedResult(Path)}; the baseline size fields never change after
 * ingestion.</p>
 *
 * @param id stable identity, never reused
 * @param originalPath source location captured at ingestion
 * @param workingPath latest committed result, equal to {@code originalPath} until the first apply
 * @param edited whether at least one apply has committed
 * @param originalPixelSize upright source dimensions, when they could be read
 * @param originalFileSizeBytes source size on disk, when it could be read
 */
public record ImageAsset(
    UUID id,
    Path originalPath,
    Path workingPath,
    boolean edited,
    @Nullable PixelSize originalPixelSize,
    @Nullable Long originalFileSizeBytes
) {

    public ImageAsset {
        if (id == null || originalPath == null) {
            throw new IllegalArgumentException("Asset id and original path are required");
        }
        workingPath = workingPath == null ? originalPath : workingPath;
    }

    public static ImageAsset ingested(Path originalPath, @Nullable PixelSize pixelSize, @Nullable Long fileSizeBytes) {
        return new ImageAsset(UUID.randomUUID(), originalPath, originalPath, false, pixelSize, fileSizeBytes);
    }

    /** Record for this asset after its output was committed to {@code destination}. */
    public ImageAsset withCommittedResult(Path destination) {
        return new ImageAsset(id, originalPath, destination, true, originalPixelSize, originalFileSizeBytes);
    }

    public String displayName() {
        Path name = workingPath.getFileName();
        return name == null ? workingPath.toString() : name.toString();
    }
}
