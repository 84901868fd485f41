package net.convertcompress.application.apply;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import net.convertcompress.model.ImageAsset;

/**
 * Published once after a batch has committed and the library reflects its results.
 */
public class BatchCompletedEvent {

    private final List<ImageAsset> updatedAssets;
    private final int failedCount;

    public BatchCompletedEvent(List<ImageAsset> updatedAssets, int failedCount) {
        this.updatedAssets = updatedAssets != null ? List.copyOf(updatedAssets) : List.of();
        this.failedCount = failedCount;
    }

    public List<ImageAsset> getUpdatedAssets() {
        return updatedAssets;
    }

    public Set<UUID> getUpdatedAssetIds() {
        return updatedAssets.stream().map(ImageAsset::id).collect(Collectors.toUnmodifiableSet());
    }

    public int getFailedCount() {
        return failedCount;
    }
}
