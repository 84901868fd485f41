package net.convertcompress.service.asset;

import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;
import net.convertcompress.model.ImageAsset;

/**
 * Published once per mutation of the {@link AssetLibrary}, carrying every record the
 * mutation touched.
 */
public class AssetsUpdatedEvent {

    public enum Kind {
        ADDED,
        REMOVED,
        UPDATED
    }

    private final Kind kind;
    private final List<ImageAsset> assets;

    public AssetsUpdatedEvent(Kind kind, List<ImageAsset> assets) {
        this.kind = kind;
        this.assets = assets != null ? List.copyOf(assets) : List.of();
    }

    public Kind getKind() {
        return kind;
    }

    public List<ImageAsset> getAssets() {
        return assets;
    }

    public Set<UUID> getAssetIds() {
        return assets.stream().map(ImageAsset::id).collect(Collectors.toUnmodifiableSet());
    }
}
