package net.convertcompress.service.asset;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import net.convertcompress.model.ImageAsset;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * The shared, ordered collection of assets under management.
 *
 * <p>Workers never write here directly. Batch results arrive through
 * {@link #applyUpdates(Collection)} after every worker has finished, so observers see a
 * single transition per batch through one {@link AssetsUpdatedEvent}.</p>
 */
@Slf4j
@Service
public class AssetLibrary {

    private final Map<UUID, ImageAsset> assets = new LinkedHashMap<>();
    private final ApplicationEventPublisher eventPublisher;

    public AssetLibrary(ApplicationEventPublisher eventPublisher) {
        this.eventPublisher = eventPublisher;
    }

    /**
     * Adds assets whose original path is not already present.
     *
     * @return the assets actually added
     */
    public List<ImageAsset> add(Collection<ImageAsset> candidates) {
        List<ImageAsset> added = new ArrayList<>();
        synchronized (assets) {
            for (ImageAsset candidate : candidates) {
                if (!assets.containsKey(candidate.id()) && !containsPathLocked(candidate.originalPath())) {
                    assets.put(candidate.id(), candidate);
                    added.add(candidate);
                }
            }
        }
        publish(AssetsUpdatedEvent.Kind.ADDED, added);
        return added;
    }

    public Optional<ImageAsset> remove(UUID id) {
        ImageAsset removed;
        synchronized (assets) {
            removed = assets.remove(id);
        }
        if (removed != null) {
            publish(AssetsUpdatedEvent.Kind.REMOVED, List.of(removed));
        }
        return Optional.ofNullable(removed);
    }

    /**
     * Replaces the stored records for every asset still present, in one mutation.
     *
     * @return number of records replaced
     */
    public int applyUpdates(Collection<ImageAsset> updated) {
        List<ImageAsset> applied = new ArrayList<>();
        synchronized (assets) {
            for (ImageAsset record : updated) {
                if (assets.containsKey(record.id())) {
                    assets.put(record.id(), record);
                    applied.add(record);
                } else {
                    log.debug("Dropping update for asset {} removed during the batch", record.id());
                }
            }
        }
        publish(AssetsUpdatedEvent.Kind.UPDATED, applied);
        return applied.size();
    }

    public Optional<ImageAsset> find(UUID id) {
        synchronized (assets) {
            return Optional.ofNullable(assets.get(id));
        }
    }

    /** Current records in insertion order. */
    public List<ImageAsset> snapshot() {
        synchronized (assets) {
            return List.copyOf(assets.values());
        }
    }

    public boolean containsPath(Path originalPath) {
        synchronized (assets) {
            return containsPathLocked(originalPath);
        }
    }

    public int size() {
        synchronized (assets) {
            return assets.size();
        }
    }

    private boolean containsPathLocked(Path originalPath) {
        Path normalized = originalPath.toAbsolutePath().normalize();
        for (ImageAsset asset : assets.values()) {
            if (asset.originalPath().toAbsolutePath().normalize().equals(normalized)) {
                return true;
            }
        }
        return false;
    }

    private void publish(AssetsUpdatedEvent.Kind kind, List<ImageAsset> changed) {
        if (!changed.isEmpty()) {
            eventPublisher.publishEvent(new AssetsUpdatedEvent(kind, changed));
        }
    }
}
