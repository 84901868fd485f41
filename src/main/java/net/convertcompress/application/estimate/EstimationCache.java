package net.convertcompress.application.estimate;

import com.github.benmanes.caffeine.cache.Cache;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import net.convertcompress.application.apply.BatchCompletedEvent;
import net.convertcompress.config.CacheFactory;
import net.convertcompress.config.ProcessingProperties;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Advisory output-size predictions keyed by asset id. Merges are last-writer-wins.
 * Nothing in the apply path reads from here.
 */
@Slf4j
@Component
public class EstimationCache {

    private final Cache<UUID, Long> estimates;

    public EstimationCache(CacheFactory cacheFactory, ProcessingProperties properties) {
        this.estimates = cacheFactory.createCacheWithSize("sizeEstimates", properties.getEstimation().getCacheSize());
    }

    public void merge(Map<UUID, Long> results) {
        estimates.putAll(results);
    }

    public Optional<Long> get(UUID assetId) {
        return Optional.ofNullable(estimates.getIfPresent(assetId));
    }

    public Map<UUID, Long> snapshot() {
        return Map.copyOf(estimates.asMap());
    }

    public void invalidate(Collection<UUID> assetIds) {
        estimates.invalidateAll(assetIds);
    }

    public void clear() {
        estimates.invalidateAll();
    }

    /** A committed apply supersedes any estimate for the assets it updated. */
    @EventListener
    public void onBatchCompleted(BatchCompletedEvent event) {
        if (!event.getUpdatedAssets().isEmpty()) {
            log.debug("Dropping {} estimates superseded by a completed batch", event.getUpdatedAssets().size());
            invalidate(event.getUpdatedAssetIds());
        }
    }
}
