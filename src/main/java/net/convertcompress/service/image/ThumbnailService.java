package net.convertcompress.service.image;

import com.github.benmanes.caffeine.cache.Cache;
import java.nio.file.Path;
import java.util.Collection;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import net.convertcompress.codec.EditableImage;
import net.convertcompress.codec.EncodeRequest;
import net.convertcompress.codec.ImageCodec;
import net.convertcompress.codec.TransformRequest;
import net.convertcompress.config.CacheFactory;
import net.convertcompress.config.ProcessingProperties;
import net.convertcompress.model.ImageAsset;
import net.convertcompress.model.image.ImageFormat;
import net.convertcompress.model.image.ImageMetadata;
import net.convertcompress.model.image.PixelSize;
import net.convertcompress.processing.ResizeMath;
import net.convertcompress.service.asset.AssetsUpdatedEvent;
import net.convertcompress.support.concurrency.AdmissionGate;
import net.convertcompress.support.sandbox.ScopedAccessToken;
import net.convertcompress.support.sandbox.SandboxAccessManager;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

/**
 * Loads small PNG previews of an asset's current working file.
 *
 * <p>Decodes are admitted through an {@link AdmissionGate} so a large library cannot
 * flood the machine with full-size decodes. Results are cached per asset and working
 * path, so a committed apply naturally yields a fresh thumbnail.</p>
 */
@Slf4j
@Service
public class ThumbnailService {

    private final ImageCodec codec;
    private final SandboxAccessManager access;
    private final Executor executor;
    private final AdmissionGate gate;
    private final int maxSide;
    private final Cache<ThumbnailKey, byte[]> thumbnails;

    public ThumbnailService(ImageCodec codec,
                            SandboxAccessManager access,
                            CacheFactory cacheFactory,
                            ProcessingProperties properties,
                            @Qualifier("thumbnailExecutor") Executor executor) {
        ProcessingProperties.Thumbnails settings = properties.getThumbnails();
        this.codec = codec;
        this.access = access;
        this.executor = executor;
        this.gate = new AdmissionGate(settings.getMaxConcurrent());
        this.maxSide = settings.getMaxSide();
        this.thumbnails = cacheFactory.createCache("thumbnails", settings.getCacheSize(), settings.getCacheTtl());
    }

    /**
     * PNG thumbnail no larger than the configured side. Completes exceptionally with an
     * {@link net.convertcompress.exception.ImageProcessingException} when the file cannot be read.
     */
    public CompletableFuture<byte[]> loadThumbnail(ImageAsset asset) {
        ThumbnailKey key = new ThumbnailKey(asset.id(), asset.workingPath());
        byte[] cached = thumbnails.getIfPresent(key);
        if (cached != null) {
            return CompletableFuture.completedFuture(cached);
        }
        return gate.submit(() -> render(asset.workingPath()), executor)
            .thenApply(bytes -> {
                thumbnails.put(key, bytes);
                return bytes;
            });
    }

    public void invalidate(Collection<UUID> assetIds) {
        thumbnails.asMap().keySet().removeIf(key -> assetIds.contains(key.assetId()));
    }

    /** Number of thumbnail loads waiting for a decode slot. */
    public int queuedLoads() {
        return gate.queuedCount();
    }

    @EventListener
    public void onAssetsUpdated(AssetsUpdatedEvent event) {
        if (event.getKind() != AssetsUpdatedEvent.Kind.ADDED) {
            invalidate(event.getAssetIds());
        }
    }

    private byte[] render(Path source) {
        try (ScopedAccessToken ignored = access.acquire(source)) {
            EditableImage image = codec.decode(source);
            PixelSize target = ResizeMath.fitWithin(image.pixelSize(), maxSide);
            if (!target.equals(image.pixelSize())) {
                image = codec.transform(image, new TransformRequest.Scale(target));
            }
            byte[] encoded = codec.encode(image, new EncodeRequest(ImageFormat.PNG, null, true, ImageMetadata.empty()));
            log.debug("Rendered {} thumbnail for {}", target, source);
            return encoded;
        }
    }

    private record ThumbnailKey(UUID assetId, Path workingPath) {
    }
}
