package net.convertcompress.service.image;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import net.convertcompress.codec.TransformRequest;
import net.convertcompress.config.CacheFactory;
import net.convertcompress.config.ProcessingProperties;
import net.convertcompress.exception.ImageLoadException;
import net.convertcompress.model.ImageAsset;
import net.convertcompress.model.image.ImageFormat;
import net.convertcompress.model.image.PixelSize;
import net.convertcompress.service.asset.AssetsUpdatedEvent;
import net.convertcompress.support.sandbox.SandboxAccessManager;
import net.convertcompress.testutil.FakeImageCodec;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ThumbnailServiceTest {

    @TempDir
    Path workspace;

    private final ExecutorService executor = Executors.newFixedThreadPool(8);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void should_ShrinkToMaxSide_When_LoadingLargeImage() throws Exception {
        FakeImageCodec codec = new FakeImageCodec();
        ThumbnailService service = service(codec, 4);
        ImageAsset asset = asset("big.png", 1000, 500);

        service.loadThumbnail(asset).get(5, TimeUnit.SECONDS);

        assertThat(codec.transforms()).containsExactly(new TransformRequest.Scale(new PixelSize(256, 128)));
        assertThat(codec.encodeRequests()).singleElement()
            .satisfies(request -> assertThat(request.format()).isEqualTo(ImageFormat.PNG));
    }

    @Test
    void should_ServeFromCache_When_LoadedTwice() throws Exception {
        FakeImageCodec codec = new FakeImageCodec();
        ThumbnailService service = service(codec, 4);
        ImageAsset asset = asset("a.png", 100, 100);

        byte[] first = service.loadThumbnail(asset).get(5, TimeUnit.SECONDS);
        byte[] second = service.loadThumbnail(asset).get(5, TimeUnit.SECONDS);

        assertThat(second).isSameAs(first);
        assertThat(codec.decodeCalls()).isEqualTo(1);
    }

    @Test
    void should_RenderAgain_When_AssetIsUpdated() throws Exception {
        FakeImageCodec codec = new FakeImageCodec();
        ThumbnailService service = service(codec, 4);
        ImageAsset asset = asset("a.png", 100, 100);
        service.loadThumbnail(asset).get(5, TimeUnit.SECONDS);

        service.onAssetsUpdated(new AssetsUpdatedEvent(AssetsUpdatedEvent.Kind.ADDED, List.of(asset)));
        service.loadThumbnail(asset).get(5, TimeUnit.SECONDS);
        service.onAssetsUpdated(new AssetsUpdatedEvent(AssetsUpdatedEvent.Kind.UPDATED, List.of(asset)));
        service.loadThumbnail(asset).get(5, TimeUnit.SECONDS);

        assertThat(codec.decodeCalls()).isEqualTo(2);
    }

    @Test
    void should_LimitConcurrentDecodes_When_ManyThumbnailsRequested() throws Exception {
        FakeImageCodec codec = new FakeImageCodec().withDecodeDelay(10);
        ThumbnailService service = service(codec, 2);
        List<CompletableFuture<byte[]>> loads = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            loads.add(service.loadThumbnail(asset("t" + i + ".png", 64, 64)));
        }

        CompletableFuture.allOf(loads.toArray(new CompletableFuture[0])).get(10, TimeUnit.SECONDS);

        assertThat(codec.peakActiveDecodes()).isBetween(1, 2);
        assertThat(service.queuedLoads()).isZero();
    }

    @Test
    void should_FailFuture_When_FileCannotBeDecoded() throws Exception {
        FakeImageCodec codec = new FakeImageCodec().failOn("bad.png");
        ThumbnailService service = service(codec, 2);

        assertThat(service.loadThumbnail(asset("bad.png", 10, 10)))
            .failsWithin(Duration.ofSeconds(5))
            .withThrowableOfType(ExecutionException.class)
            .withCauseInstanceOf(ImageLoadException.class);
    }

    private ThumbnailService service(FakeImageCodec codec, int maxConcurrent) {
        ProcessingProperties properties = new ProcessingProperties();
        properties.getThumbnails().setMaxConcurrent(maxConcurrent);
        return new ThumbnailService(codec, new SandboxAccessManager(false, List.of()), new CacheFactory(),
            properties, executor);
    }

    private ImageAsset asset(String name, int width, int height) throws Exception {
        return ImageAsset.ingested(FakeImageCodec.writeImage(workspace, name, width, height), null, null);
    }
}
