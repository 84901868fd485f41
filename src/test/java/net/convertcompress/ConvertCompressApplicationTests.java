package net.convertcompress;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import javax.imageio.ImageIO;
import net.convertcompress.application.apply.BatchApplyOrchestrator;
import net.convertcompress.application.apply.BatchApplyResult;
import net.convertcompress.application.apply.BatchApplyStatus;
import net.convertcompress.application.apply.OverwriteConfirmation;
import net.convertcompress.application.estimate.EstimationCache;
import net.convertcompress.codec.ImageCodec;
import net.convertcompress.codec.ImageIoCodec;
import net.convertcompress.model.ImageAsset;
import net.convertcompress.model.image.ImageFormat;
import net.convertcompress.processing.PipelineSettings;
import net.convertcompress.service.asset.AssetIngestionService;
import net.convertcompress.service.asset.AssetLibrary;
import net.convertcompress.service.format.FormatCapabilityResolver;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Context smoke test: the engine wires up with its default codec and runs one small
 * batch end to end through the Spring-managed beans.
 */
@SpringBootTest(properties = {
    "convert-compress.destination.temp-root=target/test-scratch",
    "convert-compress.destination.downloads-directory=target/test-downloads"
})
class ConvertCompressApplicationTests {

    @Autowired
    private ImageCodec codec;

    @Autowired
    private FormatCapabilityResolver formats;

    @Autowired
    private AssetIngestionService ingestion;

    @Autowired
    private AssetLibrary library;

    @Autowired
    private BatchApplyOrchestrator orchestrator;

    @Autowired
    private EstimationCache estimationCache;

    @Autowired
    @Qualifier("imageApplyExecutor")
    private AsyncTaskExecutor applyExecutor;

    @TempDir
    Path photos;

    @Test
    void contextLoads() {
        assertInstanceOf(ImageIoCodec.class, codec);
        assertTrue(formats.writableFormats().contains(ImageFormat.JPEG));
        assertTrue(formats.writableFormats().contains(ImageFormat.PNG));
        assertFalse(orchestrator.isRunning());
    }

    @Test
    void should_UseDedicatedThreadPrefix_When_ContextCreatesApplyExecutor() {
        ThreadPoolTaskExecutor executor = assertInstanceOf(ThreadPoolTaskExecutor.class, applyExecutor);
        assertEquals("image-apply-", executor.getThreadNamePrefix());
    }

    @Test
    void should_ConvertIngestedImages_When_BatchRunsThroughContext() throws Exception {
        Path source = photos.resolve("context.png");
        ImageIO.write(new BufferedImage(64, 32, BufferedImage.TYPE_INT_RGB), "png", source.toFile());
        List<ImageAsset> added = ingestion.ingest(List.of(photos));
        assertEquals(1, added.size());
        ImageAsset asset = added.get(0);
        estimationCache.merge(Map.of(asset.id(), 123L));

        BatchApplyResult result = orchestrator.apply(
            PipelineSettings.builder().targetFormat(ImageFormat.JPEG).build(),
            List.of(asset.id()),
            OverwriteConfirmation.NEVER).get(30, TimeUnit.SECONDS);

        assertEquals(BatchApplyStatus.COMPLETED, result.status());
        assertEquals(1, result.succeeded());
        assertTrue(Files.exists(photos.resolve("context.jpg")));
        assertTrue(library.find(asset.id()).orElseThrow().edited());
        assertTrue(estimationCache.get(asset.id()).isEmpty());
        library.remove(asset.id());
    }
}
