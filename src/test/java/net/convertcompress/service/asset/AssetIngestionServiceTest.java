package net.convertcompress.service.asset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import net.convertcompress.model.ImageAsset;
import net.convertcompress.model.image.PixelSize;
import net.convertcompress.testutil.FakeImageCodec;
import net.convertcompress.testutil.TestEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.context.ApplicationEventPublisher;

class AssetIngestionServiceTest {

    @TempDir
    Path workspace;

    private AssetLibrary library;
    private AssetIngestionService ingestion;

    @BeforeEach
    void setUp() {
        FakeImageCodec codec = new FakeImageCodec();
        TestEngine engine = TestEngine.create(codec, workspace);
        library = new AssetLibrary(mock(ApplicationEventPublisher.class));
        ingestion = new AssetIngestionService(library, engine.formats, codec, engine.access);
    }

    @Test
    void should_WalkRecursivelyAndSkipHidden_When_IngestingDirectory() throws Exception {
        Path root = workspace.resolve("album");
        FakeImageCodec.writeImage(root, "a.png", 10, 20);
        FakeImageCodec.writeImage(root.resolve("nested"), "b.jpg", 30, 40);
        FakeImageCodec.writeImage(root.resolve(".cache"), "c.png", 1, 1);
        FakeImageCodec.writeImage(root, ".hidden.png", 1, 1);
        Files.writeString(root.resolve("notes.txt"), "not an image");
        FakeImageCodec.writeImage(root, "d.webp", 5, 5);

        List<ImageAsset> added = ingestion.ingest(List.of(root));

        assertThat(added).extracting(asset -> asset.originalPath().getFileName().toString())
            .containsExactly("a.png", "b.jpg");
        assertThat(added.get(1).originalPixelSize()).isEqualTo(new PixelSize(30, 40));
        assertThat(added.get(0).originalFileSizeBytes()).isPositive();
        assertThat(added).noneMatch(ImageAsset::edited);
    }

    @Test
    void should_KeepUnknownSize_When_ProbeFails() throws Exception {
        Path broken = Files.writeString(workspace.resolve("broken.png"), "garbage");

        List<ImageAsset> added = ingestion.ingest(List.of(broken));

        assertThat(added).singleElement().satisfies(asset -> {
            assertThat(asset.originalPixelSize()).isNull();
            assertThat(asset.originalFileSizeBytes()).isEqualTo(7L);
        });
    }

    @Test
    void should_NotDuplicate_When_SameFileIngestedTwice() throws Exception {
        Path file = FakeImageCodec.writeImage(workspace, "once.png", 4, 4);

        ingestion.ingest(List.of(file));
        List<ImageAsset> second = ingestion.ingest(List.of(file, workspace));

        assertThat(second).isEmpty();
        assertThat(library.size()).isEqualTo(1);
    }
}
