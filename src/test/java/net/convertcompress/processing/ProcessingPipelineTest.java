package net.convertcompress.processing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import net.convertcompress.codec.EditableImage;
import net.convertcompress.codec.EncodeRequest;
import net.convertcompress.exception.ImageExportException;
import net.convertcompress.exception.ImageLoadException;
import net.convertcompress.exception.ImageProcessingException;
import net.convertcompress.exception.PermissionDeniedException;
import net.convertcompress.exception.ProcessingFailure;
import net.convertcompress.model.ImageAsset;
import net.convertcompress.model.image.FlipAxis;
import net.convertcompress.model.image.ImageFormat;
import net.convertcompress.model.image.ImageMetadata;
import net.convertcompress.model.image.PixelSize;
import net.convertcompress.processing.operation.ConstrainToFormatSizeOperation;
import net.convertcompress.processing.operation.FlipOperation;
import net.convertcompress.processing.operation.RemoveBackgroundOperation;
import net.convertcompress.processing.operation.ResizeOperation;
import net.convertcompress.support.sandbox.SandboxAccessManager;
import net.convertcompress.testutil.FakeImageCodec;
import net.convertcompress.testutil.TestEngine;
import net.convertcompress.util.PathUtils;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ProcessingPipelineTest {

    @TempDir
    Path workspace;

    private FakeImageCodec codec;
    private TestEngine engine;
    private Path source;

    @BeforeEach
    void setUp() throws Exception {
        codec = new FakeImageCodec();
        engine = TestEngine.create(codec, workspace);
        source = FakeImageCodec.writeImage(workspace.resolve("photos"), "square.png", 1000, 1000);
    }

    @Test
    void should_ApplyOperationsInListOrder_When_Executing() {
        PipelineSettings icon = PipelineSettings.builder().targetFormat(ImageFormat.ICO).build();

        EncodedImage resizeFirst = engine.pipelineBuilder.withOperations(icon, List.of(
            ResizeOperation.percent(0.5), new ConstrainToFormatSizeOperation(ImageFormat.ICO))).execute(source);
        EncodedImage constrainFirst = engine.pipelineBuilder.withOperations(icon, List.of(
            new ConstrainToFormatSizeOperation(ImageFormat.ICO), ResizeOperation.percent(0.5))).execute(source);

        assertThat(resizeFirst.pixelSize()).isEqualTo(PixelSize.square(256));
        assertThat(constrainFirst.pixelSize()).isEqualTo(PixelSize.square(128));
        assertThat(resizeFirst.format()).isEqualTo(ImageFormat.ICO);
    }

    @Test
    void should_KeepSourceFormat_When_NoTargetRequested() {
        EncodedImage encoded = engine.pipelineBuilder.build(PipelineSettings.defaults()).execute(source);

        assertThat(encoded.format()).isEqualTo(ImageFormat.PNG);
        assertThat(encoded.pixelSize()).isEqualTo(PixelSize.square(1000));
        assertThat(codec.transforms()).isEmpty();
    }

    @Test
    void should_WriteNoSourceMetadata_When_StrippingMetadata() {
        engine.pipelineBuilder.build(PipelineSettings.builder().stripMetadata(true).build()).execute(source);
        engine.pipelineBuilder.build(PipelineSettings.builder().stripMetadata(false).build()).execute(source);

        List<EncodeRequest> requests = codec.encodeRequests();
        assertThat(requests.get(0).stripMetadata()).isTrue();
        assertThat(requests.get(0).metadata().entries()).isEmpty();
        assertThat(requests.get(1).metadata().entries())
            .containsEntry("Author", "fixture")
            .containsEntry(ImageMetadata.ORIENTATION_KEY, "1");
    }

    @Test
    void should_ClampQuality_When_OutOfRange() {
        assertThat(ProcessingPipeline.clampQuality(3.0)).isEqualTo(1.0);
        assertThat(ProcessingPipeline.clampQuality(-1.0)).isEqualTo(0.01);
        assertThat(ProcessingPipeline.clampQuality(Double.NaN)).isNull();
        assertThat(ProcessingPipeline.clampQuality(null)).isNull();

        engine.pipelineBuilder.build(PipelineSettings.builder()
            .targetFormat(ImageFormat.JPEG).quality(7.0).build()).execute(source);
        assertThat(codec.encodeRequests().get(0).quality()).isEqualTo(1.0);
    }

    @Test
    void should_AbortWithoutEncoding_When_OperationFails() {
        ProcessingPipeline pipeline = engine.pipelineBuilder.withOperations(PipelineSettings.defaults(),
            List.of(new FlipOperation(FlipAxis.VERTICAL), new RemoveBackgroundOperation()));

        assertThatThrownBy(() -> pipeline.execute(source))
            .isInstanceOf(ImageProcessingException.class)
            .satisfies(e -> assertThat(((ImageProcessingException) e).getFailure())
                .isEqualTo(ProcessingFailure.BACKGROUND_REMOVAL_UNAVAILABLE));
        assertThat(codec.encodeCalls()).isZero();
        assertThat(engine.access.totalActiveTokens()).isZero();
    }

    @Test
    void should_SurfaceLoadFailure_When_SourceCannotBeDecoded() {
        codec.failOn("square.png");

        assertThatThrownBy(() -> engine.pipelineBuilder.build(PipelineSettings.defaults()).execute(source))
            .isInstanceOf(ImageLoadException.class);
    }

    @Test
    void should_DenyAccess_When_SourceIsOutsideGrantedRoots() {
        ProcessingPipeline pipeline = ProcessingPipeline.builder()
            .codec(codec)
            .formats(engine.formats)
            .access(new SandboxAccessManager(true, List.of(workspace.resolve("elsewhere"))))
            .build();

        assertThatThrownBy(() -> pipeline.execute(source)).isInstanceOf(PermissionDeniedException.class);
        assertThat(codec.decodeCalls()).isZero();
    }

    @Test
    void should_WriteScratchFile_When_RenderingToTemporaryFile() throws Exception {
        ProcessingPipeline pipeline = engine.pipelineBuilder.build(
            PipelineSettings.builder().targetFormat(ImageFormat.JPEG).build());

        Path rendered = pipeline.renderToTemporaryFile(ImageAsset.ingested(source, null, null));

        assertThat(rendered.getParent()).isEqualTo(engine.properties.getDestination().getTempRoot());
        assertThat(PathUtils.isTemporarySibling(rendered)).isTrue();
        assertThat(rendered.getFileName().toString()).startsWith("square_tmp_").endsWith(".jpg");
        assertThat(Files.size(rendered)).isPositive();
        assertThat(source).exists();
    }

    @Test
    void should_FallBackToWritableFormat_When_TargetCannotBeEncoded() {
        EncodedImage encoded = engine.pipelineBuilder.build(
            PipelineSettings.builder().targetFormat(ImageFormat.WEBP).build()).execute(source);

        assertThat(encoded.format()).isEqualTo(ImageFormat.PNG);
    }

    @Test
    void should_WrapUnexpectedEncoderErrors_When_Encoding() {
        FakeImageCodec crashingCodec = new FakeImageCodec(FakeImageCodec.DEFAULT_FORMATS, FakeImageCodec.DEFAULT_FORMATS) {
            @Override
            public byte[] encode(EditableImage image, EncodeRequest request) {
                throw new IllegalStateException("encoder crashed");
            }
        };
        TestEngine crashing = TestEngine.create(crashingCodec, workspace);

        assertThatThrownBy(() -> crashing.pipelineBuilder.build(PipelineSettings.defaults()).execute(source))
            .isInstanceOf(ImageExportException.class)
            .hasMessageContaining("encoder crashed");
    }
}
