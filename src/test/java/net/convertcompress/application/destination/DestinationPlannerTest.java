package net.convertcompress.application.destination;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import net.convertcompress.model.DestinationPlan;
import net.convertcompress.model.ImageAsset;
import net.convertcompress.model.image.ImageFormat;
import net.convertcompress.processing.PipelineSettings;
import net.convertcompress.processing.ProcessingPipeline;
import net.convertcompress.testutil.FakeImageCodec;
import net.convertcompress.testutil.TestEngine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DestinationPlannerTest {

    @TempDir
    Path workspace;

    private TestEngine engine;
    private DestinationPlanner planner;

    @BeforeEach
    void setUp() {
        engine = TestEngine.create(new FakeImageCodec(), workspace);
        planner = engine.planner;
    }

    @Test
    void should_PlanNextToSource_When_NoExportDirectory() {
        Path source = workspace.resolve("photos/holiday.png");

        DestinationPlan plan = planner.plan(source, ImageFormat.JPEG, null);

        assertThat(plan.path()).isEqualTo(workspace.resolve("photos/holiday.jpg"));
        assertThat(plan.directory()).isEqualTo(workspace.resolve("photos"));
        assertThat(plan.filenameStem()).isEqualTo("holiday");
        assertThat(plan.extension()).isEqualTo("jpg");
    }

    @Test
    void should_UseExportDirectory_When_Configured() {
        Path export = workspace.resolve("export");

        DestinationPlan plan = planner.plan(workspace.resolve("photos/holiday.png"), ImageFormat.TIFF, export);

        assertThat(plan.path()).isEqualTo(export.resolve("holiday.tiff"));
    }

    @Test
    void should_RedirectToDownloads_When_SourceLivesUnderTempRoot() {
        Path pasted = engine.properties.getDestination().getTempRoot().resolve("clip/pasted.png");

        DestinationPlan plan = planner.plan(pasted, ImageFormat.PNG, null);

        assertThat(planner.isTempSourced(pasted)).isTrue();
        assertThat(plan.path()).isEqualTo(engine.properties.getDestination().getDownloadsDirectory().resolve("pasted.png"));
    }

    @Test
    void should_PreferExportDirectory_When_SourceLivesUnderTempRoot() {
        Path pasted = engine.properties.getDestination().getTempRoot().resolve("pasted.png");
        Path export = workspace.resolve("export");

        assertThat(planner.plan(pasted, ImageFormat.PNG, export).path()).isEqualTo(export.resolve("pasted.png"));
    }

    @Test
    void should_NotTouchFilesystem_When_Planning() {
        Path missing = workspace.resolve("does/not/exist/ghost.bmp");

        DestinationPlan plan = planner.plan(missing, ImageFormat.BMP, null);

        assertThat(plan.path()).isEqualTo(workspace.resolve("does/not/exist/ghost.bmp"));
        assertThat(plan.directory()).doesNotExist();
    }

    @Test
    void should_FollowPipelineFormat_When_PlanningForAsset() {
        ImageAsset asset = ImageAsset.ingested(workspace.resolve("photos/cat.png"), null, null);
        ProcessingPipeline pipeline = engine.pipelineBuilder.build(
            PipelineSettings.builder().targetFormat(ImageFormat.WEBP).build());

        assertThat(planner.plannedDestination(asset, pipeline)).isEqualTo(workspace.resolve("photos/cat.png"));
    }

    @Test
    void should_FallBackToUserHome_When_DownloadsDirectoryMissing() {
        DestinationPlanner bare = new DestinationPlanner(engine.formats, null, null);

        assertThat(bare.isTempSourced(workspace.resolve("a.png"))).isFalse();
        assertThat(bare.plan(workspace.resolve("a.png"), ImageFormat.PNG, null).directory()).isEqualTo(workspace);
    }
}
