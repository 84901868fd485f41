package net.convertcompress.application.apply;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.extern.slf4j.Slf4j;
import net.convertcompress.application.destination.AtomicFileCommitter;
import net.convertcompress.application.destination.DestinationPlanner;
import net.convertcompress.exception.ImageProcessingException;
import net.convertcompress.model.DestinationPlan;
import net.convertcompress.model.ImageAsset;
import net.convertcompress.processing.EncodedImage;
import net.convertcompress.processing.PipelineBuilder;
import net.convertcompress.processing.PipelineSettings;
import net.convertcompress.processing.ProcessingPipeline;
import net.convertcompress.service.asset.AssetLibrary;
import net.convertcompress.support.concurrency.BoundedWorkerPool;
import net.convertcompress.support.concurrency.BoundedWorkerPool.UnitOutcome;
import net.convertcompress.support.concurrency.ConcurrencyAdvisor;
import net.convertcompress.util.LoggingUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

/**
 * Runs one pipeline over many assets and commits the results.
 *
 * <p>Lifecycle per batch: build the pipeline once, preflight destination collisions
 * (asking for a single confirmation), run every asset through a
 * {@link BoundedWorkerPool}, then apply all updated records to the
 * {@link AssetLibrary} in one mutation and publish {@link BatchCompletedEvent}. Only one
 * batch runs at a time; a request while busy is rejected, not queued. A failing asset is
 * logged and left unchanged while the rest of the batch continues.</p>
 */
@Slf4j
@Service
public class BatchApplyOrchestrator {

    private final PipelineBuilder pipelineBuilder;
    private final DestinationPlanner destinationPlanner;
    private final AtomicFileCommitter committer;
    private final AssetLibrary library;
    private final ApplyProgressTracker progressTracker;
    private final ConcurrencyAdvisor concurrencyAdvisor;
    private final Executor applyExecutor;
    private final ApplicationEventPublisher eventPublisher;
    private final AtomicBoolean running = new AtomicBoolean(false);

    private final Counter batchCounter;
    private final Counter successCounter;
    private final Counter failureCounter;
    private final Timer unitTimer;

    public BatchApplyOrchestrator(PipelineBuilder pipelineBuilder,
                                  DestinationPlanner destinationPlanner,
                                  AtomicFileCommitter committer,
                                  AssetLibrary library,
                                  ApplyProgressTracker progressTracker,
                                  ConcurrencyAdvisor concurrencyAdvisor,
                                  @Qualifier("imageApplyExecutor") Executor applyExecutor,
                                  ApplicationEventPublisher eventPublisher,
                                  MeterRegistry meterRegistry) {
        this.pipelineBuilder = pipelineBuilder;
        this.destinationPlanner = destinationPlanner;
        this.committer = committer;
        this.library = library;
        this.progressTracker = progressTracker;
        this.concurrencyAdvisor = concurrencyAdvisor;
        this.applyExecutor = applyExecutor;
        this.eventPublisher = eventPublisher;

        this.batchCounter = meterRegistry.counter("convert.apply.batches");
        this.successCounter = meterRegistry.counter("convert.apply.success");
        this.failureCounter = meterRegistry.counter("convert.apply.failure");
        this.unitTimer = meterRegistry.timer("convert.apply.unit.duration");
    }

    /** Applies {@code settings} to every asset in the library. */
    public CompletableFuture<BatchApplyResult> applyAll(PipelineSettings settings, OverwriteConfirmation confirmation) {
        return apply(settings, library.snapshot().stream().map(ImageAsset::id).toList(), confirmation);
    }

    /**
     * Applies {@code settings} to the given assets.
     *
     * <p>The collision preflight and confirmation run on the calling thread; processing
     * runs on the apply executor. The returned future completes after the library has
     * been updated and the completion event published; a batch that cannot start fails
     * the future instead of throwing.</p>
     */
    public CompletableFuture<BatchApplyResult> apply(PipelineSettings settings, Collection<UUID> assetIds,
                                                     OverwriteConfirmation confirmation) {
        if (!running.compareAndSet(false, true)) {
            log.info("Rejecting batch apply request: a batch is already running");
            return CompletableFuture.completedFuture(BatchApplyResult.notStarted(BatchApplyStatus.REJECTED_BUSY, assetIds.size()));
        }
        try {
            List<ImageAsset> targets = resolveTargets(assetIds);
            if (targets.isEmpty()) {
                running.set(false);
                return CompletableFuture.completedFuture(BatchApplyResult.notStarted(BatchApplyStatus.NO_TARGETS, 0));
            }
            ProcessingPipeline pipeline = pipelineBuilder.build(settings);
            Map<UUID, DestinationPlan> plans = planAll(targets, pipeline);
            Optional<OverwriteSummary> collisions = findCollisions(plans);
            if (collisions.isPresent() && !confirmation.confirmOverwrite(collisions.get())) {
                log.info("Batch apply declined by user: {}", collisions.get().describe());
                running.set(false);
                return CompletableFuture.completedFuture(BatchApplyResult.notStarted(BatchApplyStatus.DECLINED, targets.size()));
            }
            return runBatch(targets, pipeline, plans);
        } catch (RuntimeException e) {
            running.set(false);
            LoggingUtils.error(log, e, "Batch apply could not start");
            return CompletableFuture.failedFuture(e);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public ApplyProgress getProgress() {
        return progressTracker.getProgress();
    }

    private CompletableFuture<BatchApplyResult> runBatch(List<ImageAsset> targets, ProcessingPipeline pipeline,
                                                         Map<UUID, DestinationPlan> plans) {
        int concurrency = concurrencyAdvisor.applyConcurrency();
        batchCounter.increment();
        progressTracker.start(targets.size());
        log.info("Starting batch apply of {} assets with concurrency {}", targets.size(), concurrency);

        return BoundedWorkerPool.<ImageAsset, Optional<ImageAsset>>run(
                targets,
                concurrency,
                applyExecutor,
                asset -> processUnit(asset, pipeline, plans.get(asset.id())),
                outcome -> {
                    if (!outcome.succeeded()) {
                        failureCounter.increment();
                        LoggingUtils.error(log, outcome.failure(), "Asset {} was not updated after a fatal error",
                            outcome.unit().displayName());
                    }
                    progressTracker.recordCompletion();
                })
            .handle((outcomes, error) -> {
                try {
                    if (error != null) {
                        LoggingUtils.error(log, error, "Batch apply aborted unexpectedly");
                        return finish(targets.size(), List.of());
                    }
                    return finish(targets.size(), outcomes);
                } finally {
                    progressTracker.reset();
                    running.set(false);
                }
            });
    }

    private Optional<ImageAsset> processUnit(ImageAsset asset, ProcessingPipeline pipeline, DestinationPlan plan) {
        Timer.Sample sample = Timer.start();
        try {
            EncodedImage encoded = pipeline.execute(asset.originalPath());
            Path committed = committer.commit(encoded.data(), plan);
            successCounter.increment();
            return Optional.of(asset.withCommittedResult(committed));
        } catch (ImageProcessingException e) {
            failureCounter.increment();
            LoggingUtils.warn(log, e, "Asset {} was not updated [failure={}]", asset.displayName(), e.getFailure());
            return Optional.empty();
        } catch (RuntimeException e) {
            failureCounter.increment();
            LoggingUtils.warn(log, e, "Asset {} was not updated after an unexpected error", asset.displayName());
            return Optional.empty();
        } finally {
            sample.stop(unitTimer);
        }
    }

    private BatchApplyResult finish(int total, List<UnitOutcome<ImageAsset, Optional<ImageAsset>>> outcomes) {
        List<ImageAsset> updated = new ArrayList<>();
        for (UnitOutcome<ImageAsset, Optional<ImageAsset>> outcome : outcomes) {
            if (outcome.succeeded() && outcome.result().isPresent()) {
                updated.add(outcome.result().get());
            }
        }
        library.applyUpdates(updated);
        progressTracker.reset();
        BatchApplyResult result = BatchApplyResult.completed(total, updated);
        log.info("Batch apply finished: {} updated, {} failed", result.succeeded(), result.failed());
        eventPublisher.publishEvent(new BatchCompletedEvent(updated, result.failed()));
        return result;
    }

    private List<ImageAsset> resolveTargets(Collection<UUID> assetIds) {
        List<ImageAsset> targets = new ArrayList<>();
        for (UUID id : new LinkedHashSet<>(assetIds)) {
            library.find(id).ifPresent(targets::add);
        }
        return targets;
    }

    private Map<UUID, DestinationPlan> planAll(List<ImageAsset> targets, ProcessingPipeline pipeline) {
        Map<UUID, DestinationPlan> plans = new HashMap<>();
        for (ImageAsset asset : targets) {
            plans.put(asset.id(), destinationPlanner.plan(asset, pipeline));
        }
        return plans;
    }

    private static Optional<OverwriteSummary> findCollisions(Map<UUID, DestinationPlan> plans) {
        List<Path> collisions = plans.values().stream()
            .map(DestinationPlan::path)
            .filter(Files::exists)
            .distinct()
            .sorted()
            .toList();
        return collisions.isEmpty() ? Optional.empty() : Optional.of(OverwriteSummary.of(collisions));
    }
}
