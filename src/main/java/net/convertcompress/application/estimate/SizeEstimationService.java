package net.convertcompress.application.estimate;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import lombok.extern.slf4j.Slf4j;
import net.convertcompress.config.ProcessingProperties;
import net.convertcompress.model.ImageAsset;
import net.convertcompress.processing.PipelineBuilder;
import net.convertcompress.processing.PipelineSettings;
import net.convertcompress.processing.ProcessingPipeline;
import net.convertcompress.util.LoggingUtils;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * Predicts output byte sizes for the visible assets without writing anything.
 *
 * <p>Estimation runs the cheaper pipeline variant (no flips, no background removal) in
 * fixed-size sequential batches, each batch fanned out in parallel. Every new request
 * cancels the previous one; a superseded request never merges into the
 * {@link EstimationCache}. A failing asset simply has no estimate.</p>
 */
@Slf4j
@Service
public class SizeEstimationService {

    private final PipelineBuilder pipelineBuilder;
    private final EstimationCache cache;
    private final Scheduler scheduler;
    private final int batchSize;
    private final Duration debounce;
    private final Counter cancelledCounter;

    private long generation;
    private Disposable inFlight;
    private CompletableFuture<Map<UUID, Long>> inFlightResult;

    @Autowired
    public SizeEstimationService(PipelineBuilder pipelineBuilder,
                                 EstimationCache cache,
                                 ProcessingProperties properties,
                                 @Qualifier("imageEstimationExecutor") Executor estimationExecutor,
                                 MeterRegistry meterRegistry) {
        this(pipelineBuilder, cache, properties, Schedulers.fromExecutor(estimationExecutor), meterRegistry);
    }

    SizeEstimationService(PipelineBuilder pipelineBuilder,
                          EstimationCache cache,
                          ProcessingProperties properties,
                          Scheduler scheduler,
                          MeterRegistry meterRegistry) {
        this.pipelineBuilder = pipelineBuilder;
        this.cache = cache;
        this.scheduler = scheduler;
        this.batchSize = properties.getEstimation().getBatchSize();
        this.debounce = properties.getEstimation().getDebounce();
        this.cancelledCounter = meterRegistry.counter("convert.estimate.cancelled");
    }

    /**
     * Starts estimating {@code assets}, cancelling any request still in flight.
     *
     * @param debounced wait for the configured quiet period first (settings changes)
     */
    public synchronized EstimationTicket requestEstimate(PipelineSettings settings, List<ImageAsset> assets,
                                                         boolean debounced) {
        long ticket = ++generation;
        cancelInFlight();

        CompletableFuture<Map<UUID, Long>> result = new CompletableFuture<>();
        Mono<Long> delay = debounced && !debounce.isZero()
            ? Mono.delay(debounce)
            : Mono.just(0L);
        inFlightResult = result;
        inFlight = delay
            .then(Mono.defer(() -> estimate(settings, assets)))
            .subscribe(
                estimates -> mergeIfCurrent(ticket, estimates, result),
                error -> {
                    LoggingUtils.debug(log, error, "Estimation request {} failed", ticket);
                    result.completeExceptionally(error);
                });
        return new EstimationTicket(ticket, result);
    }

    /** Cancels the request in flight, if any. */
    public synchronized void cancel() {
        generation++;
        cancelInFlight();
    }

    /**
     * Cold estimation of {@code assets}; subscribing runs it. Does not touch the cache.
     */
    public Mono<Map<UUID, Long>> estimate(PipelineSettings settings, List<ImageAsset> assets) {
        ProcessingPipeline pipeline = pipelineBuilder.buildForEstimation(settings);
        return Flux.fromIterable(assets)
            .buffer(batchSize)
            .concatMap(batch -> Flux.fromIterable(batch)
                .flatMap(asset -> estimateOne(pipeline, asset), batchSize))
            .collectMap(Estimate::assetId, Estimate::bytes);
    }

    private Mono<Estimate> estimateOne(ProcessingPipeline pipeline, ImageAsset asset) {
        return Mono.fromCallable(() -> new Estimate(asset.id(), pipeline.render(asset).sizeInBytes()))
            .subscribeOn(scheduler)
            .onErrorResume(error -> {
                log.debug("No size estimate for {}: {}", asset.displayName(), error.getMessage());
                return Mono.empty();
            });
    }

    private synchronized void mergeIfCurrent(long ticket, Map<UUID, Long> estimates,
                                             CompletableFuture<Map<UUID, Long>> result) {
        if (ticket != generation) {
            result.cancel(false);
            return;
        }
        cache.merge(estimates);
        result.complete(estimates);
    }

    private void cancelInFlight() {
        if (inFlight != null && !inFlight.isDisposed()) {
            inFlight.dispose();
            cancelledCounter.increment();
        }
        if (inFlightResult != null && !inFlightResult.isDone()) {
            inFlightResult.cancel(false);
        }
        inFlight = null;
        inFlightResult = null;
    }

    private record Estimate(UUID assetId, long bytes) {
    }
}
