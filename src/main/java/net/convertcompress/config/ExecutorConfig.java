package net.convertcompress.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Dedicated executors for apply, estimation and thumbnail work.
 *
 * <p>Callers bound their own concurrency (worker pool, sequential batches, admission
 * gate), so each pool only needs enough threads to honour the largest bound it can be
 * asked for.</p>
 */
@Configuration
public class ExecutorConfig {

    /**
     * Sized for the boosted apply concurrency ceiling.
     */
    @Bean("imageApplyExecutor")
    public AsyncTaskExecutor imageApplyExecutor(ProcessingProperties properties) {
        ProcessingProperties.Concurrency concurrency = properties.getConcurrency();
        int boostedCeiling = (int) Math.ceil(concurrency.getMax() * concurrency.getApplyBoost());
        int threads = Math.max(boostedCeiling, concurrency.getOverride());
        return fixedPool("image-apply-", threads);
    }

    @Bean("imageEstimationExecutor")
    public AsyncTaskExecutor imageEstimationExecutor(ProcessingProperties properties) {
        int processors = Runtime.getRuntime().availableProcessors();
        int threads = Math.max(properties.getEstimation().getBatchSize(), Math.max(2, processors));
        return fixedPool("image-estimate-", threads);
    }

    @Bean("thumbnailExecutor")
    public AsyncTaskExecutor thumbnailExecutor(ProcessingProperties properties) {
        return fixedPool("image-thumb-", properties.getThumbnails().getMaxConcurrent());
    }

    private static ThreadPoolTaskExecutor fixedPool(String threadNamePrefix, int threads) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(threads);
        executor.setMaxPoolSize(threads);
        executor.setQueueCapacity(Integer.MAX_VALUE);
        executor.setThreadNamePrefix(threadNamePrefix);
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
