package com.funnelanalytics.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for analysis work.
 *
 * - analysisExecutor: one task per analysis request or background job, mostly waiting on the warehouse
 * - matchingExecutor: CPU-bound per-session matching fanned out from inside an analysis
 *
 * Analyses block on their matching chunks, so the two must never share a pool.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Value("${async.analysis.core-pool-size:4}")
    private int analysisCorePoolSize;

    @Value("${async.analysis.max-pool-size:8}")
    private int analysisMaxPoolSize;

    @Value("${async.analysis.queue-capacity:100}")
    private int analysisQueueCapacity;

    @Value("${async.matching.pool-size:#{T(java.lang.Runtime).getRuntime().availableProcessors()}}")
    private int matchingPoolSize;

    @Value("${async.matching.queue-capacity:1000}")
    private int matchingQueueCapacity;

    @Bean(name = "analysisExecutor")
    public ThreadPoolTaskExecutor analysisExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(analysisCorePoolSize);
        executor.setMaxPoolSize(analysisMaxPoolSize);
        executor.setQueueCapacity(analysisQueueCapacity);
        executor.setThreadNamePrefix("analysis-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.AbortPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        log.info("Analysis executor configured - Core: {}, Max: {}, Queue: {}",
                analysisCorePoolSize, analysisMaxPoolSize, analysisQueueCapacity);
        return executor;
    }

    @Bean(name = "matchingExecutor")
    public ThreadPoolTaskExecutor matchingExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(matchingPoolSize);
        executor.setMaxPoolSize(matchingPoolSize);
        executor.setQueueCapacity(matchingQueueCapacity);
        executor.setThreadNamePrefix("matching-");
        // a full queue runs the chunk on the analysis thread instead of failing the request
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();

        log.info("Matching executor configured - Threads: {}, Queue: {}", matchingPoolSize, matchingQueueCapacity);
        return executor;
    }
}
