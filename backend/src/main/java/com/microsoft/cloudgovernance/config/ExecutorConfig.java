package com.microsoft.cloudgovernance.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Worker pools for the assessment pipeline.
 *
 * POOLS:
 * - assessmentExecutor: one thread per running assessment; a full queue rejects
 *   new runs, which then fail immediately instead of waiting unbounded
 * - inventoryFetchExecutor: per-subscription Resource Graph fetches; a full queue
 *   runs the fetch on the calling pipeline thread
 */
@Configuration
@Slf4j
public class ExecutorConfig {

    @Bean(name = "assessmentExecutor")
    public ThreadPoolTaskExecutor assessmentExecutor(
            @Value("${compass.assessment.workers:4}") int workers,
            @Value("${compass.assessment.queue-capacity:100}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("assessment-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        log.info("Assessment executor: {} workers, queue {}", workers, queueCapacity);
        return executor;
    }

    @Bean(name = "inventoryFetchExecutor")
    public ThreadPoolTaskExecutor inventoryFetchExecutor(
            @Value("${compass.inventory.fetch-concurrency:8}") int concurrency,
            @Value("${compass.inventory.queue-capacity:200}") int queueCapacity
    ) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(concurrency);
        executor.setMaxPoolSize(concurrency);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("inventory-fetch-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.initialize();
        return executor;
    }
}
