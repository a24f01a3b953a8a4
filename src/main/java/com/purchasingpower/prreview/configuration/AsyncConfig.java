package com.purchasingpower.prreview.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool the orchestrator fans analysis stages out on.
 *
 * Core size should cover the number of registered stages so that no stage waits
 * in the queue while its timeout is already running.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    @Bean(name = "reviewStageExecutor")
    public ThreadPoolTaskExecutor reviewStageExecutor(AppProperties props) {
        ReviewProperties review = props.getReview();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(review.getExecutorCoreSize());
        executor.setMaxPoolSize(Math.max(review.getExecutorCoreSize(), review.getExecutorMaxSize()));
        executor.setQueueCapacity(review.getExecutorQueueCapacity());
        executor.setThreadNamePrefix("review-stage-");

        // Let in-flight reviews finish on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();

        log.info("Review stage executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                review.getExecutorQueueCapacity());

        return executor;
    }
}
