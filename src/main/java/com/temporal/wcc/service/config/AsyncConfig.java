package com.temporal.wcc.service.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Executors for asynchronous forest maintenance.
 */
@Slf4j
@Configuration
@EnableAsync
public class AsyncConfig {

    /**
     * Executor for merge passes triggered by ingestion. Passes coalesce, so one
     * thread is busy at a time and the queue only absorbs bursts of triggers.
     */
    @Bean(name = "mergeExecutor")
    public Executor mergeExecutor() {
        log.info("Initializing merge executor with platform thread pool");
        return createPlatformThreadPool("merge-", 1, 2, 100);
    }

    private ThreadPoolTaskExecutor createPlatformThreadPool(String prefix, int coreSize,
                                                             int maxSize, int queueCapacity) {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(coreSize);
        executor.setMaxPoolSize(maxSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix(prefix);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
