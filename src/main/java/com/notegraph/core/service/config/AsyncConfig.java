package com.notegraph.core.service.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Executors used by the persistence pipeline.
 *
 * The export executor runs snapshot exports and file writes; the task scheduler
 * drives the idle debounce timer.
 */
@Slf4j
@Configuration
public class AsyncConfig {

    // ==================== Executor Beans ====================

    /**
     * Executor for export and write operations.
     */
    @Bean(name = "exportExecutor")
    public ThreadPoolTaskExecutor exportExecutor() {
        log.info("Initializing export executor with platform thread pool");
        var executor = createPlatformThreadPool("export-", 2, 4, 50);
        // the shutdown flush submits its writes after the context has started closing
        executor.setAcceptTasksAfterContextClose(true);
        return executor;
    }

    /**
     * Scheduler for debounced flushes.
     */
    @Bean(name = "persistenceTaskScheduler")
    public ThreadPoolTaskScheduler persistenceTaskScheduler() {
        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("persist-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        scheduler.initialize();
        return scheduler;
    }

    // ==================== Helper Methods ====================

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
