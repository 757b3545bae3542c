package com.purchasingpower.memory.configuration;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.AsyncConfigurer;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Thread pool for background indexing and normalization jobs.
 *
 * Jobs are submitted from controllers and polled by id, so the pool must never run
 * on the request thread.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class AsyncConfig implements AsyncConfigurer {

    public static final String JOB_EXECUTOR = "memoryJobExecutor";

    private final MemoryProperties properties;

    @Bean(name = JOB_EXECUTOR)
    @Override
    public Executor getAsyncExecutor() {
        JobProperties jobs = properties.getJobs();
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();

        executor.setCorePoolSize(jobs.getCorePoolSize());
        executor.setMaxPoolSize(Math.max(jobs.getCorePoolSize(), jobs.getMaxPoolSize()));
        executor.setQueueCapacity(jobs.getQueueCapacity());
        executor.setThreadNamePrefix("memory-job-");

        // Let running jobs finish their current file or phase on shutdown
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);

        executor.initialize();

        log.info("✅ Job executor configured: core={}, max={}, queue={}",
                executor.getCorePoolSize(),
                executor.getMaxPoolSize(),
                jobs.getQueueCapacity());

        return executor;
    }
}
