package com.architecture.memory.workflowscan.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Whole scans run on {@code scanExecutor}, off the request threads. File-level parallelism inside
 * one scan uses the builder's own worker pool.
 */
@Configuration
@EnableAsync
@EnableScheduling
public class AsyncConfig {

    public static final String SCAN_EXECUTOR = "scanExecutor";

    @Bean(name = SCAN_EXECUTOR)
    public ThreadPoolTaskExecutor scanExecutor(ScannerProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getExecutor().getConcurrentScans());
        executor.setMaxPoolSize(properties.getExecutor().getConcurrentScans());
        executor.setQueueCapacity(properties.getExecutor().getQueueCapacity());
        executor.setThreadNamePrefix("scan-");
        executor.setWaitForTasksToCompleteOnShutdown(false);
        executor.initialize();
        return executor;
    }
}
