package com.fvgscanner.config;

import java.util.concurrent.ThreadPoolExecutor;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Worker pool for per-symbol scans. Each symbol's pipeline runs on one worker from
 * start to finish; symbols share nothing but this pool.
 */
@Configuration
public class AsyncConfig {

    @Value("${fvgscanner.async.core-pool-size:4}")
    private int corePoolSize;

    @Value("${fvgscanner.async.max-pool-size:8}")
    private int maxPoolSize;

    @Value("${fvgscanner.async.queue-capacity:500}")
    private int queueCapacity;

    @Bean("scanExecutor")
    public ThreadPoolTaskExecutor scanExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("scan-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        return executor;
    }
}
