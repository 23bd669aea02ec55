package com.fry.backend.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;
import java.util.concurrent.ThreadPoolExecutor;

@Configuration
public class AsyncConfig {

    /**
     * Runs batch partitions. Each partition holds one trader's losses, so tasks never contend on an account.
     * A saturated pool runs the partition on the submitting thread instead of rejecting it.
     */
    @Bean(name = "scoringExecutor")
    public Executor scoringExecutor() {
        int processors = Runtime.getRuntime().availableProcessors();
        int corePoolSize = Math.min(4, processors);
        int maxPoolSize = Math.min(8, processors * 2);

        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(corePoolSize);
        executor.setMaxPoolSize(maxPoolSize);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("scoring-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }
}
