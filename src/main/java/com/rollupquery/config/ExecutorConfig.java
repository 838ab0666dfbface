package com.rollupquery.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/**
 * Thread pool for batch query execution. Workers share the router and the
 * result cache, which do their own locking.
 */
@Configuration
public class ExecutorConfig {

    @Bean
    public ThreadPoolTaskExecutor queryExecutor(QueryProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getBatchParallelism());
        executor.setMaxPoolSize(properties.getBatchParallelism());
        executor.setQueueCapacity(properties.getBatchQueueCapacity());
        executor.setThreadNamePrefix("query-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }
}
