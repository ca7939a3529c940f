package com.lntracker.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * Named thread pools. Every dispatcher read loop, tracker live loop and pre-sync holds one
 * tracker thread for its whole lifetime, so the pool is sized for all of them and has no
 * queue: a task that finds no free thread is rejected instead of waiting forever.
 */
@Configuration
public class AsyncConfig {

    public static final String TRACKER_EXECUTOR = "tracker-executor";

    /** One thread per dispatcher plus two per tracker, with headroom. */
    public static final int TRACKER_POOL_SIZE = 32;

    @Bean(name = TRACKER_EXECUTOR)
    public Executor trackerExecutor() {
        ThreadPoolTaskExecutor e = new ThreadPoolTaskExecutor();
        e.setCorePoolSize(TRACKER_POOL_SIZE);
        e.setMaxPoolSize(TRACKER_POOL_SIZE);
        e.setQueueCapacity(0);
        e.setThreadNamePrefix("tracker-");
        e.setWaitForTasksToCompleteOnShutdown(true);
        e.setAwaitTerminationSeconds(30);
        e.initialize();
        return e;
    }
}
