package com.guildauction.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class SchedulingConfig {

    private static final Logger log = LoggerFactory.getLogger(SchedulingConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Runs the per-auction monitors and delayed panel flushes.
     */
    @Bean
    public TaskScheduler auctionTaskScheduler(AuctionProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix("auction-monitor-");
        scheduler.setErrorHandler(t -> log.error("Unhandled error in auction scheduler: {}", t.getMessage(), t));
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    /**
     * Slow transport calls run here, never under an auction lock.
     */
    @Bean
    public ThreadPoolTaskExecutor auctionSideEffectExecutor(AuctionProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getSideEffectPoolSize());
        executor.setMaxPoolSize(properties.getSideEffectPoolSize());
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("auction-io-");
        return executor;
    }

    /**
     * Drains the per-auction write queues. Storage retries and their backoff sleep here,
     * never on the side-effect pool.
     */
    @Bean
    public ThreadPoolTaskExecutor auctionStorageExecutor(AuctionProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getStoragePoolSize());
        executor.setMaxPoolSize(properties.getStoragePoolSize());
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("auction-storage-");
        return executor;
    }
}
