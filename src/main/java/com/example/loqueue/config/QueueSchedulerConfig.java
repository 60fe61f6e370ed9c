package com.example.loqueue.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Provides the scheduler on which {@link com.example.loqueue.queue.ClaimLoop} iterations run, and
 * the clock used for every queue timestamp.
 */
@Configuration
public class QueueSchedulerConfig {

    @Bean(name = "queueTaskScheduler")
    public ThreadPoolTaskScheduler queueTaskScheduler(QueueProperties properties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getSchedulerPoolSize());
        scheduler.setThreadNamePrefix(properties.getThreadNamePrefix());
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        return scheduler;
    }

    @Bean
    public Clock queueClock() {
        return Clock.systemUTC();
    }
}
