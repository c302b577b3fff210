package com.websubrelay.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

@Configuration
public class TaskExecutorConfig {

    /**
     * Fixed-size worker pool for queued jobs. No backlog queue: the poller only
     * receives as many messages as there are idle workers.
     */
    @Bean("eventJobExecutor")
    public ThreadPoolTaskExecutor eventJobExecutor(JobQueueProperties queueProperties) {
        int workers = Math.max(1, queueProperties.getConcurrency());
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(workers);
        executor.setMaxPoolSize(workers);
        executor.setQueueCapacity(0);
        executor.setThreadNamePrefix("EventWorker-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();
        return executor;
    }

    @Bean("queueHeartbeatScheduler")
    public ThreadPoolTaskScheduler queueHeartbeatScheduler(JobQueueProperties queueProperties) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(1, queueProperties.getConcurrency()));
        scheduler.setThreadNamePrefix("QueueHeartbeat-");
        scheduler.initialize();
        return scheduler;
    }

    // Picked up by name for @Scheduled methods (poller, renewal sweep, retention).
    @Bean("taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(3);
        scheduler.setThreadNamePrefix("Scheduled-");
        scheduler.initialize();
        return scheduler;
    }
}
