package com.example.standupbot.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * Threads and time source of the notification engine.
 * <p>
 * - One dispatch thread runs every job and applies every response event
 * - A bounded pool carries outbound Slack calls so each can be cut off by a timeout
 * - Spring's @Async executor sends operator alerts off the dispatch thread
 */
@Slf4j
@EnableAsync
@Configuration
public class SchedulerConfig {

    @Bean
    public Clock clock(StandupBotProperties properties) {
        var zone = properties.zone();
        log.info("Engine clock running in zone {}", zone);
        return Clock.system(zone);
    }

    /**
     * The single scheduling thread. Delayed ticks are dropped on shutdown;
     * the job already running is allowed to finish.
     */
    @Bean(name = "dispatchExecutor", destroyMethod = "shutdownNow")
    public ScheduledExecutorService dispatchExecutor() {
        log.info("Creating single-threaded dispatch executor");

        var executor = new ScheduledThreadPoolExecutor(1, new CustomizableThreadFactory("dispatch-loop-"));
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
        executor.setRemoveOnCancelPolicy(true);
        return executor;
    }

    /**
     * Pool for outbound Slack calls.
     */
    @Bean(name = "notifierCallExecutor", destroyMethod = "shutdownNow")
    public ExecutorService notifierCallExecutor(StandupBotProperties properties) {
        log.info("Creating notifier call executor with {} threads", properties.getNotifierPoolSize());

        var factory = new CustomizableThreadFactory("notifier-call-");
        factory.setDaemon(true);
        return Executors.newFixedThreadPool(properties.getNotifierPoolSize(), factory);
    }

    /**
     * Task executor for Spring's @Async annotation.
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        log.info("Configuring Spring TaskExecutor for async alerts");

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("async-alert-");
        executor.setRejectedExecutionHandler((r, e) -> log.warn("Alert rejected from async executor, dropping it"));
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(10);
        executor.initialize();

        return executor;
    }
}
