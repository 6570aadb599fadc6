package com.sosapp.emergency.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

/**
 * Scheduler shared by the countdown and escalation timers, the outbox relay and the notification
 * worker. Polling jobs can be switched off with {@code sos.scheduling.enabled=false}; deadline timers
 * keep working because they are registered programmatically.
 */
@Slf4j
@Configuration
public class SchedulingConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public TaskScheduler taskScheduler() {
        int processors = Runtime.getRuntime().availableProcessors();
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(Math.max(4, processors));
        scheduler.setThreadNamePrefix("emergency-timer-");
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.setErrorHandler(t -> log.error("Unhandled error in scheduled task", t));
        scheduler.initialize();
        return scheduler;
    }

    @Configuration
    @EnableScheduling
    @ConditionalOnProperty(name = "sos.scheduling.enabled", havingValue = "true", matchIfMissing = true)
    static class PollingSchedules {
    }
}
