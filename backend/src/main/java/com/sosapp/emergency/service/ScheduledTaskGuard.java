package com.sosapp.emergency.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Keeps a failing polling job from killing its schedule.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScheduledTaskGuard {

    private final MeterRegistry meterRegistry;

    public void run(String taskName, Runnable task) {
        try {
            task.run();
        } catch (Throwable t) {
            log.error("Scheduled task failed task={}", taskName, t);
            Counter.builder("scheduled_task_failures_total")
                    .tag("task", taskName)
                    .register(meterRegistry)
                    .increment();
        }
    }
}
