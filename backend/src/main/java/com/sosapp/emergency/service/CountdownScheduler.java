package com.sosapp.emergency.service;

import com.sosapp.emergency.config.EmergencyProperties;
import com.sosapp.emergency.model.Emergency;
import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * Countdown timers of PENDING emergencies. Cancelling here only saves a wasted tick: the fire path
 * re-checks the status under the row lock, so a cancel that commits first always wins.
 */
@Slf4j
@Component
public class CountdownScheduler {

    private final EmergencyStateMachine stateMachine;
    private final EscalationMonitor escalationMonitor;
    private final DeadlineTaskRegistry<UUID> timers;

    public CountdownScheduler(EmergencyStateMachine stateMachine,
                              EscalationMonitor escalationMonitor,
                              TaskScheduler taskScheduler,
                              Clock clock,
                              EmergencyProperties properties,
                              DeadLetterQueueService deadLetterQueueService,
                              EmergencyMetrics metrics) {
        this.stateMachine = stateMachine;
        this.escalationMonitor = escalationMonitor;
        EmergencyProperties.TimerRetry retry = properties.getTimerRetry();
        this.timers = new DeadlineTaskRegistry<>("countdown", taskScheduler, clock,
                IntervalFunction.ofExponentialBackoff(retry.getInitialBackoff(), retry.getMultiplier(), retry.getMaxBackoff()),
                retry.getMaxAttempts(), deadLetterQueueService);
        metrics.registerTimerGauge("countdown", timers::size);
    }

    public void start(Emergency emergency) {
        arm(emergency.getId(), emergency.countdownDeadline());
    }

    public void arm(UUID emergencyId, Instant deadline) {
        timers.schedule(emergencyId, deadline, () -> fire(emergencyId));
        log.info("Countdown for emergency {} armed, activates at {}", emergencyId, deadline);
    }

    public void cancel(UUID emergencyId) {
        if (timers.cancel(emergencyId)) {
            log.info("Countdown for emergency {} cancelled", emergencyId);
        }
    }

    public boolean isScheduled(UUID emergencyId) {
        return timers.isScheduled(emergencyId);
    }

    void fire(UUID emergencyId) {
        stateMachine.activate(emergencyId)
                .ifPresent(result -> escalationMonitor.arm(emergencyId, result.escalation().getNextCheckAt()));
    }
}
