package com.sosapp.emergency.service;

import com.sosapp.emergency.config.EmergencyProperties;
import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;

/**
 * In-memory escalation timers, one per ACTIVE emergency. Each tick runs
 * {@link EscalationService#advance(UUID)} and re-arms itself for the returned instant.
 */
@Slf4j
@Component
public class EscalationMonitor {

    private final EscalationService escalationService;
    private final DeadlineTaskRegistry<UUID> timers;

    public EscalationMonitor(EscalationService escalationService,
                             TaskScheduler taskScheduler,
                             Clock clock,
                             EmergencyProperties properties,
                             DeadLetterQueueService deadLetterQueueService,
                             EmergencyMetrics metrics) {
        this.escalationService = escalationService;
        EmergencyProperties.TimerRetry retry = properties.getTimerRetry();
        this.timers = new DeadlineTaskRegistry<>("escalation", taskScheduler, clock,
                IntervalFunction.ofExponentialBackoff(retry.getInitialBackoff(), retry.getMultiplier(), retry.getMaxBackoff()),
                retry.getMaxAttempts(), deadLetterQueueService);
        metrics.registerTimerGauge("escalation", timers::size);
    }

    public void arm(UUID emergencyId, Instant nextCheckAt) {
        if (nextCheckAt == null) {
            return;
        }
        timers.schedule(emergencyId, nextCheckAt, () -> tick(emergencyId));
        log.debug("Escalation check for emergency {} armed at {}", emergencyId, nextCheckAt);
    }

    public void stop(UUID emergencyId) {
        if (timers.cancel(emergencyId)) {
            log.info("Escalation timer for emergency {} cancelled", emergencyId);
        }
    }

    public boolean isScheduled(UUID emergencyId) {
        return timers.isScheduled(emergencyId);
    }

    void tick(UUID emergencyId) {
        escalationService.advance(emergencyId).ifPresent(next -> arm(emergencyId, next));
    }
}
