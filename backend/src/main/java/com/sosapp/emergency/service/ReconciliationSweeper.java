package com.sosapp.emergency.service;

import com.sosapp.emergency.config.EmergencyProperties;
import com.sosapp.emergency.model.Emergency;
import com.sosapp.emergency.model.EmergencyStatus;
import com.sosapp.emergency.model.EscalationState;
import com.sosapp.emergency.repository.EmergencyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.UUID;

/**
 * Rebuilds the in-memory countdown and escalation timers from persisted deadlines. Runs once when the
 * application is ready and then periodically, so a timer dropped for any reason is re-armed within one
 * sweep interval.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReconciliationSweeper {

    private final EmergencyRepository emergencyRepository;
    private final EscalationService escalationService;
    private final CountdownScheduler countdownScheduler;
    private final EscalationMonitor escalationMonitor;
    private final ScheduledTaskGuard scheduledTaskGuard;
    private final EmergencyProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!properties.getReconciliation().isOnStartup()) {
            return;
        }
        log.info("Rehydrating emergency timers on startup");
        scheduledTaskGuard.run("timerReconciliationStartup", this::sweep);
    }

    @Scheduled(fixedDelayString = "${sos.emergency.reconciliation.sweep-interval-ms:60000}",
            initialDelayString = "${sos.emergency.reconciliation.sweep-interval-ms:60000}")
    public void periodicSweep() {
        scheduledTaskGuard.run("timerReconciliation", this::sweep);
    }

    public SweepResult sweep() {
        int countdowns = 0;
        int escalations = 0;
        List<Emergency> pending = emergencyRepository.findByStatus(EmergencyStatus.PENDING);
        for (Emergency emergency : pending) {
            if (rearmCountdown(emergency)) {
                countdowns++;
            }
        }
        List<Emergency> active = emergencyRepository.findByStatus(EmergencyStatus.ACTIVE);
        for (Emergency emergency : active) {
            if (rearmEscalation(emergency.getId())) {
                escalations++;
            }
        }
        SweepResult result = new SweepResult(pending.size(), active.size(), countdowns, escalations);
        if (countdowns > 0 || escalations > 0) {
            log.info("Timer reconciliation: pending={} active={} countdownsRearmed={} escalationsRearmed={}",
                    result.pending(), result.active(), countdowns, escalations);
        } else {
            log.debug("Timer reconciliation found nothing to re-arm (pending={}, active={})",
                    result.pending(), result.active());
        }
        return result;
    }

    /**
     * Re-arms whatever timer the emergency's persisted status calls for.
     */
    public void reconcile(UUID emergencyId) {
        emergencyRepository.findById(emergencyId).ifPresent(emergency -> {
            if (emergency.getStatus() == EmergencyStatus.PENDING) {
                rearmCountdown(emergency);
            } else if (emergency.getStatus() == EmergencyStatus.ACTIVE) {
                rearmEscalation(emergencyId);
            }
        });
    }

    private boolean rearmCountdown(Emergency emergency) {
        if (countdownScheduler.isScheduled(emergency.getId())) {
            return false;
        }
        MDC.put("emergencyId", emergency.getId().toString());
        try {
            log.info("Re-arming countdown for emergency {} (deadline {})", emergency.getId(), emergency.countdownDeadline());
            countdownScheduler.start(emergency);
            return true;
        } catch (RuntimeException ex) {
            log.error("Could not re-arm countdown for emergency {}", emergency.getId(), ex);
            return false;
        } finally {
            MDC.remove("emergencyId");
        }
    }

    private boolean rearmEscalation(UUID emergencyId) {
        if (escalationMonitor.isScheduled(emergencyId)) {
            return false;
        }
        MDC.put("emergencyId", emergencyId.toString());
        try {
            EscalationState state = escalationService.recover(emergencyId).orElse(null);
            if (state == null || state.isStopped() || state.getNextCheckAt() == null) {
                return false;
            }
            log.info("Resuming escalation for emergency {} at tier {} (next check {})",
                    emergencyId, state.getCurrentTier(), state.getNextCheckAt());
            escalationMonitor.arm(emergencyId, state.getNextCheckAt());
            return true;
        } catch (RuntimeException ex) {
            log.error("Could not resume escalation for emergency {}", emergencyId, ex);
            return false;
        } finally {
            MDC.remove("emergencyId");
        }
    }

    public record SweepResult(int pending, int active, int countdownsRearmed, int escalationsRearmed) {
    }
}
