package com.sosapp.emergency.service;

import com.sosapp.emergency.event.EmergencyEventType;
import com.sosapp.emergency.model.Emergency;
import com.sosapp.emergency.model.EmergencyStatus;
import com.sosapp.emergency.model.EscalationState;
import com.sosapp.emergency.repository.AcknowledgmentRepository;
import com.sosapp.emergency.repository.EmergencyRepository;
import com.sosapp.emergency.repository.EscalationStateRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Persisted side of the escalation monitor. Ticks lock the emergency row like every other transition,
 * so a tick can never emit after a committed resolve or first acknowledgment.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EscalationService {

    public static final String STOP_ACKNOWLEDGED = "ACKNOWLEDGED";
    public static final String STOP_EXHAUSTED = "REMINDERS_EXHAUSTED";

    private final EscalationStateRepository escalationStateRepository;
    private final EmergencyRepository emergencyRepository;
    private final AcknowledgmentRepository acknowledgmentRepository;
    private final EscalationPolicy escalationPolicy;
    private final EventPublisher eventPublisher;
    private final EmergencyMetrics metrics;
    private final Clock clock;

    @Transactional(propagation = Propagation.MANDATORY)
    public EscalationState open(Emergency emergency, Instant activatedAt) {
        Instant deadline = escalationPolicy.firstDeadline(activatedAt);
        EscalationState state = EscalationState.builder()
                .emergencyId(emergency.getId())
                .userId(emergency.getUserId())
                .currentTier(1)
                .tierDeadline(deadline)
                .nextCheckAt(deadline)
                .reminderCount(0)
                .stopped(false)
                .updatedAt(Instant.now(clock))
                .build();
        return escalationStateRepository.save(state);
    }

    /**
     * Runs one escalation tick.
     *
     * @return when the next tick is due; empty when monitoring is over
     */
    @Transactional
    public Optional<Instant> advance(UUID emergencyId) {
        Emergency emergency = emergencyRepository.findByIdForUpdate(emergencyId).orElse(null);
        if (emergency == null || emergency.getStatus() != EmergencyStatus.ACTIVE) {
            log.info("Escalation tick for emergency {} ignored, status={}", emergencyId,
                    emergency == null ? "MISSING" : emergency.getStatus());
            return Optional.empty();
        }
        EscalationState state = escalationStateRepository.findById(emergencyId).orElse(null);
        if (state == null || state.isStopped()) {
            return Optional.empty();
        }
        Instant now = Instant.now(clock);
        if (acknowledgmentRepository.countByEmergencyId(emergencyId) > 0) {
            state.stop(STOP_ACKNOWLEDGED, now);
            log.info("Escalation for emergency {} already acknowledged, stopping", emergencyId);
            return Optional.empty();
        }
        if (state.getNextCheckAt() != null && now.isBefore(state.getNextCheckAt())) {
            return Optional.of(state.getNextCheckAt());
        }

        EscalationStep step = escalationPolicy.next(state, now);
        state.setCurrentTier(step.tier());
        state.setReminderCount(step.reminderCount());
        state.setTierDeadline(step.tierDeadline());
        state.setNextCheckAt(step.nextCheckAt());
        state.setUpdatedAt(now);
        if (step.nextCheckAt() == null) {
            state.stop(STOP_EXHAUSTED, now);
        }

        emergency.nextVersion();
        eventPublisher.record(emergency, EmergencyEventType.ESCALATION_TRIGGERED, event -> event
                .tier(step.tier())
                .reminder(step.reminderCount()));
        metrics.recordEscalation(!step.advanced());
        if (step.advanced()) {
            log.warn("Emergency {} unacknowledged, escalated to tier {}", emergencyId, step.tier());
        } else {
            log.info("Emergency {} still unacknowledged, reminder {} for tier {}", emergencyId,
                    step.reminderCount(), step.tier());
        }
        return Optional.ofNullable(step.nextCheckAt());
    }

    /**
     * Stops escalation permanently.
     *
     * @return true only for the call that actually stopped it
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean stop(UUID emergencyId, String reason, Instant at) {
        EscalationState state = escalationStateRepository.findById(emergencyId).orElse(null);
        if (state == null || state.isStopped()) {
            return false;
        }
        state.stop(reason, at);
        log.info("Escalation for emergency {} stopped: {}", emergencyId, reason);
        return true;
    }

    /**
     * Escalation state of an ACTIVE emergency, recreating tier 1 from the activation time when the
     * process died between activation and the first write.
     */
    @Transactional
    public Optional<EscalationState> recover(UUID emergencyId) {
        Emergency emergency = emergencyRepository.findByIdForUpdate(emergencyId).orElse(null);
        if (emergency == null || emergency.getStatus() != EmergencyStatus.ACTIVE) {
            return Optional.empty();
        }
        EscalationState state = escalationStateRepository.findById(emergencyId)
                .orElseGet(() -> {
                    log.warn("Emergency {} is ACTIVE without escalation state, reopening tier 1", emergencyId);
                    Instant anchor = emergency.getActivatedAt() != null ? emergency.getActivatedAt() : Instant.now(clock);
                    return open(emergency, anchor);
                });
        return Optional.of(state);
    }

    @Transactional(readOnly = true)
    public Optional<EscalationState> find(UUID emergencyId) {
        return escalationStateRepository.findById(emergencyId);
    }
}
