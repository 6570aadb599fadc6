package com.sosapp.emergency.service;

import com.sosapp.emergency.config.EmergencyProperties;
import com.sosapp.emergency.event.EmergencyEventType;
import com.sosapp.emergency.exception.AuthorizationException;
import com.sosapp.emergency.exception.NotFoundException;
import com.sosapp.emergency.exception.StateConflictException;
import com.sosapp.emergency.model.Emergency;
import com.sosapp.emergency.model.EmergencyStatus;
import com.sosapp.emergency.model.EmergencyTransition;
import com.sosapp.emergency.model.EscalationState;
import com.sosapp.emergency.repository.EmergencyRepository;
import com.sosapp.emergency.repository.EmergencyTransitionRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.Optional;
import java.util.UUID;

/**
 * Durable emergency transitions. Every method runs in its own transaction and takes the emergency's
 * row lock before reading its status, so the status check and the write form one compare-and-swap and
 * concurrent transitions of the same emergency are serialized. Events are written to the outbox in the
 * same transaction. Timers are not touched here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmergencyStateMachine {

    private final EmergencyRepository emergencyRepository;
    private final EmergencyTransitionRepository transitionRepository;
    private final EscalationService escalationService;
    private final EventPublisher eventPublisher;
    private final EmergencyMetrics metrics;
    private final UserTriggerGate userTriggerGate;
    private final EmergencyProperties properties;
    private final Clock clock;

    @Transactional
    public Emergency create(EmergencyDraft draft) {
        userTriggerGate.acquire(draft.userId());
        long open = emergencyRepository.countByUserIdAndStatusIn(draft.userId(),
                EnumSet.of(EmergencyStatus.PENDING, EmergencyStatus.ACTIVE));
        if (open >= properties.getMaxOpenPerUser()) {
            throw new StateConflictException("User already has an emergency in progress", null);
        }
        Instant now = Instant.now(clock);
        Emergency emergency = Emergency.builder()
                .id(UUID.randomUUID())
                .userId(draft.userId())
                .type(draft.type())
                .status(EmergencyStatus.PENDING)
                .location(draft.location())
                .countdownSeconds(draft.countdownSeconds())
                .autoTriggered(draft.autoTriggered())
                .triggeredBy(draft.triggeredBy())
                .confidence(draft.confidence())
                .initialMessage(draft.message())
                .transitionVersion(1)
                .createdAt(now)
                .build();
        emergencyRepository.save(emergency);
        audit(emergency, null, draft.autoTriggered() ? "AUTO_TRIGGER" : "TRIGGER", now);
        metrics.recordTriggered(draft.autoTriggered());
        log.info("Emergency {} created for user {} type={} countdown={}s triggeredBy={}",
                emergency.getId(), emergency.getUserId(), emergency.getType(),
                emergency.getCountdownSeconds(), emergency.getTriggeredBy());
        return emergency;
    }

    /**
     * Countdown expiry. Losing the race against a cancel (or a resolve) is expected and returns empty.
     */
    @Transactional
    public Optional<ActivationResult> activate(UUID emergencyId) {
        Emergency emergency = emergencyRepository.findByIdForUpdate(emergencyId).orElse(null);
        if (emergency == null) {
            log.warn("Countdown fired for unknown emergency {}", emergencyId);
            return Optional.empty();
        }
        if (emergency.getStatus() != EmergencyStatus.PENDING) {
            log.info("Countdown fired for emergency {} already {}, nothing to do", emergencyId, emergency.getStatus());
            return Optional.empty();
        }
        Instant now = Instant.now(clock);
        EmergencyStatus from = emergency.getStatus();
        emergency.setStatus(EmergencyStatus.ACTIVE);
        emergency.setActivatedAt(now);
        emergency.nextVersion();
        audit(emergency, from, "COUNTDOWN_EXPIRED", now);

        EscalationState escalation = escalationService.open(emergency, now);
        eventPublisher.record(emergency, EmergencyEventType.CREATED, event -> event.tier(1));
        log.info("Emergency {} is ACTIVE, tier 1 window ends at {}", emergencyId, escalation.getTierDeadline());
        return Optional.of(new ActivationResult(emergency, escalation));
    }

    @Transactional
    public Emergency cancel(UUID emergencyId, Long userId, String reason) {
        Emergency emergency = lockOwned(emergencyId, userId);
        if (emergency.getStatus() != EmergencyStatus.PENDING) {
            throw new StateConflictException(
                    "Emergency can only be cancelled during the countdown; it is " + emergency.getStatus(),
                    emergency.getStatus());
        }
        Instant now = Instant.now(clock);
        emergency.setStatus(EmergencyStatus.CANCELLED);
        emergency.setCancelledAt(now);
        emergency.setCancellationReason(reason);
        emergency.nextVersion();
        audit(emergency, EmergencyStatus.PENDING, "USER_CANCELLED", now);
        escalationService.stop(emergencyId, "CANCELLED", now);
        eventPublisher.record(emergency, EmergencyEventType.CANCELLED, event -> event.reason(reason));
        log.info("Emergency {} cancelled by user {}", emergencyId, userId);
        return emergency;
    }

    @Transactional
    public Emergency resolve(UUID emergencyId, Long userId, String notes) {
        Emergency emergency = lockOwned(emergencyId, userId);
        EmergencyStatus from = emergency.getStatus();
        if (!from.canTransitionTo(EmergencyStatus.RESOLVED)) {
            throw new StateConflictException("Emergency is already " + from, from);
        }
        Instant now = Instant.now(clock);
        emergency.setStatus(EmergencyStatus.RESOLVED);
        emergency.setResolvedAt(now);
        emergency.setResolutionNotes(notes);
        emergency.nextVersion();
        audit(emergency, from, "USER_RESOLVED", now);
        escalationService.stop(emergencyId, "RESOLVED", now);
        long durationSeconds = emergency.getActivatedAt() == null
                ? 0
                : Duration.between(emergency.getActivatedAt(), now).getSeconds();
        eventPublisher.record(emergency, EmergencyEventType.RESOLVED, event -> event
                .reason(notes)
                .durationSeconds(durationSeconds));
        log.info("Emergency {} resolved by user {} after {}s active", emergencyId, userId, durationSeconds);
        return emergency;
    }

    private Emergency lockOwned(UUID emergencyId, Long userId) {
        Emergency emergency = emergencyRepository.findByIdForUpdate(emergencyId)
                .orElseThrow(() -> new NotFoundException("Emergency not found: " + emergencyId));
        if (!emergency.isOwnedBy(userId)) {
            throw new AuthorizationException("Only the owner can change this emergency");
        }
        return emergency;
    }

    private void audit(Emergency emergency, EmergencyStatus from, String reason, Instant at) {
        if (from != null && !from.canTransitionTo(emergency.getStatus())) {
            throw new IllegalStateException("Invalid emergency transition: " + from + " -> " + emergency.getStatus());
        }
        transitionRepository.save(EmergencyTransition.builder()
                .emergencyId(emergency.getId())
                .userId(emergency.getUserId())
                .fromStatus(from)
                .toStatus(emergency.getStatus())
                .transitionVersion(emergency.getTransitionVersion())
                .reason(reason)
                .correlationId(MDC.get("correlationId"))
                .createdAt(at)
                .build());
        metrics.recordTransition(emergency.getStatus());
    }
}
