package com.sosapp.emergency.service;

import com.sosapp.emergency.event.EmergencyEventType;
import com.sosapp.emergency.exception.AuthorizationException;
import com.sosapp.emergency.exception.NotFoundException;
import com.sosapp.emergency.exception.StateConflictException;
import com.sosapp.emergency.model.Acknowledgment;
import com.sosapp.emergency.model.Emergency;
import com.sosapp.emergency.model.EmergencyStatus;
import com.sosapp.emergency.repository.AcknowledgmentRepository;
import com.sosapp.emergency.repository.EmergencyRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

/**
 * Records contact acknowledgments. Runs under the emergency's row lock, so the existence check, the
 * insert and the escalation stop are atomic with respect to resolve and to other acknowledgments.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AcknowledgmentTracker {

    private final EmergencyRepository emergencyRepository;
    private final AcknowledgmentRepository acknowledgmentRepository;
    private final ContactDirectory contactDirectory;
    private final EscalationService escalationService;
    private final EventPublisher eventPublisher;
    private final EmergencyMetrics metrics;
    private final Clock clock;

    @Transactional
    public AcknowledgmentOutcome acknowledge(AcknowledgmentCommand command) {
        UUID emergencyId = command.emergencyId();
        Emergency emergency = emergencyRepository.findByIdForUpdate(emergencyId)
                .orElseThrow(() -> new NotFoundException("Emergency not found: " + emergencyId));
        ContactEndpoint contact = contactDirectory.findContact(emergency.getUserId(), command.contactId())
                .orElseThrow(() -> new AuthorizationException("Caller is not an emergency contact of this user"));

        Optional<Acknowledgment> existing = acknowledgmentRepository.findByEmergencyIdAndContactId(
                emergencyId, command.contactId());
        if (existing.isPresent()) {
            log.info("Contact {} already acknowledged emergency {}", command.contactId(), emergencyId);
            return new AcknowledgmentOutcome(existing.get(), emergency.getStatus(), true, false);
        }
        if (emergency.getStatus() != EmergencyStatus.ACTIVE) {
            throw new StateConflictException(
                    "Emergency can only be acknowledged while active; it is " + emergency.getStatus(),
                    emergency.getStatus());
        }

        Instant now = Instant.now(clock);
        String contactName = hasText(command.contactName()) ? command.contactName() : contact.name();
        Acknowledgment acknowledgment = acknowledgmentRepository.saveAndFlush(Acknowledgment.builder()
                .id(UUID.randomUUID())
                .emergencyId(emergencyId)
                .contactId(command.contactId())
                .contactName(contactName)
                .contactPhone(contact.phone())
                .contactEmail(contact.email())
                .acknowledgedAt(now)
                .location(command.location())
                .message(command.message())
                .build());

        emergency.nextVersion();
        eventPublisher.record(emergency, EmergencyEventType.CONTACT_ACKNOWLEDGED, event -> event
                .contactId(command.contactId())
                .contactName(contactName));
        boolean stopped = escalationService.stop(emergencyId, EscalationService.STOP_ACKNOWLEDGED, now);
        metrics.recordAcknowledgment();
        log.info("Contact {} acknowledged emergency {} (escalation stopped by this ack: {})",
                command.contactId(), emergencyId, stopped);
        return new AcknowledgmentOutcome(acknowledgment, emergency.getStatus(), false, stopped);
    }

    @Transactional(readOnly = true)
    public Optional<Acknowledgment> find(UUID emergencyId, Long contactId) {
        return acknowledgmentRepository.findByEmergencyIdAndContactId(emergencyId, contactId);
    }

    private boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
