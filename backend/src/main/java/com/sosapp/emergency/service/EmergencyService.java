package com.sosapp.emergency.service;

import com.sosapp.emergency.config.EmergencyProperties;
import com.sosapp.emergency.dto.AcknowledgeEmergencyRequest;
import com.sosapp.emergency.dto.AcknowledgeEmergencyResponse;
import com.sosapp.emergency.dto.AcknowledgmentDTO;
import com.sosapp.emergency.dto.AutoTriggerRequest;
import com.sosapp.emergency.dto.EmergencyDTO;
import com.sosapp.emergency.dto.EmergencyHistoryResponse;
import com.sosapp.emergency.dto.EscalationSummaryDTO;
import com.sosapp.emergency.dto.NotificationJobDTO;
import com.sosapp.emergency.dto.TriggerEmergencyRequest;
import com.sosapp.emergency.dto.TriggerEmergencyResponse;
import com.sosapp.emergency.exception.AuthorizationException;
import com.sosapp.emergency.exception.NotFoundException;
import com.sosapp.emergency.exception.StateConflictException;
import com.sosapp.emergency.exception.UnauthorizedException;
import com.sosapp.emergency.exception.ValidationException;
import com.sosapp.emergency.model.Emergency;
import com.sosapp.emergency.model.EmergencyStatus;
import com.sosapp.emergency.model.EmergencyType;
import com.sosapp.emergency.repository.AcknowledgmentRepository;
import com.sosapp.emergency.repository.EmergencyRepository;
import com.sosapp.emergency.repository.EmergencySpecifications;
import com.sosapp.emergency.repository.NotificationJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * API-facing emergency operations. Transitions commit in {@link EmergencyStateMachine} or
 * {@link AcknowledgmentTracker}; timers are armed or cancelled here, after the commit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmergencyService {

    private static final int DEFAULT_PAGE_SIZE = 20;
    private static final int MAX_PAGE_SIZE = 100;

    private final EmergencyStateMachine stateMachine;
    private final AcknowledgmentTracker acknowledgmentTracker;
    private final CountdownScheduler countdownScheduler;
    private final EscalationMonitor escalationMonitor;
    private final EscalationService escalationService;
    private final ReconciliationSweeper reconciliationSweeper;
    private final DeviceIdentityGateway deviceIdentityGateway;
    private final ContactDirectory contactDirectory;
    private final EmergencyRepository emergencyRepository;
    private final AcknowledgmentRepository acknowledgmentRepository;
    private final NotificationJobRepository notificationJobRepository;
    private final EmergencyProperties properties;

    public TriggerEmergencyResponse trigger(Long userId, TriggerEmergencyRequest request) {
        EmergencyProperties.Countdown countdown = properties.getCountdown();
        int seconds = request.getCountdownSeconds() != null
                ? request.getCountdownSeconds()
                : countdown.getDefaultSeconds();
        if (seconds < countdown.getMinSeconds() || seconds > countdown.getMaxSeconds()) {
            throw new ValidationException("countdownSeconds must be between " + countdown.getMinSeconds()
                    + " and " + countdown.getMaxSeconds());
        }
        Emergency emergency = stateMachine.create(new EmergencyDraft(userId, request.getType(),
                request.getLocation().toModel(), seconds, false, Emergency.TRIGGERED_BY_USER, null,
                request.getMessage()));
        countdownScheduler.start(emergency);
        return toTriggerResponse(emergency);
    }

    public TriggerEmergencyResponse autoTrigger(String deviceToken, AutoTriggerRequest request) {
        if (deviceToken == null || deviceToken.isBlank()) {
            throw new UnauthorizedException("Device token is required");
        }
        DeviceIdentity device = deviceIdentityGateway.verify(deviceToken)
                .orElseThrow(() -> new UnauthorizedException("Device token is invalid or expired"));
        if (!device.deviceId().equals(request.getDeviceId()) || !device.userId().equals(request.getUserId())) {
            log.warn("Device {} attempted to trigger for device {} user {}", device.deviceId(),
                    request.getDeviceId(), request.getUserId());
            throw new AuthorizationException("Device is not paired with this user");
        }
        Emergency emergency = stateMachine.create(new EmergencyDraft(device.userId(), request.getType(),
                request.getLocation().toModel(), properties.getCountdown().getAutoTriggerSeconds(), true,
                Emergency.DEVICE_PREFIX + device.deviceId(), request.getConfidence(), request.getMessage()));
        countdownScheduler.start(emergency);
        return toTriggerResponse(emergency);
    }

    public EmergencyDTO cancel(UUID emergencyId, Long userId, String reason) {
        Emergency emergency = stateMachine.cancel(emergencyId, userId, reason);
        countdownScheduler.cancel(emergencyId);
        escalationMonitor.stop(emergencyId);
        return EmergencyDTO.from(emergency);
    }

    public EmergencyDTO resolve(UUID emergencyId, Long userId, String notes) {
        Emergency current = emergencyRepository.findById(emergencyId)
                .orElseThrow(() -> new NotFoundException("Emergency not found: " + emergencyId));
        if (!current.isOwnedBy(userId)) {
            throw new AuthorizationException("Only the owner can change this emergency");
        }
        if (current.getStatus().isTerminal()) {
            throw new StateConflictException("Emergency is already " + current.getStatus(), current.getStatus());
        }
        countdownScheduler.cancel(emergencyId);
        escalationMonitor.stop(emergencyId);
        Emergency resolved;
        try {
            resolved = stateMachine.resolve(emergencyId, userId, notes);
        } catch (RuntimeException ex) {
            // the emergency is still open, put its timer back
            reconciliationSweeper.reconcile(emergencyId);
            throw ex;
        }
        // a tick that was already running may have re-armed itself before the commit
        countdownScheduler.cancel(emergencyId);
        escalationMonitor.stop(emergencyId);
        return EmergencyDTO.from(resolved);
    }

    public AcknowledgeEmergencyResponse acknowledge(UUID emergencyId, Long contactId, AcknowledgeEmergencyRequest request) {
        AcknowledgeEmergencyRequest body = request != null ? request : new AcknowledgeEmergencyRequest();
        AcknowledgmentCommand command = new AcknowledgmentCommand(emergencyId, contactId, body.getContactName(),
                body.getLocation() != null ? body.getLocation().toModel() : null, body.getMessage());
        AcknowledgmentOutcome outcome;
        try {
            outcome = acknowledgmentTracker.acknowledge(command);
        } catch (DataIntegrityViolationException ex) {
            outcome = acknowledgmentTracker.find(emergencyId, contactId)
                    .map(existing -> new AcknowledgmentOutcome(existing, currentStatus(emergencyId), true, false))
                    .orElseThrow(() -> ex);
            log.info("Concurrent duplicate acknowledgment of emergency {} by contact {}", emergencyId, contactId);
        }
        if (outcome.escalationStopped()) {
            escalationMonitor.stop(emergencyId);
        }
        return AcknowledgeEmergencyResponse.builder()
                .acknowledgment(AcknowledgmentDTO.from(outcome.acknowledgment()))
                .emergencyStatus(outcome.emergencyStatus())
                .duplicate(outcome.duplicate())
                .escalationStopped(outcome.escalationStopped())
                .build();
    }

    public EmergencyDTO get(UUID emergencyId, Long callerId) {
        Emergency emergency = emergencyRepository.findById(emergencyId)
                .orElseThrow(() -> new NotFoundException("Emergency not found: " + emergencyId));
        if (!emergency.isOwnedBy(callerId)) {
            boolean activeContact = emergency.getStatus() == EmergencyStatus.ACTIVE
                    && contactDirectory.findContact(emergency.getUserId(), callerId).isPresent();
            if (!activeContact) {
                throw new AuthorizationException("Not allowed to view this emergency");
            }
        }
        EmergencyDTO dto = EmergencyDTO.from(emergency);
        dto.setAcknowledgments(acknowledgmentRepository.findByEmergencyIdOrderByAcknowledgedAtAsc(emergencyId).stream()
                .map(AcknowledgmentDTO::from)
                .toList());
        dto.setEscalation(escalationService.find(emergencyId).map(EscalationSummaryDTO::from).orElse(null));
        return dto;
    }

    public EmergencyHistoryResponse history(Long userId, Integer page, Integer pageSize, EmergencyStatus status,
                                            EmergencyType type, Instant from, Instant to) {
        int pageNumber = page != null ? page : 1;
        int size = pageSize != null ? pageSize : DEFAULT_PAGE_SIZE;
        if (pageNumber < 1) {
            throw new ValidationException("page must be at least 1");
        }
        if (size < 1 || size > MAX_PAGE_SIZE) {
            throw new ValidationException("pageSize must be between 1 and " + MAX_PAGE_SIZE);
        }
        if (from != null && to != null && from.isAfter(to)) {
            throw new ValidationException("from must not be after to");
        }
        Page<Emergency> result = emergencyRepository.findAll(
                EmergencySpecifications.history(userId, status, type, from, to),
                PageRequest.of(pageNumber - 1, size, Sort.by(Sort.Direction.DESC, "createdAt")));
        return EmergencyHistoryResponse.builder()
                .emergencies(result.getContent().stream().map(EmergencyDTO::from).toList())
                .page(pageNumber)
                .pageSize(size)
                .total(result.getTotalElements())
                .totalPages(result.getTotalPages())
                .build();
    }

    public List<NotificationJobDTO> notifications(UUID emergencyId, Long userId) {
        Emergency emergency = emergencyRepository.findById(emergencyId)
                .orElseThrow(() -> new NotFoundException("Emergency not found: " + emergencyId));
        if (!emergency.isOwnedBy(userId)) {
            throw new AuthorizationException("Only the owner can view notifications of this emergency");
        }
        return notificationJobRepository.findByEmergencyIdOrderByCreatedAtAsc(emergencyId).stream()
                .map(NotificationJobDTO::from)
                .toList();
    }

    private EmergencyStatus currentStatus(UUID emergencyId) {
        return emergencyRepository.findById(emergencyId).map(Emergency::getStatus).orElse(null);
    }

    private TriggerEmergencyResponse toTriggerResponse(Emergency emergency) {
        return TriggerEmergencyResponse.builder()
                .emergencyId(emergency.getId())
                .status(emergency.getStatus())
                .countdownSeconds(emergency.getCountdownSeconds())
                .activatesAt(emergency.countdownDeadline())
                .autoTriggered(emergency.isAutoTriggered())
                .build();
    }
}
