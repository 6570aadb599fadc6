package com.sosapp.emergency.integration;

import com.sosapp.emergency.dto.AcknowledgeEmergencyRequest;
import com.sosapp.emergency.dto.AcknowledgeEmergencyResponse;
import com.sosapp.emergency.dto.AutoTriggerRequest;
import com.sosapp.emergency.dto.EmergencyDTO;
import com.sosapp.emergency.dto.EmergencyHistoryResponse;
import com.sosapp.emergency.dto.LocationDTO;
import com.sosapp.emergency.dto.TriggerEmergencyRequest;
import com.sosapp.emergency.dto.TriggerEmergencyResponse;
import com.sosapp.emergency.event.EmergencyEventType;
import com.sosapp.emergency.exception.AuthorizationException;
import com.sosapp.emergency.exception.StateConflictException;
import com.sosapp.emergency.exception.UnauthorizedException;
import com.sosapp.emergency.exception.ValidationException;
import com.sosapp.emergency.model.Acknowledgment;
import com.sosapp.emergency.model.EmergencyStatus;
import com.sosapp.emergency.model.EmergencyTransition;
import com.sosapp.emergency.model.EmergencyType;
import com.sosapp.emergency.model.EscalationState;
import com.sosapp.emergency.model.NotificationChannel;
import com.sosapp.emergency.model.NotificationJob;
import com.sosapp.emergency.model.OutboxEvent;
import com.sosapp.emergency.repository.AcknowledgmentRepository;
import com.sosapp.emergency.repository.EmergencyRepository;
import com.sosapp.emergency.repository.EmergencyTransitionRepository;
import com.sosapp.emergency.repository.EscalationStateRepository;
import com.sosapp.emergency.repository.NotificationJobRepository;
import com.sosapp.emergency.security.JwtTokenProvider;
import com.sosapp.emergency.service.CountdownScheduler;
import com.sosapp.emergency.service.EmergencyService;
import com.sosapp.emergency.service.EmergencyStateMachine;
import com.sosapp.emergency.service.EscalationMonitor;
import com.sosapp.emergency.service.EscalationService;
import com.sosapp.emergency.support.IntegrationTestSupport;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class EmergencyLifecycleIntegrationTest extends IntegrationTestSupport {

    @Autowired
    private EmergencyService emergencyService;

    @Autowired
    private EmergencyStateMachine stateMachine;

    @Autowired
    private CountdownScheduler countdownScheduler;

    @Autowired
    private EscalationMonitor escalationMonitor;

    @Autowired
    private EmergencyRepository emergencyRepository;

    @Autowired
    private AcknowledgmentRepository acknowledgmentRepository;

    @Autowired
    private EscalationStateRepository escalationStateRepository;

    @Autowired
    private EmergencyTransitionRepository transitionRepository;

    @Autowired
    private NotificationJobRepository notificationJobRepository;

    @Autowired
    private JwtTokenProvider jwtTokenProvider;

    private TriggerEmergencyRequest request(Integer countdownSeconds) {
        return TriggerEmergencyRequest.builder()
                .type(EmergencyType.MEDICAL)
                .location(LocationDTO.builder().latitude(40.4168).longitude(-3.7038).accuracy(12.0).build())
                .countdownSeconds(countdownSeconds)
                .message("Chest pain")
                .build();
    }

    private UUID trigger(int countdownSeconds) {
        return emergencyService.trigger(OWNER_ID, request(countdownSeconds)).getEmergencyId();
    }

    /** Triggers with a 10s countdown and lets it run out; activation happens at t=10s. */
    private UUID activeEmergency() {
        UUID id = trigger(10);
        advanceTo(at(10));
        assertThat(status(id)).isEqualTo(EmergencyStatus.ACTIVE);
        return id;
    }

    private EmergencyStatus status(UUID id) {
        return emergencyRepository.findById(id).orElseThrow().getStatus();
    }

    private AcknowledgeEmergencyResponse acknowledge(UUID id, long contactId) {
        return emergencyService.acknowledge(id, contactId,
                AcknowledgeEmergencyRequest.builder().message("On my way").build());
    }

    @Test
    void cancelDuringCountdownNeverActivates() {
        TriggerEmergencyResponse response = emergencyService.trigger(OWNER_ID, request(10));
        UUID id = response.getEmergencyId();
        assertThat(response.getStatus()).isEqualTo(EmergencyStatus.PENDING);
        assertThat(response.getActivatesAt()).isEqualTo(at(10));
        assertThat(countdownScheduler.isScheduled(id)).isTrue();

        advanceTo(at(3));
        EmergencyDTO cancelled = emergencyService.cancel(id, OWNER_ID, "false alarm");
        advanceTo(at(60));

        assertThat(cancelled.getStatus()).isEqualTo(EmergencyStatus.CANCELLED);
        assertThat(cancelled.getCancelledAt()).isEqualTo(at(3));
        assertThat(status(id)).isEqualTo(EmergencyStatus.CANCELLED);
        assertThat(countdownScheduler.isScheduled(id)).isFalse();
        assertThat(events(id, EmergencyEventType.CREATED)).isZero();
        assertThat(events(id, EmergencyEventType.CANCELLED)).isEqualTo(1);
        assertThat(notificationJobRepository.findByEmergencyIdOrderByCreatedAtAsc(id)).isEmpty();
    }

    @Test
    void countdownExpiryActivatesAndPublishesCreatedOnce() {
        UUID id = trigger(10);

        advanceTo(at(9));
        assertThat(status(id)).isEqualTo(EmergencyStatus.PENDING);

        advanceTo(at(10));
        assertThat(status(id)).isEqualTo(EmergencyStatus.ACTIVE);
        assertThat(emergencyRepository.findById(id).orElseThrow().getActivatedAt()).isEqualTo(at(10));
        assertThat(countdownScheduler.isScheduled(id)).isFalse();
        assertThat(escalationMonitor.isScheduled(id)).isTrue();

        advanceTo(at(60));
        assertThat(events(id, EmergencyEventType.CREATED)).isEqualTo(1);
        assertThat(outboxEventRepository.findByEmergencyIdOrderByCreatedAtAsc(id))
                .allSatisfy(row -> assertThat(row.getStatus()).isEqualTo(OutboxEvent.Status.PUBLISHED));

        List<NotificationJob> jobs = notificationJobRepository.findByEmergencyIdOrderByCreatedAtAsc(id);
        assertThat(jobs).hasSize(1);
        assertThat(jobs.get(0).getRecipientId()).isEqualTo(PRIMARY_CONTACT_ID);
        assertThat(jobs.get(0).getChannel()).isEqualTo(NotificationChannel.PUSH);
        assertThat(jobs.get(0).getKind()).isEqualTo(NotificationJob.Kind.ALERT);

        EscalationState escalation = escalationStateRepository.findById(id).orElseThrow();
        assertThat(escalation.getCurrentTier()).isEqualTo(1);
        assertThat(escalation.getTierDeadline()).isEqualTo(at(130));
    }

    @Test
    void unacknowledgedEmergencyEscalatesThenKeepsReminding() {
        UUID id = activeEmergency();

        advanceTo(at(129));
        assertThat(events(id, EmergencyEventType.ESCALATION_TRIGGERED)).isZero();

        advanceTo(at(130));
        assertThat(events(id, EmergencyEventType.ESCALATION_TRIGGERED)).isEqualTo(1);
        EscalationState escalation = escalationStateRepository.findById(id).orElseThrow();
        assertThat(escalation.getCurrentTier()).isEqualTo(2);
        assertThat(escalation.getNextCheckAt()).isEqualTo(at(160));

        advanceTo(at(159));
        assertThat(events(id, EmergencyEventType.ESCALATION_TRIGGERED)).isEqualTo(1);
        advanceTo(at(190));
        assertThat(events(id, EmergencyEventType.ESCALATION_TRIGGERED)).isEqualTo(3);
        assertThat(escalationStateRepository.findById(id).orElseThrow().getReminderCount()).isEqualTo(2);

        List<NotificationJob> jobs = notificationJobRepository.findByEmergencyIdOrderByCreatedAtAsc(id);
        assertThat(jobs).filteredOn(job -> job.getKind() == NotificationJob.Kind.ESCALATION)
                .singleElement()
                .satisfies(job -> {
                    assertThat(job.getRecipientId()).isEqualTo(SECONDARY_CONTACT_ID);
                    assertThat(job.getTier()).isEqualTo(2);
                    assertThat(job.getChannel()).isEqualTo(NotificationChannel.SMS);
                });
        assertThat(jobs).filteredOn(job -> job.getKind() == NotificationJob.Kind.REMINDER)
                .extracting(NotificationJob::getRecipientId)
                .containsExactlyInAnyOrder(PRIMARY_CONTACT_ID, SECONDARY_CONTACT_ID,
                        PRIMARY_CONTACT_ID, SECONDARY_CONTACT_ID);

        acknowledge(id, SECONDARY_CONTACT_ID);
        advanceTo(at(400));
        assertThat(events(id, EmergencyEventType.ESCALATION_TRIGGERED)).isEqualTo(3);
        assertThat(escalationMonitor.isScheduled(id)).isFalse();
    }

    @Test
    void acknowledgmentBeforeDeadlinePreventsEscalation() {
        UUID id = activeEmergency();

        advanceTo(at(60));
        AcknowledgeEmergencyResponse response = acknowledge(id, PRIMARY_CONTACT_ID);

        assertThat(response.isDuplicate()).isFalse();
        assertThat(response.isEscalationStopped()).isTrue();
        assertThat(response.getEmergencyStatus()).isEqualTo(EmergencyStatus.ACTIVE);
        assertThat(response.getAcknowledgment().getContactName()).isEqualTo("Primary Contact");
        assertThat(escalationMonitor.isScheduled(id)).isFalse();

        advanceTo(at(600));
        assertThat(events(id, EmergencyEventType.ESCALATION_TRIGGERED)).isZero();
        EscalationState escalation = escalationStateRepository.findById(id).orElseThrow();
        assertThat(escalation.isStopped()).isTrue();
        assertThat(escalation.getStopReason()).isEqualTo("ACKNOWLEDGED");
        assertThat(status(id)).isEqualTo(EmergencyStatus.ACTIVE);
    }

    @Test
    void resolveStopsEscalationAndRejectsLaterAcknowledgment() {
        UUID id = activeEmergency();

        advanceTo(at(70));
        EmergencyDTO resolved = emergencyService.resolve(id, OWNER_ID, "Paramedics arrived");
        assertThat(resolved.getStatus()).isEqualTo(EmergencyStatus.RESOLVED);
        assertThat(escalationMonitor.isScheduled(id)).isFalse();

        advanceTo(at(80));
        assertThatThrownBy(() -> acknowledge(id, PRIMARY_CONTACT_ID))
                .isInstanceOf(StateConflictException.class)
                .satisfies(ex -> assertThat(((StateConflictException) ex).getCurrentStatus())
                        .isEqualTo(EmergencyStatus.RESOLVED));

        advanceTo(at(600));
        assertThat(events(id, EmergencyEventType.ESCALATION_TRIGGERED)).isZero();
        assertThat(events(id, EmergencyEventType.RESOLVED)).isEqualTo(1);
        assertThat(escalationStateRepository.findById(id).orElseThrow().getStopReason()).isEqualTo("RESOLVED");
        assertThat(notificationJobRepository.findByEmergencyIdOrderByCreatedAtAsc(id))
                .allSatisfy(job -> assertThat(job.getStatus()).isEqualTo(NotificationJob.Status.CANCELLED));

        List<EmergencyTransition> transitions = transitionRepository.findByEmergencyIdOrderByTransitionVersionAsc(id);
        assertThat(transitions).extracting(EmergencyTransition::getToStatus)
                .containsExactly(EmergencyStatus.PENDING, EmergencyStatus.ACTIVE, EmergencyStatus.RESOLVED);
    }

    @Test
    void escalationTickAlreadyArmedAfterResolveEmitsNothing() {
        UUID id = activeEmergency();
        // straight to the state machine, so the escalation timer is still armed
        stateMachine.resolve(id, OWNER_ID, "resolved elsewhere");
        assertThat(escalationMonitor.isScheduled(id)).isTrue();

        advanceTo(at(400));

        assertThat(events(id, EmergencyEventType.ESCALATION_TRIGGERED)).isZero();
        assertThat(escalationMonitor.isScheduled(id)).isFalse();
    }

    @Test
    void countdownFiringAfterCommittedCancelIsANoOp() {
        UUID id = trigger(10);
        stateMachine.cancel(id, OWNER_ID, null);
        assertThat(countdownScheduler.isScheduled(id)).isTrue();

        advanceTo(at(30));

        assertThat(status(id)).isEqualTo(EmergencyStatus.CANCELLED);
        assertThat(events(id, EmergencyEventType.CREATED)).isZero();
        assertThat(events(id, EmergencyEventType.CANCELLED)).isEqualTo(1);
        assertThat(escalationStateRepository.findById(id)).isEmpty();
    }

    @Test
    void cancelAfterActivationIsAConflict() {
        UUID id = activeEmergency();

        assertThatThrownBy(() -> emergencyService.cancel(id, OWNER_ID, "too late"))
                .isInstanceOf(StateConflictException.class)
                .satisfies(ex -> assertThat(((StateConflictException) ex).getCurrentStatus())
                        .isEqualTo(EmergencyStatus.ACTIVE));
        assertThat(events(id, EmergencyEventType.CANCELLED)).isZero();
        assertThat(events(id, EmergencyEventType.CREATED)).isEqualTo(1);
    }

    @Test
    void resolveDuringCountdownSkipsActivation() {
        UUID id = trigger(10);

        emergencyService.resolve(id, OWNER_ID, "handled");
        advanceTo(at(60));

        assertThat(status(id)).isEqualTo(EmergencyStatus.RESOLVED);
        assertThat(events(id, EmergencyEventType.CREATED)).isZero();
        assertThat(countdownScheduler.isScheduled(id)).isFalse();
    }

    @Test
    void repeatedAcknowledgmentIsIdempotent() {
        UUID id = activeEmergency();

        AcknowledgeEmergencyResponse first = acknowledge(id, PRIMARY_CONTACT_ID);
        AcknowledgeEmergencyResponse second = acknowledge(id, PRIMARY_CONTACT_ID);

        assertThat(second.isDuplicate()).isTrue();
        assertThat(second.isEscalationStopped()).isFalse();
        assertThat(second.getAcknowledgment().getAcknowledgedAt()).isEqualTo(first.getAcknowledgment().getAcknowledgedAt());
        List<Acknowledgment> stored = acknowledgmentRepository.findByEmergencyIdOrderByAcknowledgedAtAsc(id);
        assertThat(stored).hasSize(1);
        assertThat(events(id, EmergencyEventType.CONTACT_ACKNOWLEDGED)).isEqualTo(1);
    }

    @Test
    void secondContactIsRecordedWithoutStoppingEscalationAgain() {
        UUID id = activeEmergency();

        acknowledge(id, PRIMARY_CONTACT_ID);
        AcknowledgeEmergencyResponse second = acknowledge(id, SECONDARY_CONTACT_ID);

        assertThat(second.isDuplicate()).isFalse();
        assertThat(second.isEscalationStopped()).isFalse();
        assertThat(events(id, EmergencyEventType.CONTACT_ACKNOWLEDGED)).isEqualTo(2);

        EmergencyDTO view = emergencyService.get(id, SECONDARY_CONTACT_ID);
        assertThat(view.getAcknowledgments()).hasSize(2);
        assertThat(view.getEscalation().isStopped()).isTrue();
    }

    @Test
    void onlyTheOwnersContactsMayAcknowledge() {
        UUID id = activeEmergency();

        assertThatThrownBy(() -> acknowledge(id, STRANGER_ID)).isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> emergencyService.get(id, STRANGER_ID)).isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> emergencyService.resolve(id, PRIMARY_CONTACT_ID, null))
                .isInstanceOf(AuthorizationException.class);
        assertThat(status(id)).isEqualTo(EmergencyStatus.ACTIVE);
    }

    @Test
    void secondOpenEmergencyIsRejected() {
        trigger(10);

        assertThatThrownBy(() -> trigger(10)).isInstanceOf(StateConflictException.class);
    }

    @Test
    void countdownOutsideAllowedRangeIsRejected() {
        assertThatThrownBy(() -> trigger(4)).isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> trigger(31)).isInstanceOf(ValidationException.class);

        TriggerEmergencyResponse defaulted = emergencyService.trigger(OWNER_ID, request(null));
        assertThat(defaulted.getCountdownSeconds()).isEqualTo(10);
    }

    @Test
    void pairedDeviceTriggersWithLongCountdown() {
        String token = jwtTokenProvider.generateDeviceToken("watch-1", OWNER_ID);
        AutoTriggerRequest request = AutoTriggerRequest.builder()
                .deviceId("watch-1")
                .userId(OWNER_ID)
                .type(EmergencyType.FALL)
                .location(LocationDTO.builder().latitude(1.0).longitude(2.0).build())
                .confidence(0.93)
                .build();

        TriggerEmergencyResponse response = emergencyService.autoTrigger(token, request);

        assertThat(response.isAutoTriggered()).isTrue();
        assertThat(response.getCountdownSeconds()).isEqualTo(30);
        assertThat(emergencyRepository.findById(response.getEmergencyId()).orElseThrow().getTriggeredBy())
                .isEqualTo("device:watch-1");

        request.setUserId(2L);
        assertThatThrownBy(() -> emergencyService.autoTrigger(token, request))
                .isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> emergencyService.autoTrigger("forged", request))
                .isInstanceOf(UnauthorizedException.class);
    }

    @Test
    void historyIsNewestFirstAndFiltered() {
        UUID first = trigger(10);
        emergencyService.cancel(first, OWNER_ID, null);
        advanceBy(Duration.ofMinutes(5));
        UUID second = trigger(10);
        emergencyService.cancel(second, OWNER_ID, null);
        advanceBy(Duration.ofMinutes(5));
        UUID third = trigger(10);

        EmergencyHistoryResponse all = emergencyService.history(OWNER_ID, 1, 2, null, null, null, null);
        assertThat(all.getTotal()).isEqualTo(3);
        assertThat(all.getTotalPages()).isEqualTo(2);
        assertThat(all.getEmergencies()).extracting(EmergencyDTO::getId).containsExactly(third, second);

        EmergencyHistoryResponse cancelled = emergencyService.history(OWNER_ID, 1, 20, EmergencyStatus.CANCELLED,
                null, null, null);
        assertThat(cancelled.getEmergencies()).extracting(EmergencyDTO::getId).containsExactly(second, first);

        Instant from = at(60);
        EmergencyHistoryResponse window = emergencyService.history(OWNER_ID, null, null, null, null, from, at(400));
        assertThat(window.getEmergencies()).extracting(EmergencyDTO::getId).containsExactly(second);

        assertThat(emergencyService.history(STRANGER_ID, 1, 20, null, null, null, null).getTotal()).isZero();
        assertThatThrownBy(() -> emergencyService.history(OWNER_ID, 0, 20, null, null, null, null))
                .isInstanceOf(ValidationException.class);
        assertThatThrownBy(() -> emergencyService.history(OWNER_ID, 1, 101, null, null, null, null))
                .isInstanceOf(ValidationException.class);
    }
}
