package com.sosapp.emergency.service.notification;

import com.sosapp.emergency.event.EmergencyEvent;
import com.sosapp.emergency.event.EmergencyEventType;
import com.sosapp.emergency.model.Emergency;
import com.sosapp.emergency.model.EmergencyStatus;
import com.sosapp.emergency.model.NotificationChannel;
import com.sosapp.emergency.model.NotificationJob;
import com.sosapp.emergency.model.ProcessedEvent;
import com.sosapp.emergency.repository.EmergencyRepository;
import com.sosapp.emergency.repository.NotificationJobRepository;
import com.sosapp.emergency.repository.ProcessedEventRepository;
import com.sosapp.emergency.service.ContactDirectory;
import com.sosapp.emergency.service.ContactEndpoint;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Turns emergency events into notification jobs. Each event is handled once per consumer: the
 * processed marker is written in the same transaction as the jobs.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationDispatcher {

    public static final String CONSUMER = "notification-dispatcher";

    private final ProcessedEventRepository processedEventRepository;
    private final NotificationJobRepository notificationJobRepository;
    private final EmergencyRepository emergencyRepository;
    private final ContactDirectory contactDirectory;
    private final Clock clock;

    @Transactional
    public void handle(EmergencyEvent event) {
        if (processedEventRepository.existsByConsumerAndEmergencyIdAndEventTypeAndTransitionVersion(
                CONSUMER, event.emergencyId(), event.eventType(), event.transitionVersion())) {
            log.debug("Skipping already processed event {}", event.dedupeKey());
            return;
        }
        Instant now = Instant.now(clock);
        processedEventRepository.save(ProcessedEvent.builder()
                .consumer(CONSUMER)
                .emergencyId(event.emergencyId())
                .eventType(event.eventType())
                .transitionVersion(event.transitionVersion())
                .processedAt(now)
                .build());

        switch (event.eventType()) {
            case CREATED, ESCALATION_TRIGGERED -> enqueueAlerts(event, now);
            case CANCELLED, RESOLVED -> cancelQueued(event);
            default -> log.debug("Event {} needs no notification", event.dedupeKey());
        }
    }

    private void enqueueAlerts(EmergencyEvent event, Instant now) {
        EmergencyStatus status = emergencyRepository.findById(event.emergencyId())
                .map(Emergency::getStatus)
                .orElse(null);
        if (status != EmergencyStatus.ACTIVE) {
            log.info("Emergency {} is {}, dropping {}", event.emergencyId(), status, event.dedupeKey());
            return;
        }
        int tier = event.tier() != null ? event.tier() : 1;
        NotificationJob.Kind kind = kindOf(event);
        List<ContactEndpoint> contacts = recipients(event.userId(), tier, kind);
        if (contacts.isEmpty()) {
            log.warn("No reachable contacts for emergency {} tier {}", event.emergencyId(), tier);
            return;
        }
        String dispatchKey = event.eventType() + ":" + event.transitionVersion();
        int created = 0;
        for (ContactEndpoint contact : contacts) {
            if (contact.channels().isEmpty()) {
                log.warn("Contact {} of user {} has no usable channel", contact.contactId(), event.userId());
                continue;
            }
            NotificationChannel channel = contact.channels().get(0);
            if (notificationJobRepository.existsByDispatchKeyAndRecipientIdAndChannel(dispatchKey, contact.contactId(), channel)) {
                continue;
            }
            notificationJobRepository.save(NotificationJob.builder()
                    .id(UUID.randomUUID())
                    .emergencyId(event.emergencyId())
                    .dispatchKey(dispatchKey)
                    .recipientId(contact.contactId())
                    .recipientName(contact.name())
                    .channel(channel)
                    .destination(contact.destinationFor(channel))
                    .kind(kind)
                    .tier(tier)
                    .status(NotificationJob.Status.QUEUED)
                    .attempt(0)
                    .nextAttemptAt(now)
                    .fallbackEnqueued(false)
                    .createdAt(now)
                    .build());
            created++;
        }
        log.info("Queued {} {} notifications for emergency {} tier {}", created, kind, event.emergencyId(), tier);
    }

    /**
     * Tier N on escalation; every tier reached so far on a reminder.
     */
    private List<ContactEndpoint> recipients(Long userId, int tier, NotificationJob.Kind kind) {
        if (kind != NotificationJob.Kind.REMINDER) {
            return contactDirectory.getPrioritizedContacts(userId, tier);
        }
        List<ContactEndpoint> all = new ArrayList<>();
        for (int t = 1; t <= tier; t++) {
            all.addAll(contactDirectory.getPrioritizedContacts(userId, t));
        }
        return all;
    }

    private NotificationJob.Kind kindOf(EmergencyEvent event) {
        if (event.eventType() == EmergencyEventType.CREATED) {
            return NotificationJob.Kind.ALERT;
        }
        return event.isReminder() ? NotificationJob.Kind.REMINDER : NotificationJob.Kind.ESCALATION;
    }

    private void cancelQueued(EmergencyEvent event) {
        List<NotificationJob> queued = notificationJobRepository.findByEmergencyIdAndStatus(
                event.emergencyId(), NotificationJob.Status.QUEUED);
        queued.forEach(job -> {
            job.setStatus(NotificationJob.Status.CANCELLED);
            job.setNextAttemptAt(null);
        });
        notificationJobRepository.saveAll(queued);
        if (!queued.isEmpty()) {
            log.info("Cancelled {} queued notifications of emergency {} ({})", queued.size(),
                    event.emergencyId(), event.eventType());
        }
    }
}
