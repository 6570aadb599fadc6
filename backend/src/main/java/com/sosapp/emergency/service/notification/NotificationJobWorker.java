package com.sosapp.emergency.service.notification;

import com.sosapp.emergency.config.NotificationProperties;
import com.sosapp.emergency.model.Emergency;
import com.sosapp.emergency.model.EmergencyStatus;
import com.sosapp.emergency.model.NotificationChannel;
import com.sosapp.emergency.model.NotificationJob;
import com.sosapp.emergency.repository.EmergencyRepository;
import com.sosapp.emergency.repository.NotificationJobRepository;
import com.sosapp.emergency.service.ContactDirectory;
import com.sosapp.emergency.service.ContactEndpoint;
import com.sosapp.emergency.service.EmergencyMetrics;
import com.sosapp.emergency.service.ScheduledTaskGuard;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Works the notification queue. A failed attempt is retried on the configured backoff until the
 * attempt cap; the first failure of a job also queues the contact's next channel right away, so a
 * broken push token does not hold back the SMS. Provider calls run outside any transaction.
 */
@Slf4j
@Service
public class NotificationJobWorker {

    static final String SEND_ERROR = "SEND_ERROR";

    private final NotificationJobRepository notificationJobRepository;
    private final EmergencyRepository emergencyRepository;
    private final ContactDirectory contactDirectory;
    private final NotificationTemplates templates;
    private final Map<NotificationChannel, NotificationChannelSender> senders = new EnumMap<>(NotificationChannel.class);
    private final ScheduledTaskGuard scheduledTaskGuard;
    private final EmergencyMetrics metrics;
    private final NotificationProperties properties;
    private final Clock clock;

    public NotificationJobWorker(NotificationJobRepository notificationJobRepository,
                                 EmergencyRepository emergencyRepository,
                                 ContactDirectory contactDirectory,
                                 NotificationTemplates templates,
                                 List<NotificationChannelSender> senders,
                                 ScheduledTaskGuard scheduledTaskGuard,
                                 EmergencyMetrics metrics,
                                 NotificationProperties properties,
                                 Clock clock) {
        this.notificationJobRepository = notificationJobRepository;
        this.emergencyRepository = emergencyRepository;
        this.contactDirectory = contactDirectory;
        this.templates = templates;
        senders.forEach(sender -> this.senders.put(sender.channel(), sender));
        this.scheduledTaskGuard = scheduledTaskGuard;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${sos.notifications.worker.poll-interval-ms:1000}")
    public void processDueJobs() {
        scheduledTaskGuard.run("notificationWorker", () -> {
            List<NotificationJob> due = notificationJobRepository
                    .findByStatusAndNextAttemptAtLessThanEqualOrderByNextAttemptAtAsc(NotificationJob.Status.QUEUED,
                            clock.instant(), PageRequest.of(0, properties.getWorker().getBatchSize()));
            for (NotificationJob job : due) {
                try {
                    attempt(job);
                } catch (RuntimeException ex) {
                    log.error("Notification job {} for emergency {} could not be processed", job.getId(),
                            job.getEmergencyId(), ex);
                }
            }
        });
    }

    public void attempt(NotificationJob job) {
        MDC.put("emergencyId", String.valueOf(job.getEmergencyId()));
        try {
            Emergency emergency = emergencyRepository.findById(job.getEmergencyId()).orElse(null);
            if (emergency == null || emergency.getStatus() != EmergencyStatus.ACTIVE) {
                cancel(job);
                return;
            }
            NotificationChannelSender sender = senders.get(job.getChannel());
            DeliveryResult result;
            if (sender == null) {
                result = DeliveryResult.failed("CHANNEL_UNSUPPORTED", "No sender for " + job.getChannel(), true);
            } else {
                result = send(sender, job, emergency);
            }
            Instant now = clock.instant();
            job.setAttempt(job.getAttempt() + 1);
            job.setLastAttemptAt(now);
            if (result.success()) {
                markSent(job, result, now);
                return;
            }
            handleFailure(job, emergency, result, now);
        } finally {
            MDC.remove("emergencyId");
        }
    }

    private DeliveryResult send(NotificationChannelSender sender, NotificationJob job, Emergency emergency) {
        try {
            return sender.send(job, templates.render(job, emergency));
        } catch (RuntimeException ex) {
            log.warn("{} sender threw for job {}", job.getChannel(), job.getId(), ex);
            return DeliveryResult.failed(SEND_ERROR, ex.getClass().getSimpleName() + ": " + ex.getMessage(), false);
        }
    }

    private void markSent(NotificationJob job, DeliveryResult result, Instant now) {
        job.setStatus(NotificationJob.Status.SENT);
        job.setSentAt(now);
        job.setProviderMessageId(result.providerMessageId());
        job.setNextAttemptAt(null);
        job.setLastError(null);
        notificationJobRepository.save(job);
        metrics.recordNotificationAttempt(job.getChannel(), "sent");
        log.info("{} {} to contact {} sent (attempt {})", job.getKind(), job.getChannel(), job.getRecipientId(), job.getAttempt());
    }

    private void handleFailure(NotificationJob job, Emergency emergency, DeliveryResult result, Instant now) {
        job.setLastError(describe(result));
        if (result.permanent() || job.getAttempt() >= properties.getMaxAttempts()) {
            job.setStatus(NotificationJob.Status.FAILED);
            job.setNextAttemptAt(null);
            metrics.recordNotificationAttempt(job.getChannel(), "failed");
            log.warn("{} {} to contact {} FAILED after {} attempts: {}", job.getKind(), job.getChannel(),
                    job.getRecipientId(), job.getAttempt(), job.getLastError());
        } else {
            job.setNextAttemptAt(now.plus(properties.backoffAfter(job.getAttempt())));
            metrics.recordNotificationAttempt(job.getChannel(), "retry");
            log.warn("{} {} to contact {} failed (attempt {}/{}), retry at {}: {}", job.getKind(), job.getChannel(),
                    job.getRecipientId(), job.getAttempt(), properties.getMaxAttempts(), job.getNextAttemptAt(),
                    job.getLastError());
        }
        NotificationJob fallback = null;
        if (!job.isFallbackEnqueued()) {
            job.setFallbackEnqueued(true);
            fallback = enqueueFallback(job, emergency, now).orElse(null);
        }
        notificationJobRepository.save(job);
        if (fallback != null) {
            attempt(fallback);
        }
    }

    private Optional<NotificationJob> enqueueFallback(NotificationJob failed, Emergency emergency, Instant now) {
        Optional<ContactEndpoint> contact = contactDirectory.findContact(emergency.getUserId(), failed.getRecipientId());
        if (contact.isEmpty()) {
            return Optional.empty();
        }
        List<NotificationChannel> channels = contact.get().channels();
        int index = channels.indexOf(failed.getChannel());
        if (index < 0 || index + 1 >= channels.size()) {
            log.info("No fallback channel after {} for contact {}", failed.getChannel(), failed.getRecipientId());
            return Optional.empty();
        }
        NotificationChannel next = channels.get(index + 1);
        if (notificationJobRepository.existsByDispatchKeyAndRecipientIdAndChannel(failed.getDispatchKey(),
                failed.getRecipientId(), next)) {
            return Optional.empty();
        }
        NotificationJob fallback = notificationJobRepository.save(NotificationJob.builder()
                .id(UUID.randomUUID())
                .emergencyId(failed.getEmergencyId())
                .dispatchKey(failed.getDispatchKey())
                .recipientId(failed.getRecipientId())
                .recipientName(failed.getRecipientName())
                .channel(next)
                .destination(contact.get().destinationFor(next))
                .kind(failed.getKind())
                .tier(failed.getTier())
                .status(NotificationJob.Status.QUEUED)
                .attempt(0)
                .nextAttemptAt(now)
                .fallbackOf(failed.getId())
                .fallbackEnqueued(false)
                .createdAt(now)
                .build());
        metrics.recordFallback();
        log.info("Falling back from {} to {} for contact {}", failed.getChannel(), next, failed.getRecipientId());
        return Optional.of(fallback);
    }

    private void cancel(NotificationJob job) {
        job.setStatus(NotificationJob.Status.CANCELLED);
        job.setNextAttemptAt(null);
        notificationJobRepository.save(job);
        log.info("Dropped {} {} for contact {}: emergency no longer active", job.getKind(), job.getChannel(),
                job.getRecipientId());
    }

    private String describe(DeliveryResult result) {
        if (result.errorCode() == null) {
            return result.error();
        }
        return result.error() == null ? result.errorCode() : result.errorCode() + ": " + result.error();
    }
}
