package com.sosapp.emergency.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sosapp.emergency.config.EventProperties;
import com.sosapp.emergency.event.EmergencyEvent;
import com.sosapp.emergency.event.EventBus;
import com.sosapp.emergency.event.OutboxEventRecordedEvent;
import com.sosapp.emergency.model.OutboxEvent;
import com.sosapp.emergency.repository.OutboxEventRepository;
import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Moves committed outbox rows onto the {@link EventBus}. Delivery is at-least-once: a row is marked
 * published only after every subscriber accepted it, and failed rows are retried with exponential
 * backoff until they land in the dead-letter queue.
 */
@Slf4j
@Service
public class OutboxRelay {

    private final OutboxEventRepository outboxEventRepository;
    private final EventBus eventBus;
    private final ObjectMapper objectMapper;
    private final TaskScheduler taskScheduler;
    private final DeadLetterQueueService deadLetterQueueService;
    private final ScheduledTaskGuard scheduledTaskGuard;
    private final EmergencyMetrics metrics;
    private final EventProperties properties;
    private final Clock clock;
    private final IntervalFunction backoff;

    public OutboxRelay(OutboxEventRepository outboxEventRepository,
                       EventBus eventBus,
                       ObjectMapper objectMapper,
                       TaskScheduler taskScheduler,
                       DeadLetterQueueService deadLetterQueueService,
                       ScheduledTaskGuard scheduledTaskGuard,
                       EmergencyMetrics metrics,
                       EventProperties properties,
                       Clock clock) {
        this.outboxEventRepository = outboxEventRepository;
        this.eventBus = eventBus;
        this.objectMapper = objectMapper;
        this.taskScheduler = taskScheduler;
        this.deadLetterQueueService = deadLetterQueueService;
        this.scheduledTaskGuard = scheduledTaskGuard;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
        this.backoff = IntervalFunction.ofExponentialBackoff(
                properties.getInitialBackoff(), properties.getMultiplier(), properties.getMaxBackoff());
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)
    public void onRecorded(OutboxEventRecordedEvent recorded) {
        taskScheduler.schedule(() -> scheduledTaskGuard.run("outboxDeliver", () -> deliver(recorded.outboxEventId())),
                clock.instant());
    }

    @Scheduled(fixedDelayString = "${sos.events.relay-interval-ms:5000}")
    public void relayPending() {
        scheduledTaskGuard.run("outboxRelay", () -> {
            List<OutboxEvent> due = outboxEventRepository.findByStatusAndNextAttemptAtLessThanEqualOrderByCreatedAtAsc(
                    OutboxEvent.Status.PENDING, clock.instant(), PageRequest.of(0, properties.getBatchSize()));
            if (!due.isEmpty()) {
                log.info("Relaying {} pending outbox events", due.size());
            }
            due.forEach(this::deliver);
        });
    }

    public void deliver(UUID outboxEventId) {
        outboxEventRepository.findById(outboxEventId)
                .filter(row -> row.getStatus() == OutboxEvent.Status.PENDING)
                .ifPresent(this::deliver);
    }

    void deliver(OutboxEvent row) {
        MDC.put("emergencyId", String.valueOf(row.getEmergencyId()));
        try {
            EmergencyEvent event = objectMapper.readValue(row.getPayload(), EmergencyEvent.class);
            eventBus.publish(row.getTopic(), event);
            row.setAttempts(row.getAttempts() + 1);
            row.setStatus(OutboxEvent.Status.PUBLISHED);
            row.setPublishedAt(clock.instant());
            row.setLastError(null);
            outboxEventRepository.save(row);
            log.debug("Published {} to {}", event.dedupeKey(), row.getTopic());
        } catch (JsonProcessingException ex) {
            markFailed(row, "Unreadable payload: " + ex.getOriginalMessage());
        } catch (RuntimeException ex) {
            scheduleRetry(row, ex);
        } finally {
            MDC.remove("emergencyId");
        }
    }

    private void scheduleRetry(OutboxEvent row, RuntimeException error) {
        metrics.recordOutboxFailure();
        int attempts = row.getAttempts() + 1;
        row.setAttempts(attempts);
        row.setLastError(rootMessage(error));
        if (attempts >= properties.getMaxAttempts()) {
            markFailed(row, row.getLastError());
            return;
        }
        Instant next = clock.instant().plus(Duration.ofMillis(backoff.apply(attempts)));
        row.setNextAttemptAt(next);
        outboxEventRepository.save(row);
        log.warn("Outbox delivery failed event={} topic={} attempts={} nextAttemptAt={} error={}",
                row.getId(), row.getTopic(), attempts, next, row.getLastError());
    }

    private void markFailed(OutboxEvent row, String error) {
        row.setStatus(OutboxEvent.Status.FAILED);
        row.setLastError(error);
        row.setNextAttemptAt(null);
        outboxEventRepository.save(row);
        deadLetterQueueService.logFailure(DeadLetterQueueService.OUTBOX_DELIVERY,
                "outboxEventId=" + row.getId() + " topic=" + row.getTopic() + " emergencyId=" + row.getEmergencyId(),
                error);
    }

    private String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage() != null ? current.getMessage() : current.getClass().getSimpleName();
    }
}
