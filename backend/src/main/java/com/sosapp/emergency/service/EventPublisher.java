package com.sosapp.emergency.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sosapp.emergency.config.EventProperties;
import com.sosapp.emergency.event.EmergencyEvent;
import com.sosapp.emergency.event.EmergencyEventType;
import com.sosapp.emergency.event.OutboxEventRecordedEvent;
import com.sosapp.emergency.model.Emergency;
import com.sosapp.emergency.model.OutboxEvent;
import com.sosapp.emergency.repository.OutboxEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * Writes domain events to the outbox inside the caller's transaction. Nothing reaches the bus until
 * that transaction commits; {@link OutboxRelay} takes it from there.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EventPublisher {

    private final OutboxEventRepository outboxEventRepository;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher applicationEventPublisher;
    private final EventProperties eventProperties;
    private final Clock clock;

    /**
     * Records an event stamped with the emergency's current transition version.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public EmergencyEvent record(Emergency emergency, EmergencyEventType type,
                                 UnaryOperator<EmergencyEvent.EmergencyEventBuilder> details) {
        Instant now = Instant.now(clock);
        EmergencyEvent event = details.apply(EmergencyEvent.builder()
                        .eventId(UUID.randomUUID())
                        .eventType(type)
                        .emergencyId(emergency.getId())
                        .transitionVersion(emergency.getTransitionVersion())
                        .userId(emergency.getUserId())
                        .emergencyType(emergency.getType())
                        .status(emergency.getStatus())
                        .location(emergency.getLocation())
                        .autoTriggered(emergency.isAutoTriggered())
                        .occurredAt(now))
                .build();

        OutboxEvent row = OutboxEvent.builder()
                .id(event.eventId())
                .emergencyId(event.emergencyId())
                .eventType(type)
                .topic(type.topic())
                .transitionVersion(event.transitionVersion())
                .payload(serialize(event))
                .status(OutboxEvent.Status.PENDING)
                .attempts(0)
                // the after-commit hook delivers first; the sweep only picks up what it missed
                .nextAttemptAt(now.plus(eventProperties.getSweepGrace()))
                .createdAt(now)
                .build();
        outboxEventRepository.save(row);
        applicationEventPublisher.publishEvent(new OutboxEventRecordedEvent(row.getId(), row.getEmergencyId()));
        log.info("Recorded {} for emergency={} version={}", type, emergency.getId(), event.transitionVersion());
        return event;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public EmergencyEvent record(Emergency emergency, EmergencyEventType type) {
        return record(emergency, type, UnaryOperator.identity());
    }

    private String serialize(EmergencyEvent event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("Could not serialize event " + event.dedupeKey(), ex);
        }
    }
}
