package com.sosapp.emergency.event;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Synchronous fan-out. Durability comes from the outbox in front of it: a failed publish leaves the
 * outbox row pending and the relay delivers it again.
 */
@Slf4j
@Component
public class InProcessEventBus implements EventBus {

    private final Map<String, List<EmergencyEventHandler>> subscribers = new ConcurrentHashMap<>();

    @Override
    public void publish(String topic, EmergencyEvent event) {
        List<EmergencyEventHandler> handlers = subscribers.getOrDefault(topic, List.of());
        if (handlers.isEmpty()) {
            log.debug("No subscribers for topic={} event={}", topic, event.dedupeKey());
            return;
        }
        RuntimeException firstFailure = null;
        for (EmergencyEventHandler handler : handlers) {
            try {
                handler.handle(event);
            } catch (RuntimeException ex) {
                log.warn("Subscriber failed topic={} event={} error={}", topic, event.dedupeKey(), ex.getMessage());
                if (firstFailure == null) {
                    firstFailure = ex;
                }
            }
        }
        if (firstFailure != null) {
            throw new EventDeliveryException("Delivery failed for " + event.dedupeKey() + " on " + topic, firstFailure);
        }
    }

    @Override
    public void subscribe(String topic, EmergencyEventHandler handler) {
        subscribers.computeIfAbsent(topic, key -> new CopyOnWriteArrayList<>()).add(handler);
        log.info("Subscribed handler to topic={}", topic);
    }
}
