package com.sosapp.emergency.service.notification;

import com.sosapp.emergency.event.EmergencyEventType;
import com.sosapp.emergency.event.EventBus;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Wires the dispatcher's transactional proxy to the bus topics it consumes.
 */
@Component
@RequiredArgsConstructor
public class NotificationEventSubscriber {

    private final EventBus eventBus;
    private final NotificationDispatcher notificationDispatcher;

    @PostConstruct
    void subscribe() {
        eventBus.subscribe(EmergencyEventType.CREATED.topic(), notificationDispatcher::handle);
        eventBus.subscribe(EmergencyEventType.ESCALATION_TRIGGERED.topic(), notificationDispatcher::handle);
        eventBus.subscribe(EmergencyEventType.CANCELLED.topic(), notificationDispatcher::handle);
        eventBus.subscribe(EmergencyEventType.RESOLVED.topic(), notificationDispatcher::handle);
    }
}
