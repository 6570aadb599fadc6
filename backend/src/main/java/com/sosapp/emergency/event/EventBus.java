package com.sosapp.emergency.event;

/**
 * At-least-once topic bus. Subscribers must tolerate redelivery and de-duplicate on
 * {@link EmergencyEvent#dedupeKey()}.
 */
public interface EventBus {

    /**
     * Delivers the event to every subscriber of the topic.
     *
     * @throws EventDeliveryException when a subscriber failed; the caller is expected to retry
     */
    void publish(String topic, EmergencyEvent event);

    void subscribe(String topic, EmergencyEventHandler handler);
}
