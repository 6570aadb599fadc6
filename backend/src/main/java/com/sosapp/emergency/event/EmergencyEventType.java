package com.sosapp.emergency.event;

public enum EmergencyEventType {
    CREATED("emergency-created"),
    CANCELLED("emergency-cancelled"),
    RESOLVED("emergency-resolved"),
    CONTACT_ACKNOWLEDGED("contact-acknowledged"),
    ESCALATION_TRIGGERED("escalation-triggered");

    private final String topic;

    EmergencyEventType(String topic) {
        this.topic = topic;
    }

    public String topic() {
        return topic;
    }
}
