package com.sosapp.emergency.event;

import com.sosapp.emergency.model.EmergencyStatus;
import com.sosapp.emergency.model.EmergencyType;
import com.sosapp.emergency.model.GeoLocation;
import lombok.Builder;

import java.time.Instant;
import java.util.UUID;

/**
 * Payload carried on every topic. {@code (emergencyId, eventType, transitionVersion)} identifies the
 * event for consumer de-duplication; fields that do not apply to a type are null.
 */
@Builder(toBuilder = true)
public record EmergencyEvent(
        UUID eventId,
        EmergencyEventType eventType,
        UUID emergencyId,
        int transitionVersion,
        Long userId,
        EmergencyType emergencyType,
        EmergencyStatus status,
        GeoLocation location,
        Integer tier,
        Integer reminder,
        Long contactId,
        String contactName,
        String reason,
        Long durationSeconds,
        boolean autoTriggered,
        Instant occurredAt
) {

    public String dedupeKey() {
        return emergencyId + ":" + eventType + ":" + transitionVersion;
    }

    public boolean isReminder() {
        return reminder != null && reminder > 0;
    }
}
