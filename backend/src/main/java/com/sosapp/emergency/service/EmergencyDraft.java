package com.sosapp.emergency.service;

import com.sosapp.emergency.model.EmergencyType;
import com.sosapp.emergency.model.GeoLocation;

/**
 * Validated input for a new emergency, from either the user or a paired device.
 */
public record EmergencyDraft(
        Long userId,
        EmergencyType type,
        GeoLocation location,
        int countdownSeconds,
        boolean autoTriggered,
        String triggeredBy,
        Double confidence,
        String message
) {
}
