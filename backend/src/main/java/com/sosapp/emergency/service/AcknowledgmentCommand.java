package com.sosapp.emergency.service;

import com.sosapp.emergency.model.GeoLocation;

import java.util.UUID;

public record AcknowledgmentCommand(UUID emergencyId,
                                    Long contactId,
                                    String contactName,
                                    GeoLocation location,
                                    String message) {
}
