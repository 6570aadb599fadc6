package com.sosapp.emergency.dto;

import com.sosapp.emergency.model.EmergencyStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerEmergencyResponse {

    private UUID emergencyId;
    private EmergencyStatus status;
    private int countdownSeconds;
    private Instant activatesAt;
    private boolean autoTriggered;
}
