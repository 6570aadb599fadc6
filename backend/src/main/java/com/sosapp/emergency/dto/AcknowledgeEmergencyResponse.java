package com.sosapp.emergency.dto;

import com.sosapp.emergency.model.EmergencyStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AcknowledgeEmergencyResponse {

    private AcknowledgmentDTO acknowledgment;
    private EmergencyStatus emergencyStatus;
    private boolean duplicate;
    private boolean escalationStopped;
}
