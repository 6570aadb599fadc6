package com.sosapp.emergency.dto;

import com.sosapp.emergency.model.Acknowledgment;
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
public class AcknowledgmentDTO {

    private UUID emergencyId;
    private Long contactId;
    private String contactName;
    private Instant acknowledgedAt;
    private LocationDTO location;
    private String message;

    public static AcknowledgmentDTO from(Acknowledgment acknowledgment) {
        return AcknowledgmentDTO.builder()
                .emergencyId(acknowledgment.getEmergencyId())
                .contactId(acknowledgment.getContactId())
                .contactName(acknowledgment.getContactName())
                .acknowledgedAt(acknowledgment.getAcknowledgedAt())
                .location(LocationDTO.from(acknowledgment.getLocation()))
                .message(acknowledgment.getMessage())
                .build();
    }
}
