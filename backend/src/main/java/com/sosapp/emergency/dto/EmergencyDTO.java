package com.sosapp.emergency.dto;

import com.sosapp.emergency.model.Emergency;
import com.sosapp.emergency.model.EmergencyStatus;
import com.sosapp.emergency.model.EmergencyType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EmergencyDTO {

    private UUID id;
    private Long userId;
    private EmergencyType type;
    private EmergencyStatus status;
    private LocationDTO location;
    private int countdownSeconds;
    private boolean autoTriggered;
    private String triggeredBy;
    private Double confidence;
    private String initialMessage;
    private Instant createdAt;
    private Instant activatedAt;
    private Instant cancelledAt;
    private String cancellationReason;
    private Instant resolvedAt;
    private String resolutionNotes;
    private List<AcknowledgmentDTO> acknowledgments;
    private EscalationSummaryDTO escalation;

    public static EmergencyDTO from(Emergency emergency) {
        return EmergencyDTO.builder()
                .id(emergency.getId())
                .userId(emergency.getUserId())
                .type(emergency.getType())
                .status(emergency.getStatus())
                .location(LocationDTO.from(emergency.getLocation()))
                .countdownSeconds(emergency.getCountdownSeconds())
                .autoTriggered(emergency.isAutoTriggered())
                .triggeredBy(emergency.getTriggeredBy())
                .confidence(emergency.getConfidence())
                .initialMessage(emergency.getInitialMessage())
                .createdAt(emergency.getCreatedAt())
                .activatedAt(emergency.getActivatedAt())
                .cancelledAt(emergency.getCancelledAt())
                .cancellationReason(emergency.getCancellationReason())
                .resolvedAt(emergency.getResolvedAt())
                .resolutionNotes(emergency.getResolutionNotes())
                .build();
    }
}
