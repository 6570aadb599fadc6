package com.sosapp.emergency.dto;

import com.sosapp.emergency.model.EscalationState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationSummaryDTO {

    private int currentTier;
    private Instant tierDeadline;
    private Instant nextCheckAt;
    private int reminderCount;
    private boolean stopped;
    private String stopReason;

    public static EscalationSummaryDTO from(EscalationState state) {
        if (state == null) {
            return null;
        }
        return EscalationSummaryDTO.builder()
                .currentTier(state.getCurrentTier())
                .tierDeadline(state.getTierDeadline())
                .nextCheckAt(state.getNextCheckAt())
                .reminderCount(state.getReminderCount())
                .stopped(state.isStopped())
                .stopReason(state.getStopReason())
                .build();
    }
}
