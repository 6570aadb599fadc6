package com.sosapp.emergency.dto;

import com.sosapp.emergency.model.NotificationChannel;
import com.sosapp.emergency.model.NotificationJob;
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
public class NotificationJobDTO {

    private UUID id;
    private Long recipientId;
    private String recipientName;
    private NotificationChannel channel;
    private NotificationJob.Kind kind;
    private int tier;
    private NotificationJob.Status status;
    private int attempt;
    private Instant nextAttemptAt;
    private String lastError;
    private UUID fallbackOf;
    private Instant createdAt;
    private Instant sentAt;
    private Instant deliveredAt;

    public static NotificationJobDTO from(NotificationJob job) {
        return NotificationJobDTO.builder()
                .id(job.getId())
                .recipientId(job.getRecipientId())
                .recipientName(job.getRecipientName())
                .channel(job.getChannel())
                .kind(job.getKind())
                .tier(job.getTier())
                .status(job.getStatus())
                .attempt(job.getAttempt())
                .nextAttemptAt(job.getNextAttemptAt())
                .lastError(job.getLastError())
                .fallbackOf(job.getFallbackOf())
                .createdAt(job.getCreatedAt())
                .sentAt(job.getSentAt())
                .deliveredAt(job.getDeliveredAt())
                .build();
    }
}
