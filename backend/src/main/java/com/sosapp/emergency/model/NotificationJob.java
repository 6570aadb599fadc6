package com.sosapp.emergency.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One delivery of one message to one contact on one channel.
 * A channel fallback is a new job pointing at the job it replaces through {@code fallbackOf}.
 */
@Entity
@Table(name = "notification_jobs",
        uniqueConstraints = @UniqueConstraint(name = "uk_notification_job_dispatch",
                columnNames = {"dispatch_key", "recipient_id", "channel"}),
        indexes = {
                @Index(name = "idx_notification_jobs_due", columnList = "status, next_attempt_at"),
                @Index(name = "idx_notification_jobs_emergency", columnList = "emergency_id")
        })
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationJob {

    @Id
    private UUID id;

    @Column(name = "emergency_id", nullable = false)
    private UUID emergencyId;

    @Column(name = "dispatch_key", nullable = false, length = 120)
    private String dispatchKey;

    @Column(name = "recipient_id", nullable = false)
    private Long recipientId;

    @Column(name = "recipient_name", length = 200)
    private String recipientName;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 10)
    private NotificationChannel channel;

    @Column(nullable = false, length = 500)
    private String destination;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Kind kind;

    @Column(nullable = false)
    private int tier;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Status status;

    @Column(nullable = false)
    private int attempt;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "last_attempt_at")
    private Instant lastAttemptAt;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    @Column(name = "provider_message_id", length = 200)
    private String providerMessageId;

    @Column(name = "fallback_of")
    private UUID fallbackOf;

    @Column(name = "fallback_enqueued", nullable = false)
    private boolean fallbackEnqueued;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "sent_at")
    private Instant sentAt;

    @Column(name = "delivered_at")
    private Instant deliveredAt;

    public enum Status {
        QUEUED,
        SENT,
        DELIVERED,
        FAILED,
        CANCELLED
    }

    public enum Kind {
        ALERT,
        ESCALATION,
        REMINDER
    }
}
