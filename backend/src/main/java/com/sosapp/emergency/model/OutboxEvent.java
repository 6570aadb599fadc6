package com.sosapp.emergency.model;

import com.sosapp.emergency.event.EmergencyEventType;
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
 * Domain event written in the same transaction as the state change it describes.
 * The relay hands it to the bus once the transaction has committed.
 */
@Entity
@Table(name = "outbox_events",
        uniqueConstraints = @UniqueConstraint(name = "uk_outbox_event_identity",
                columnNames = {"emergency_id", "event_type", "transition_version"}),
        indexes = @Index(name = "idx_outbox_status_next_attempt", columnList = "status, next_attempt_at"))
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OutboxEvent {

    @Id
    private UUID id;

    @Column(name = "emergency_id", nullable = false)
    private UUID emergencyId;

    @Enumerated(EnumType.STRING)
    @Column(name = "event_type", nullable = false, length = 40)
    private EmergencyEventType eventType;

    @Column(nullable = false, length = 80)
    private String topic;

    @Column(name = "transition_version", nullable = false)
    private int transitionVersion;

    @Column(nullable = false, length = 8000)
    private String payload;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Status status;

    @Column(nullable = false)
    private int attempts;

    @Column(name = "next_attempt_at")
    private Instant nextAttemptAt;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "published_at")
    private Instant publishedAt;

    public enum Status {
        PENDING,
        PUBLISHED,
        FAILED
    }
}
