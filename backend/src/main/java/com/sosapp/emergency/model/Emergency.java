package com.sosapp.emergency.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embedded;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "emergencies", indexes = {
        @Index(name = "idx_emergencies_user_status", columnList = "user_id, status"),
        @Index(name = "idx_emergencies_created_at", columnList = "created_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Emergency {

    public static final String TRIGGERED_BY_USER = "user";
    public static final String DEVICE_PREFIX = "device:";

    @Id
    private UUID id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EmergencyType type;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private EmergencyStatus status;

    @Embedded
    private GeoLocation location;

    @Column(name = "countdown_seconds", nullable = false)
    private int countdownSeconds;

    @Column(name = "auto_triggered", nullable = false)
    private boolean autoTriggered;

    @Column(name = "triggered_by", nullable = false, length = 120)
    private String triggeredBy;

    @Column(name = "detection_confidence")
    private Double confidence;

    @Column(name = "initial_message", length = 1000)
    private String initialMessage;

    @Column(name = "transition_version", nullable = false)
    private int transitionVersion;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "activated_at")
    private Instant activatedAt;

    @Column(name = "cancelled_at")
    private Instant cancelledAt;

    @Column(name = "cancellation_reason", length = 500)
    private String cancellationReason;

    @Column(name = "resolved_at")
    private Instant resolvedAt;

    @Column(name = "resolution_notes", length = 2000)
    private String resolutionNotes;

    public Instant countdownDeadline() {
        return createdAt.plusSeconds(countdownSeconds);
    }

    public boolean isOwnedBy(Long candidateUserId) {
        return userId != null && userId.equals(candidateUserId);
    }

    /**
     * Bumps the version carried by events emitted for the mutation in progress.
     */
    public int nextVersion() {
        transitionVersion++;
        return transitionVersion;
    }
}
