package com.sosapp.emergency.model;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Persisted escalation progress so a restarted process resumes at the right tier.
 * {@code tierDeadline} is null once the last tier is reached.
 */
@Entity
@Table(name = "escalation_states")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EscalationState {

    @Id
    @Column(name = "emergency_id")
    private UUID emergencyId;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "current_tier", nullable = false)
    private int currentTier;

    @Column(name = "tier_deadline")
    private Instant tierDeadline;

    @Column(name = "next_check_at")
    private Instant nextCheckAt;

    @Column(name = "reminder_count", nullable = false)
    private int reminderCount;

    @Column(nullable = false)
    private boolean stopped;

    @Column(name = "stop_reason", length = 40)
    private String stopReason;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public void stop(String reason, Instant at) {
        this.stopped = true;
        this.stopReason = reason;
        this.nextCheckAt = null;
        this.updatedAt = at;
    }
}
