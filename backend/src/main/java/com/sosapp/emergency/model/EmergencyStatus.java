package com.sosapp.emergency.model;

/**
 * Emergency lifecycle.
 * PENDING is the cancellable countdown; ACTIVE means contacts are being alerted.
 */
public enum EmergencyStatus {
    PENDING,
    ACTIVE,
    CANCELLED,
    RESOLVED;

    public boolean isTerminal() {
        return this == CANCELLED || this == RESOLVED;
    }

    public boolean canTransitionTo(EmergencyStatus target) {
        if (target == null || this == target) {
            return false;
        }
        return switch (this) {
            case PENDING -> target == ACTIVE || target == CANCELLED || target == RESOLVED;
            case ACTIVE -> target == RESOLVED;
            default -> false;
        };
    }
}
