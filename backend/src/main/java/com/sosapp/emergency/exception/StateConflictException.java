package com.sosapp.emergency.exception;

import com.sosapp.emergency.model.EmergencyStatus;

public class StateConflictException extends RuntimeException {
    private final EmergencyStatus currentStatus;

    public StateConflictException(String message, EmergencyStatus currentStatus) {
        super(message);
        this.currentStatus = currentStatus;
    }

    public EmergencyStatus getCurrentStatus() {
        return currentStatus;
    }
}
