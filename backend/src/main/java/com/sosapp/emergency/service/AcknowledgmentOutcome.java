package com.sosapp.emergency.service;

import com.sosapp.emergency.model.Acknowledgment;
import com.sosapp.emergency.model.EmergencyStatus;

/**
 * @param duplicate         the contact had already acknowledged; nothing was written
 * @param escalationStopped this acknowledgment was the one that stopped escalation
 */
public record AcknowledgmentOutcome(Acknowledgment acknowledgment,
                                    EmergencyStatus emergencyStatus,
                                    boolean duplicate,
                                    boolean escalationStopped) {
}
