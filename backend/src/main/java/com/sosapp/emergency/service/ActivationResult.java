package com.sosapp.emergency.service;

import com.sosapp.emergency.model.Emergency;
import com.sosapp.emergency.model.EscalationState;

public record ActivationResult(Emergency emergency, EscalationState escalation) {
}
