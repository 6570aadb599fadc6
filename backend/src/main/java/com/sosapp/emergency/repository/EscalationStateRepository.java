package com.sosapp.emergency.repository;

import com.sosapp.emergency.model.EscalationState;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface EscalationStateRepository extends JpaRepository<EscalationState, UUID> {
}
