package com.sosapp.emergency.repository;

import com.sosapp.emergency.model.EmergencyTransition;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface EmergencyTransitionRepository extends JpaRepository<EmergencyTransition, Long> {

    List<EmergencyTransition> findByEmergencyIdOrderByTransitionVersionAsc(UUID emergencyId);
}
