package com.sosapp.emergency.repository;

import com.sosapp.emergency.model.Acknowledgment;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface AcknowledgmentRepository extends JpaRepository<Acknowledgment, UUID> {

    Optional<Acknowledgment> findByEmergencyIdAndContactId(UUID emergencyId, Long contactId);

    List<Acknowledgment> findByEmergencyIdOrderByAcknowledgedAtAsc(UUID emergencyId);

    long countByEmergencyId(UUID emergencyId);
}
