package com.sosapp.emergency.repository;

import com.sosapp.emergency.event.EmergencyEventType;
import com.sosapp.emergency.model.OutboxEvent;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

public interface OutboxEventRepository extends JpaRepository<OutboxEvent, UUID> {

    List<OutboxEvent> findByStatusAndNextAttemptAtLessThanEqualOrderByCreatedAtAsc(OutboxEvent.Status status,
                                                                                   Instant now,
                                                                                   Pageable pageable);

    List<OutboxEvent> findByEmergencyIdOrderByCreatedAtAsc(UUID emergencyId);

    long countByEmergencyIdAndEventType(UUID emergencyId, EmergencyEventType eventType);
}
