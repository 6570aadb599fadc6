package com.sosapp.emergency.repository;

import com.sosapp.emergency.event.EmergencyEventType;
import com.sosapp.emergency.model.ProcessedEvent;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface ProcessedEventRepository extends JpaRepository<ProcessedEvent, Long> {

    boolean existsByConsumerAndEmergencyIdAndEventTypeAndTransitionVersion(String consumer,
                                                                          UUID emergencyId,
                                                                          EmergencyEventType eventType,
                                                                          int transitionVersion);
}
