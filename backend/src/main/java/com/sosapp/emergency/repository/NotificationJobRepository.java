package com.sosapp.emergency.repository;

import com.sosapp.emergency.model.NotificationChannel;
import com.sosapp.emergency.model.NotificationJob;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface NotificationJobRepository extends JpaRepository<NotificationJob, UUID> {

    List<NotificationJob> findByStatusAndNextAttemptAtLessThanEqualOrderByNextAttemptAtAsc(NotificationJob.Status status,
                                                                                           Instant now,
                                                                                           Pageable pageable);

    List<NotificationJob> findByEmergencyIdOrderByCreatedAtAsc(UUID emergencyId);

    List<NotificationJob> findByEmergencyIdAndStatus(UUID emergencyId, NotificationJob.Status status);

    boolean existsByDispatchKeyAndRecipientIdAndChannel(String dispatchKey, Long recipientId, NotificationChannel channel);

    Optional<NotificationJob> findByProviderMessageId(String providerMessageId);
}
