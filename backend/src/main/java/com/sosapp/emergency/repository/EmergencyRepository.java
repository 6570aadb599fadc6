package com.sosapp.emergency.repository;

import com.sosapp.emergency.model.Emergency;
import com.sosapp.emergency.model.EmergencyStatus;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public interface EmergencyRepository extends JpaRepository<Emergency, UUID>, JpaSpecificationExecutor<Emergency> {

    /**
     * Row lock that serializes every transition of a single emergency.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT e FROM Emergency e WHERE e.id = :id")
    Optional<Emergency> findByIdForUpdate(@Param("id") UUID id);

    List<Emergency> findByStatus(EmergencyStatus status);

    long countByUserIdAndStatusIn(Long userId, Collection<EmergencyStatus> statuses);
}
