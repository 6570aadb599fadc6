package com.sosapp.emergency.repository;

import com.sosapp.emergency.model.UserTriggerLock;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.util.Optional;

public interface UserTriggerLockRepository extends JpaRepository<UserTriggerLock, Long> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT l FROM UserTriggerLock l WHERE l.userId = :userId")
    Optional<UserTriggerLock> findByUserIdForUpdate(@Param("userId") Long userId);
}
