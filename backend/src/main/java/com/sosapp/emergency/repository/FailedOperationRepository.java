package com.sosapp.emergency.repository;

import com.sosapp.emergency.model.FailedOperation;
import org.springframework.data.jpa.repository.JpaRepository;

public interface FailedOperationRepository extends JpaRepository<FailedOperation, Long> {
}
