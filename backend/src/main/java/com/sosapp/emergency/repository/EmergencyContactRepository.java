package com.sosapp.emergency.repository;

import com.sosapp.emergency.model.EmergencyContact;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface EmergencyContactRepository extends JpaRepository<EmergencyContact, Long> {

    List<EmergencyContact> findByUserIdAndTierAndActiveTrueOrderByPriorityAsc(Long userId, int tier);

    Optional<EmergencyContact> findFirstByUserIdAndContactUserIdAndActiveTrue(Long userId, Long contactUserId);
}
