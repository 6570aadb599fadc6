package com.sosapp.emergency.service;

import com.sosapp.emergency.repository.UserTriggerLockRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Per-user serialization point for creating emergencies. Holding the lock until the caller's
 * transaction commits makes the open-emergency count and the insert one atomic step.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class UserTriggerGate {

    private final UserTriggerLockRepository userTriggerLockRepository;
    private final UserTriggerLockRegistrar registrar;

    @Transactional(propagation = Propagation.MANDATORY)
    public void acquire(Long userId) {
        if (userTriggerLockRepository.findByUserIdForUpdate(userId).isPresent()) {
            return;
        }
        try {
            registrar.register(userId);
        } catch (DataIntegrityViolationException ex) {
            log.debug("Trigger lock row for user {} created concurrently", userId);
        }
        userTriggerLockRepository.findByUserIdForUpdate(userId)
                .orElseThrow(() -> new IllegalStateException("Trigger lock row missing for user " + userId));
    }
}
