package com.sosapp.emergency.service;

import com.sosapp.emergency.model.UserTriggerLock;
import com.sosapp.emergency.repository.UserTriggerLockRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;

/**
 * Creates a user's lock row in its own transaction so it is visible to every racing trigger
 * before any of them tries to lock it.
 */
@Component
@RequiredArgsConstructor
class UserTriggerLockRegistrar {

    private final UserTriggerLockRepository userTriggerLockRepository;
    private final Clock clock;

    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public void register(Long userId) {
        if (!userTriggerLockRepository.existsById(userId)) {
            userTriggerLockRepository.saveAndFlush(new UserTriggerLock(userId, Instant.now(clock)));
        }
    }
}
