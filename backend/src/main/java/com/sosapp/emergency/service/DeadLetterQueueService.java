package com.sosapp.emergency.service;

import com.sosapp.emergency.model.FailedOperation;
import com.sosapp.emergency.repository.FailedOperationRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;

@Service
@Slf4j
@RequiredArgsConstructor
public class DeadLetterQueueService {

    public static final String OUTBOX_DELIVERY = "OUTBOX_DELIVERY";
    public static final String TIMER_TICK = "TIMER_TICK";

    private final FailedOperationRepository repo;
    private final Clock clock;

    public void logFailure(String type, String details, String error) {
        log.error("DLQ entry: [{}] {} -> {}", type, details, error);
        try {
            repo.save(FailedOperation.builder()
                    .operationType(type)
                    .details(truncate(details, 500))
                    .errorMessage(truncate(error, 2000))
                    .createdAt(Instant.now(clock))
                    .resolved(false)
                    .retryCount(0)
                    .build());
        } catch (RuntimeException ex) {
            log.error("Could not persist DLQ entry type={} details={}", type, details, ex);
        }
    }

    private String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        return value.substring(0, max);
    }
}
