package com.sosapp.emergency.service.notification;

import com.sosapp.emergency.dto.DeliveryReceiptRequest;
import com.sosapp.emergency.exception.NotFoundException;
import com.sosapp.emergency.exception.ValidationException;
import com.sosapp.emergency.model.NotificationJob;
import com.sosapp.emergency.repository.NotificationJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;

@Slf4j
@Service
@RequiredArgsConstructor
public class DeliveryReceiptService {

    private final NotificationJobRepository notificationJobRepository;
    private final Clock clock;

    @Transactional
    public NotificationJob apply(DeliveryReceiptRequest receipt) {
        NotificationJob job = notificationJobRepository.findByProviderMessageId(receipt.getProviderMessageId())
                .orElseThrow(() -> new NotFoundException("Unknown provider message id"));
        String status = receipt.getStatus().trim().toUpperCase(Locale.ROOT);
        if (job.getStatus() != NotificationJob.Status.SENT) {
            log.debug("Receipt {} for job {} ignored, job is {}", status, job.getId(), job.getStatus());
            return job;
        }
        switch (status) {
            case "DELIVERED" -> {
                job.setStatus(NotificationJob.Status.DELIVERED);
                job.setDeliveredAt(Instant.now(clock));
            }
            case "FAILED" -> {
                job.setStatus(NotificationJob.Status.FAILED);
                job.setLastError(receipt.getErrorCode() != null ? receipt.getErrorCode() : "UNDELIVERED");
            }
            default -> throw new ValidationException("status must be DELIVERED or FAILED");
        }
        log.info("Job {} {} to contact {} is now {}", job.getId(), job.getChannel(), job.getRecipientId(), job.getStatus());
        return notificationJobRepository.save(job);
    }
}
