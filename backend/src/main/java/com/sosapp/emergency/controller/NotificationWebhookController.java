package com.sosapp.emergency.controller;

import com.sosapp.emergency.config.NotificationProperties;
import com.sosapp.emergency.dto.DeliveryReceiptRequest;
import com.sosapp.emergency.dto.NotificationJobDTO;
import com.sosapp.emergency.exception.UnauthorizedException;
import com.sosapp.emergency.service.notification.DeliveryReceiptService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;

@RestController
@RequestMapping("/api/v1/notifications/webhooks")
@RequiredArgsConstructor
@Tag(name = "Notification webhooks")
public class NotificationWebhookController {

    public static final String SECRET_HEADER = "X-Webhook-Secret";

    private final DeliveryReceiptService deliveryReceiptService;
    private final NotificationProperties notificationProperties;

    @PostMapping("/delivery")
    @Operation(summary = "Delivery receipt from a notification provider")
    public ResponseEntity<NotificationJobDTO> delivery(@RequestHeader(value = SECRET_HEADER, required = false) String secret,
                                                       @Valid @RequestBody DeliveryReceiptRequest request) {
        requireSecret(secret);
        return ResponseEntity.ok(NotificationJobDTO.from(deliveryReceiptService.apply(request)));
    }

    private void requireSecret(String presented) {
        String expected = notificationProperties.getWebhookSecret();
        if (expected == null || expected.isBlank() || presented == null
                || !MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8))) {
            throw new UnauthorizedException("Invalid webhook secret");
        }
    }
}
