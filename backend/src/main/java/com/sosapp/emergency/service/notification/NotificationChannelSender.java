package com.sosapp.emergency.service.notification;

import com.sosapp.emergency.model.NotificationChannel;
import com.sosapp.emergency.model.NotificationJob;

/**
 * Delivers messages on one channel. Implementations report failures through {@link DeliveryResult}
 * and must not throw for provider errors.
 */
public interface NotificationChannelSender {

    NotificationChannel channel();

    DeliveryResult send(NotificationJob job, NotificationMessage message);
}
