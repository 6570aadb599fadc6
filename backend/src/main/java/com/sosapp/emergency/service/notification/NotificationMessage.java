package com.sosapp.emergency.service.notification;

/**
 * Rendered message. {@code subject} is only used by channels that have one.
 */
public record NotificationMessage(String subject, String body) {
}
