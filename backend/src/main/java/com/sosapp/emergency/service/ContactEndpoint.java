package com.sosapp.emergency.service;

import com.sosapp.emergency.model.NotificationChannel;

import java.util.List;

/**
 * A contact as the dispatcher needs it: who, on which channels (in preference order) and where.
 */
public record ContactEndpoint(
        Long contactId,
        String name,
        int tier,
        List<NotificationChannel> channels,
        String pushToken,
        String phone,
        String email
) {

    public String destinationFor(NotificationChannel channel) {
        return switch (channel) {
            case PUSH -> pushToken;
            case SMS -> phone;
            case EMAIL -> email;
        };
    }
}
