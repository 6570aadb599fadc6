package com.sosapp.emergency.service.notification;

import com.sosapp.emergency.config.NotificationProperties;
import com.sosapp.emergency.model.Emergency;
import com.sosapp.emergency.model.GeoLocation;
import com.sosapp.emergency.model.NotificationChannel;
import com.sosapp.emergency.model.NotificationJob;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
@RequiredArgsConstructor
public class NotificationTemplates {

    private static final int SMS_LIMIT = 320;

    private final NotificationProperties properties;

    public NotificationMessage render(NotificationJob job, Emergency emergency) {
        String type = emergency.getType().name().toLowerCase(Locale.ROOT);
        String subject = switch (job.getKind()) {
            case ALERT -> "SOS: " + type + " emergency";
            case ESCALATION -> "SOS escalated: " + type + " emergency, no response yet";
            case REMINDER -> "SOS reminder: " + type + " emergency still unanswered";
        };
        StringBuilder body = new StringBuilder();
        if (job.getRecipientName() != null) {
            body.append(job.getRecipientName()).append(", ");
        }
        body.append(switch (job.getKind()) {
            case ALERT -> "someone who listed you as an emergency contact needs help.";
            case ESCALATION -> "an emergency has gone unanswered and you are the next contact.";
            case REMINDER -> "an emergency is still waiting for a response.";
        });
        String where = describe(emergency.getLocation());
        if (where != null) {
            body.append(" Location: ").append(where).append('.');
        }
        if (emergency.getInitialMessage() != null && !emergency.getInitialMessage().isBlank()) {
            body.append(" Message: \"").append(emergency.getInitialMessage()).append("\".");
        }
        body.append(" Respond: ").append(properties.getEmergencyLinkBaseUrl()).append(emergency.getId());

        String text = body.toString();
        if (job.getChannel() == NotificationChannel.SMS && text.length() > SMS_LIMIT) {
            text = subject + ". Respond: " + properties.getEmergencyLinkBaseUrl() + emergency.getId();
        }
        return new NotificationMessage(subject, text);
    }

    private String describe(GeoLocation location) {
        if (location == null || location.getLatitude() == null || location.getLongitude() == null) {
            return null;
        }
        if (location.getAddress() != null && !location.getAddress().isBlank()) {
            return location.getAddress();
        }
        return String.format(Locale.ROOT, "https://maps.google.com/?q=%.6f,%.6f",
                location.getLatitude(), location.getLongitude());
    }
}
