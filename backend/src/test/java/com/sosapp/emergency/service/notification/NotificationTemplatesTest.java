package com.sosapp.emergency.service.notification;

import com.sosapp.emergency.config.NotificationProperties;
import com.sosapp.emergency.model.Emergency;
import com.sosapp.emergency.model.EmergencyType;
import com.sosapp.emergency.model.GeoLocation;
import com.sosapp.emergency.model.NotificationChannel;
import com.sosapp.emergency.model.NotificationJob;
import org.junit.jupiter.api.Test;

import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

class NotificationTemplatesTest {

    private final NotificationTemplates templates = new NotificationTemplates(new NotificationProperties());

    private Emergency emergency(String message) {
        return Emergency.builder()
                .id(UUID.fromString("00000000-0000-0000-0000-000000000001"))
                .type(EmergencyType.FALL)
                .location(GeoLocation.builder().latitude(52.52).longitude(13.405).build())
                .initialMessage(message)
                .build();
    }

    private NotificationJob job(NotificationJob.Kind kind, NotificationChannel channel) {
        return NotificationJob.builder().kind(kind).channel(channel).recipientName("Ana").build();
    }

    @Test
    void alertCarriesLocationMessageAndLink() {
        NotificationMessage message = templates.render(job(NotificationJob.Kind.ALERT, NotificationChannel.PUSH),
                emergency("I fell in the kitchen"));

        assertThat(message.subject()).isEqualTo("SOS: fall emergency");
        assertThat(message.body())
                .startsWith("Ana, ")
                .contains("https://maps.google.com/?q=52.520000,13.405000")
                .contains("\"I fell in the kitchen\"")
                .endsWith("https://app.sosapp.local/emergency/00000000-0000-0000-0000-000000000001");
    }

    @Test
    void escalationAndReminderHaveTheirOwnSubject() {
        assertThat(templates.render(job(NotificationJob.Kind.ESCALATION, NotificationChannel.EMAIL), emergency(null))
                .subject()).startsWith("SOS escalated");
        assertThat(templates.render(job(NotificationJob.Kind.REMINDER, NotificationChannel.EMAIL), emergency(null))
                .subject()).startsWith("SOS reminder");
    }

    @Test
    void longSmsFallsBackToShortForm() {
        NotificationMessage message = templates.render(job(NotificationJob.Kind.ALERT, NotificationChannel.SMS),
                emergency("x".repeat(400)));

        assertThat(message.body()).isEqualTo(
                "SOS: fall emergency. Respond: https://app.sosapp.local/emergency/00000000-0000-0000-0000-000000000001");
    }
}
