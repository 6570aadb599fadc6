package com.sosapp.emergency.config;

import com.sosapp.emergency.model.NotificationChannel;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

@Configuration
@ConfigurationProperties(prefix = "sos.notifications")
@Data
@Validated
public class NotificationProperties {

    @Min(1)
    private int maxAttempts = 3;

    /** Delay before the next attempt, indexed by failed attempt number; the last entry repeats. */
    @NotEmpty
    private List<Duration> retryBackoff = new ArrayList<>(List.of(
            Duration.ofSeconds(5), Duration.ofSeconds(15), Duration.ofSeconds(45)));

    @NotEmpty
    private List<NotificationChannel> channelOrder = new ArrayList<>(List.of(
            NotificationChannel.PUSH, NotificationChannel.SMS, NotificationChannel.EMAIL));

    private Set<String> permanentErrorCodes = Set.of(
            "INVALID_TOKEN", "INVALID_PHONE_NUMBER", "INVALID_EMAIL",
            "BLACKLISTED", "UNREGISTERED", "PERMISSION_DENIED");

    private Worker worker = new Worker();

    private String emergencyLinkBaseUrl = "https://app.sosapp.local/emergency/";

    private String webhookSecret = "";

    private Map<NotificationChannel, Provider> providers = new EnumMap<>(NotificationChannel.class);

    @Data
    public static class Worker {
        private long pollIntervalMs = 1000;

        @Min(1)
        private int batchSize = 100;
    }

    @Data
    public static class Provider {
        /** {@code log} writes the message to the application log instead of calling a provider. */
        private String mode = "log";
        private String url;
        private String apiKey;
    }

    public Duration backoffAfter(int failedAttempt) {
        int index = Math.min(Math.max(failedAttempt, 1), retryBackoff.size()) - 1;
        return retryBackoff.get(index);
    }

    public Provider provider(NotificationChannel channel) {
        return providers.computeIfAbsent(channel, key -> new Provider());
    }
}
