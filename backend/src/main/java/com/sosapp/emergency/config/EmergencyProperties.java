package com.sosapp.emergency.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "sos.emergency")
@Data
@Validated
public class EmergencyProperties {

    private Countdown countdown = new Countdown();

    /** Open (PENDING or ACTIVE) emergencies a single user may hold. */
    @Min(1)
    private int maxOpenPerUser = 1;

    private Reconciliation reconciliation = new Reconciliation();

    private TimerRetry timerRetry = new TimerRetry();

    @Data
    public static class Countdown {
        @Min(1)
        private int minSeconds = 5;

        @Min(1)
        private int maxSeconds = 30;

        @Min(1)
        private int defaultSeconds = 10;

        @Min(1)
        private int autoTriggerSeconds = 30;
    }

    @Data
    public static class Reconciliation {
        private boolean onStartup = true;

        @Positive
        private long sweepIntervalMs = 60_000;
    }

    /**
     * Backoff for countdown and escalation ticks that hit a transient store failure.
     */
    @Data
    public static class TimerRetry {
        @Min(1)
        private int maxAttempts = 5;

        @NotNull
        private Duration initialBackoff = Duration.ofSeconds(1);

        @Positive
        private double multiplier = 2.0;

        @NotNull
        private Duration maxBackoff = Duration.ofSeconds(30);
    }
}
