package com.sosapp.emergency.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Configuration
@ConfigurationProperties(prefix = "sos.events")
@Data
@Validated
public class EventProperties {

    @Min(1)
    private int maxAttempts = 10;

    @NotNull
    private Duration initialBackoff = Duration.ofSeconds(2);

    private double multiplier = 2.0;

    @NotNull
    private Duration maxBackoff = Duration.ofMinutes(5);

    private long relayIntervalMs = 5000;

    /**
     * How long a freshly recorded event is left to the after-commit delivery before the relay sweep
     * may pick it up.
     */
    @NotNull
    private Duration sweepGrace = Duration.ofSeconds(10);

    @Min(1)
    private int batchSize = 100;
}
