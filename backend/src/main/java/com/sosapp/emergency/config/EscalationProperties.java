package com.sosapp.emergency.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Escalation ladder. Every entry of {@code tierTimeouts} is the acknowledgment window of one tier;
 * the tier after the last entry is final and re-notifies until someone responds.
 */
@Configuration
@ConfigurationProperties(prefix = "sos.escalation")
@Data
@Validated
public class EscalationProperties {

    @NotEmpty
    private List<Duration> tierTimeouts = new ArrayList<>(List.of(Duration.ofSeconds(120)));

    @NotNull
    private Duration renotifyInterval = Duration.ofSeconds(30);

    /** Reminders per tier after which the monitor goes quiet; 0 keeps reminding. */
    @Min(0)
    private int maxReminders = 0;

    public int tierCount() {
        return tierTimeouts.size() + 1;
    }

    public boolean isFinalTier(int tier) {
        return tier >= tierCount();
    }

    /**
     * Acknowledgment window of the given tier, or null for the final tier.
     */
    public Duration timeoutForTier(int tier) {
        if (tier < 1 || isFinalTier(tier)) {
            return null;
        }
        return tierTimeouts.get(tier - 1);
    }
}
