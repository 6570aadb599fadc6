package com.sosapp.emergency.service;

import com.sosapp.emergency.config.EscalationProperties;
import com.sosapp.emergency.model.EscalationState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * Tier arithmetic. Tier 1 waits for its whole window without reminders (the initial alert already
 * went out). Every later tier re-notifies on the configured interval until its own window runs out,
 * and the final tier keeps re-notifying until someone acknowledges.
 */
@Component
@RequiredArgsConstructor
public class EscalationPolicy {

    private final EscalationProperties properties;

    public Instant firstDeadline(Instant activatedAt) {
        return activatedAt.plus(properties.timeoutForTier(1));
    }

    public EscalationStep next(EscalationState state, Instant now) {
        Instant deadline = state.getTierDeadline();
        if (deadline != null && !now.isBefore(deadline)) {
            int tier = state.getCurrentTier() + 1;
            Duration window = properties.timeoutForTier(tier);
            Instant tierDeadline = window == null ? null : now.plus(window);
            return new EscalationStep(tier, true, 0, tierDeadline, earliest(reminderAt(now, 0), tierDeadline));
        }
        int reminders = state.getReminderCount() + 1;
        return new EscalationStep(state.getCurrentTier(), false, reminders, deadline,
                earliest(reminderAt(now, reminders), deadline));
    }

    private Instant reminderAt(Instant now, int remindersSent) {
        int max = properties.getMaxReminders();
        if (max > 0 && remindersSent >= max) {
            return null;
        }
        return now.plus(properties.getRenotifyInterval());
    }

    private Instant earliest(Instant first, Instant second) {
        if (first == null) {
            return second;
        }
        if (second == null) {
            return first;
        }
        return first.isBefore(second) ? first : second;
    }
}
