package com.sosapp.emergency.service;

import java.time.Instant;

/**
 * Outcome of one escalation tick.
 *
 * @param tier          tier notified by this tick
 * @param advanced      true when the tick moved to a new tier, false for a reminder
 * @param reminderCount reminders sent in {@code tier} including this one
 * @param tierDeadline  when {@code tier} times out, null for the final tier
 * @param nextCheckAt   next tick, null when there is nothing left to do
 */
public record EscalationStep(int tier, boolean advanced, int reminderCount, Instant tierDeadline, Instant nextCheckAt) {
}
