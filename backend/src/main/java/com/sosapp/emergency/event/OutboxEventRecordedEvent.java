package com.sosapp.emergency.event;

import java.util.UUID;

/**
 * Spring application event raised inside the writing transaction; observed after commit.
 */
public record OutboxEventRecordedEvent(UUID outboxEventId, UUID emergencyId) {
}
