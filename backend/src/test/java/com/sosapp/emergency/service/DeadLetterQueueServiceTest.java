package com.sosapp.emergency.service;

import com.sosapp.emergency.model.FailedOperation;
import com.sosapp.emergency.repository.FailedOperationRepository;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DeadLetterQueueServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T08:00:00Z");

    private final FailedOperationRepository repo = mock(FailedOperationRepository.class);
    private final DeadLetterQueueService service =
            new DeadLetterQueueService(repo, Clock.fixed(NOW, ZoneOffset.UTC));

    @Test
    void storesUnresolvedEntryWithTruncatedDetails() {
        service.logFailure(DeadLetterQueueService.OUTBOX_DELIVERY, "x".repeat(800), "boom");

        ArgumentCaptor<FailedOperation> captor = ArgumentCaptor.forClass(FailedOperation.class);
        verify(repo).save(captor.capture());
        FailedOperation saved = captor.getValue();
        assertThat(saved.getOperationType()).isEqualTo("OUTBOX_DELIVERY");
        assertThat(saved.getDetails()).hasSize(500);
        assertThat(saved.getErrorMessage()).isEqualTo("boom");
        assertThat(saved.isResolved()).isFalse();
        assertThat(saved.getCreatedAt()).isEqualTo(NOW);
    }

    @Test
    void storageFailureDoesNotEscape() {
        when(repo.save(any())).thenThrow(new IllegalStateException("db down"));

        assertThatCode(() -> service.logFailure(DeadLetterQueueService.TIMER_TICK, "countdown key=1", "timeout"))
                .doesNotThrowAnyException();
    }
}
