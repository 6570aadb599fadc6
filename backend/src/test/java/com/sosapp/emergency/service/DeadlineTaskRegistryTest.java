package com.sosapp.emergency.service;

import com.sosapp.emergency.support.ManualTaskScheduler;
import com.sosapp.emergency.support.MutableClock;
import io.github.resilience4j.core.IntervalFunction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class DeadlineTaskRegistryTest {

    private static final Instant T0 = Instant.parse("2026-03-01T08:00:00Z");

    private MutableClock clock;
    private ManualTaskScheduler scheduler;
    private DeadLetterQueueService deadLetterQueueService;
    private DeadlineTaskRegistry<String> registry;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(T0);
        scheduler = new ManualTaskScheduler(clock);
        deadLetterQueueService = mock(DeadLetterQueueService.class);
        registry = new DeadlineTaskRegistry<>("test", scheduler, clock,
                IntervalFunction.of(Duration.ofSeconds(1)), 3, deadLetterQueueService);
    }

    @Test
    void firesAtDeadlineAndNotBefore() {
        AtomicInteger runs = new AtomicInteger();
        registry.schedule("a", T0.plusSeconds(10), runs::incrementAndGet);

        clock.advance(Duration.ofSeconds(9));
        scheduler.runDue();
        assertThat(runs.get()).isZero();
        assertThat(registry.isScheduled("a")).isTrue();

        clock.advance(Duration.ofSeconds(1));
        scheduler.runDue();
        assertThat(runs.get()).isEqualTo(1);
        assertThat(registry.isScheduled("a")).isFalse();
    }

    @Test
    void reschedulingReplacesPreviousTask() {
        AtomicInteger first = new AtomicInteger();
        AtomicInteger second = new AtomicInteger();
        registry.schedule("a", T0.plusSeconds(5), first::incrementAndGet);
        registry.schedule("a", T0.plusSeconds(8), second::incrementAndGet);

        clock.advance(Duration.ofSeconds(10));
        scheduler.runDue();

        assertThat(first.get()).isZero();
        assertThat(second.get()).isEqualTo(1);
        assertThat(registry.size()).isZero();
    }

    @Test
    void cancelledTaskNeverRuns() {
        AtomicInteger runs = new AtomicInteger();
        registry.schedule("a", T0.plusSeconds(5), runs::incrementAndGet);

        assertThat(registry.cancel("a")).isTrue();
        assertThat(registry.cancel("a")).isFalse();

        clock.advance(Duration.ofSeconds(10));
        scheduler.runDue();
        assertThat(runs.get()).isZero();
    }

    @Test
    void overdueDeadlineFiresImmediately() {
        AtomicInteger runs = new AtomicInteger();
        registry.schedule("a", T0.minusSeconds(30), runs::incrementAndGet);

        scheduler.runDue();

        assertThat(runs.get()).isEqualTo(1);
    }

    @Test
    void actionMayRearmItsOwnKey() {
        AtomicInteger runs = new AtomicInteger();
        Runnable[] tick = new Runnable[1];
        tick[0] = () -> {
            if (runs.incrementAndGet() < 3) {
                registry.schedule("a", clock.instant().plusSeconds(5), tick[0]);
            }
        };
        registry.schedule("a", T0.plusSeconds(5), tick[0]);

        for (int i = 0; i < 3; i++) {
            clock.advance(Duration.ofSeconds(5));
            scheduler.runDue();
        }

        assertThat(runs.get()).isEqualTo(3);
        assertThat(registry.isScheduled("a")).isFalse();
    }

    @Test
    void transientFailureIsRetriedWithBackoff() {
        AtomicInteger calls = new AtomicInteger();
        registry.schedule("a", T0, () -> {
            if (calls.incrementAndGet() == 1) {
                throw new QueryTimeoutException("lock timeout");
            }
        });

        scheduler.runDue();
        assertThat(calls.get()).isEqualTo(1);
        assertThat(registry.isScheduled("a")).isTrue();

        clock.advance(Duration.ofSeconds(1));
        scheduler.runDue();
        assertThat(calls.get()).isEqualTo(2);
        verify(deadLetterQueueService, never()).logFailure(anyString(), anyString(), anyString());
    }

    @Test
    void exhaustedTransientFailureGoesToDeadLetterQueue() {
        AtomicInteger calls = new AtomicInteger();
        registry.schedule("a", T0, () -> {
            calls.incrementAndGet();
            throw new QueryTimeoutException("lock timeout");
        });

        for (int i = 0; i < 5; i++) {
            scheduler.runDue();
            clock.advance(Duration.ofSeconds(1));
        }

        assertThat(calls.get()).isEqualTo(3);
        verify(deadLetterQueueService).logFailure(eq(DeadLetterQueueService.TIMER_TICK), contains("attempt=3"), eq("lock timeout"));
    }

    @Test
    void nonTransientFailureIsNotRetried() {
        AtomicInteger calls = new AtomicInteger();
        registry.schedule("a", T0, () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("boom");
        });

        scheduler.runDue();
        clock.advance(Duration.ofSeconds(5));
        scheduler.runDue();

        assertThat(calls.get()).isEqualTo(1);
        assertThat(registry.isScheduled("a")).isFalse();
        verify(deadLetterQueueService).logFailure(eq(DeadLetterQueueService.TIMER_TICK), contains("key=a"), eq("boom"));
    }
}
