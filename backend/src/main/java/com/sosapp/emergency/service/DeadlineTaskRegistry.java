package com.sosapp.emergency.service;

import com.sosapp.emergency.util.TransientFailures;
import io.github.resilience4j.core.IntervalFunction;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Keyed one-shot timers on top of a {@link TaskScheduler}. Holds at most one task per key: scheduling
 * a key again replaces (and cancels) the previous task. A deadline that has already passed is run
 * right away, which is how overdue timers are recovered after a restart.
 * <p>
 * The action runs on a scheduler thread and never propagates an exception. Transient store failures
 * re-schedule the same action with bounded exponential backoff; other failures, and transient ones
 * that exhaust the retries, are written to the dead-letter queue. The persisted deadline stays the
 * source of truth, so the reconciliation sweep can always re-arm a dropped timer.
 * <p>
 * This registry is a process-local cache and not the source of truth.
 */
@Slf4j
public class DeadlineTaskRegistry<K> {

    private final String name;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final IntervalFunction retryBackoff;
    private final int maxAttempts;
    private final DeadLetterQueueService deadLetterQueueService;
    private final Map<K, Handle> tasks = new ConcurrentHashMap<>();

    public DeadlineTaskRegistry(String name,
                                TaskScheduler taskScheduler,
                                Clock clock,
                                IntervalFunction retryBackoff,
                                int maxAttempts,
                                DeadLetterQueueService deadLetterQueueService) {
        this.name = name;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.retryBackoff = retryBackoff;
        this.maxAttempts = maxAttempts;
        this.deadLetterQueueService = deadLetterQueueService;
    }

    public void schedule(K key, Instant deadline, Runnable action) {
        Handle handle = new Handle(key, action, 1);
        Handle previous = tasks.put(key, handle);
        if (previous != null) {
            previous.cancel();
        }
        arm(handle, deadline);
    }

    /**
     * Cancels the task for the key. A task that is already running is not interrupted; it must
     * re-check persisted state before acting.
     *
     * @return true when a pending task was removed
     */
    public boolean cancel(K key) {
        Handle handle = tasks.remove(key);
        if (handle == null) {
            return false;
        }
        handle.cancel();
        log.debug("[{}] cancelled timer key={}", name, key);
        return true;
    }

    public boolean isScheduled(K key) {
        return tasks.containsKey(key);
    }

    public int size() {
        return tasks.size();
    }

    public void cancelAll() {
        tasks.keySet().forEach(this::cancel);
    }

    private void arm(Handle handle, Instant deadline) {
        Instant now = clock.instant();
        if (!deadline.isAfter(now)) {
            log.info("[{}] deadline {} already passed for key={}, firing now", name, deadline, handle.key);
            handle.future = taskScheduler.schedule(handle, now);
        } else {
            handle.future = taskScheduler.schedule(handle, deadline);
        }
        if (handle.cancelled.get() && handle.future != null) {
            handle.future.cancel(false);
        }
    }

    private void retry(Handle failed, RuntimeException error) {
        Duration delay = Duration.ofMillis(retryBackoff.apply(failed.attempt));
        Handle next = new Handle(failed.key, failed.action, failed.attempt + 1);
        if (tasks.putIfAbsent(failed.key, next) != null) {
            log.info("[{}] key={} re-armed while retrying, dropping retry", name, failed.key);
            return;
        }
        log.warn("[{}] transient failure key={} attempt={}/{}, retrying in {} ms: {}",
                name, failed.key, failed.attempt, maxAttempts, delay.toMillis(), error.getMessage());
        arm(next, clock.instant().plus(delay));
    }

    private final class Handle implements Runnable {

        private final K key;
        private final Runnable action;
        private final int attempt;
        private final AtomicBoolean cancelled = new AtomicBoolean(false);
        private volatile ScheduledFuture<?> future;

        private Handle(K key, Runnable action, int attempt) {
            this.key = key;
            this.action = action;
            this.attempt = attempt;
        }

        private void cancel() {
            cancelled.set(true);
            ScheduledFuture<?> scheduled = future;
            if (scheduled != null) {
                scheduled.cancel(false);
            }
        }

        @Override
        public void run() {
            if (cancelled.get()) {
                return;
            }
            // leave the slot free so the action can re-arm its own key
            tasks.remove(key, this);
            MDC.put("emergencyId", String.valueOf(key));
            try {
                action.run();
            } catch (RuntimeException ex) {
                if (TransientFailures.isTransient(ex) && attempt < maxAttempts && !cancelled.get()) {
                    retry(this, ex);
                } else {
                    log.error("[{}] timer action failed key={} attempt={}", name, key, attempt, ex);
                    deadLetterQueueService.logFailure(DeadLetterQueueService.TIMER_TICK,
                            name + " key=" + key + " attempt=" + attempt, ex.getMessage());
                }
            } finally {
                MDC.remove("emergencyId");
            }
        }
    }
}
