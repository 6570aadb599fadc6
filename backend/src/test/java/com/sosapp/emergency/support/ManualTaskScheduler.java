package com.sosapp.emergency.support;

import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.Trigger;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs one-shot tasks on the calling thread when the test says so, against a {@link MutableClock}.
 */
public class ManualTaskScheduler implements TaskScheduler {

    private final Clock clock;
    private final List<Task> tasks = new ArrayList<>();
    private final AtomicLong sequence = new AtomicLong();

    public ManualTaskScheduler(Clock clock) {
        this.clock = clock;
    }

    @Override
    public Clock getClock() {
        return clock;
    }

    @Override
    public synchronized ScheduledFuture<?> schedule(Runnable runnable, Instant startTime) {
        Task task = new Task(runnable, startTime, sequence.incrementAndGet());
        tasks.add(task);
        return task;
    }

    /**
     * Runs every task due at the current clock instant, including tasks scheduled by the tasks it runs.
     *
     * @return number of tasks run
     */
    public int runDue() {
        int ran = 0;
        Optional<Task> next;
        while ((next = pollDue()).isPresent()) {
            next.get().run();
            ran++;
        }
        return ran;
    }

    public synchronized int pendingCount() {
        return (int) tasks.stream().filter(task -> !task.cancelled).count();
    }

    public synchronized Optional<Instant> nextRunAt() {
        return tasks.stream()
                .filter(task -> !task.cancelled)
                .map(task -> task.runAt)
                .min(Comparator.naturalOrder());
    }

    public synchronized void clear() {
        tasks.clear();
    }

    private synchronized Optional<Task> pollDue() {
        tasks.removeIf(task -> task.cancelled);
        Instant now = clock.instant();
        Optional<Task> due = tasks.stream()
                .filter(task -> !task.runAt.isAfter(now))
                .min(Comparator.comparing((Task task) -> task.runAt).thenComparingLong(task -> task.sequence));
        due.ifPresent(tasks::remove);
        return due;
    }

    @Override
    public ScheduledFuture<?> schedule(Runnable task, Trigger trigger) {
        throw new UnsupportedOperationException("Trigger scheduling is not used");
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Instant startTime, Duration period) {
        throw new UnsupportedOperationException("Fixed-rate scheduling is not used");
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable task, Duration period) {
        throw new UnsupportedOperationException("Fixed-rate scheduling is not used");
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Instant startTime, Duration delay) {
        throw new UnsupportedOperationException("Fixed-delay scheduling is not used");
    }

    @Override
    public ScheduledFuture<?> scheduleWithFixedDelay(Runnable task, Duration delay) {
        throw new UnsupportedOperationException("Fixed-delay scheduling is not used");
    }

    private final class Task implements ScheduledFuture<Object> {

        private final Runnable runnable;
        private final Instant runAt;
        private final long sequence;
        private volatile boolean cancelled;
        private volatile boolean done;

        private Task(Runnable runnable, Instant runAt, long sequence) {
            this.runnable = runnable;
            this.runAt = runAt;
            this.sequence = sequence;
        }

        private void run() {
            if (cancelled) {
                return;
            }
            try {
                runnable.run();
            } finally {
                done = true;
            }
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(Duration.between(clock.instant(), runAt));
        }

        @Override
        public int compareTo(Delayed other) {
            return Long.compare(getDelay(TimeUnit.NANOSECONDS), other.getDelay(TimeUnit.NANOSECONDS));
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (done) {
                return false;
            }
            cancelled = true;
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return done || cancelled;
        }

        @Override
        public Object get() {
            return null;
        }

        @Override
        public Object get(long timeout, TimeUnit unit) {
            return null;
        }
    }
}
