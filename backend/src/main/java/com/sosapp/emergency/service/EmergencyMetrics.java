package com.sosapp.emergency.service;

import com.sosapp.emergency.model.EmergencyStatus;
import com.sosapp.emergency.model.NotificationChannel;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.function.Supplier;

@Service
@RequiredArgsConstructor
public class EmergencyMetrics {

    private final MeterRegistry meterRegistry;

    private Counter escalationsCounter;
    private Counter remindersCounter;
    private Counter acknowledgmentsCounter;
    private Counter fallbacksCounter;
    private Counter outboxFailuresCounter;

    @PostConstruct
    void init() {
        escalationsCounter = Counter.builder("emergency_escalations_total").register(meterRegistry);
        remindersCounter = Counter.builder("emergency_reminders_total").register(meterRegistry);
        acknowledgmentsCounter = Counter.builder("emergency_acknowledgments_total").register(meterRegistry);
        fallbacksCounter = Counter.builder("notification_fallbacks_total").register(meterRegistry);
        outboxFailuresCounter = Counter.builder("outbox_delivery_failures_total").register(meterRegistry);
    }

    public void recordTriggered(boolean autoTriggered) {
        Counter.builder("emergency_triggered_total")
                .tag("source", autoTriggered ? "device" : "user")
                .register(meterRegistry)
                .increment();
    }

    public void recordTransition(EmergencyStatus target) {
        Counter.builder("emergency_transitions_total")
                .tag("to", target.name())
                .register(meterRegistry)
                .increment();
    }

    public void recordEscalation(boolean reminder) {
        if (reminder) {
            remindersCounter.increment();
        } else {
            escalationsCounter.increment();
        }
    }

    public void recordAcknowledgment() {
        acknowledgmentsCounter.increment();
    }

    public void recordNotificationAttempt(NotificationChannel channel, String outcome) {
        Counter.builder("notification_attempts_total")
                .tag("channel", channel.name())
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    public void recordFallback() {
        fallbacksCounter.increment();
    }

    public void recordOutboxFailure() {
        outboxFailuresCounter.increment();
    }

    public void registerTimerGauge(String timer, Supplier<Number> size) {
        Gauge.builder("emergency_timers_scheduled", size)
                .tag("timer", timer)
                .register(meterRegistry);
    }
}
