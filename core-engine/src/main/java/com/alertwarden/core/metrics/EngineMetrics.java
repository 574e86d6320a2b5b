package com.alertwarden.core.metrics;

import com.alertwarden.core.evaluation.EvaluationOutcome;
import com.alertwarden.core.model.AlertEventType;
import com.alertwarden.core.model.AttemptStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Engine meters.
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code warden.evaluations} - counter, tag {@code outcome} (breach, clear, error)</li>
 *   <li>{@code warden.evaluation.latency} - timer of telemetry pull plus comparison</li>
 *   <li>{@code warden.alerts.transitions} - counter, tag {@code event} (fired, still_firing, resolved)</li>
 *   <li>{@code warden.notifications} - counter, tag {@code status} (sent, failed, given_up)</li>
 *   <li>{@code warden.scheduler.skipped} - counter of ticks skipped because the rule was in flight</li>
 *   <li>{@code warden.monitoring.degraded} - counter of rules entering MonitoringDegraded</li>
 * </ul>
 *
 * <p>
 * Meters are registered once in the constructor; the recording methods only
 * look them up.
 * </p>
 *
 * @since 1.0.0
 */
public class EngineMetrics {

    private final MeterRegistry registry;
    private final Map<EvaluationOutcome, Counter> evaluations = new EnumMap<>(EvaluationOutcome.class);
    private final Map<AlertEventType, Counter> transitions = new EnumMap<>(AlertEventType.class);
    private final Map<AttemptStatus, Counter> notifications = new EnumMap<>(AttemptStatus.class);
    private final Timer evaluationLatency;
    private final Counter skipped;
    private final Counter degraded;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "MeterRegistry must not be null");

        for (EvaluationOutcome outcome : EvaluationOutcome.values()) {
            evaluations.put(outcome, Counter.builder("warden.evaluations")
                    .description("Rule evaluations by outcome")
                    .tag("outcome", tagValue(outcome))
                    .register(registry));
        }
        for (AlertEventType type : AlertEventType.values()) {
            transitions.put(type, Counter.builder("warden.alerts.transitions")
                    .description("Alert lifecycle events emitted")
                    .tag("event", tagValue(type))
                    .register(registry));
        }
        for (AttemptStatus status : AttemptStatus.values()) {
            if (status == AttemptStatus.PENDING) {
                continue;
            }
            notifications.put(status, Counter.builder("warden.notifications")
                    .description("Notification attempt outcomes")
                    .tag("status", tagValue(status))
                    .register(registry));
        }
        this.evaluationLatency = Timer.builder("warden.evaluation.latency")
                .description("Telemetry pull and comparison latency")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
        this.skipped = Counter.builder("warden.scheduler.skipped")
                .description("Evaluations skipped because the rule was still in flight")
                .register(registry);
        this.degraded = Counter.builder("warden.monitoring.degraded")
                .description("Rules that entered MonitoringDegraded")
                .register(registry);
    }

    /**
     * Metrics backed by a private in-memory registry.
     */
    public static EngineMetrics inMemory() {
        return new EngineMetrics(new SimpleMeterRegistry());
    }

    public void recordEvaluation(EvaluationOutcome outcome, Duration latency) {
        evaluations.get(outcome).increment();
        evaluationLatency.record(latency);
    }

    public void recordTransition(AlertEventType type) {
        transitions.get(type).increment();
    }

    public void recordNotification(AttemptStatus status) {
        Counter counter = notifications.get(status);
        if (counter != null) {
            counter.increment();
        }
    }

    public void recordSkip() {
        skipped.increment();
    }

    public void recordDegraded() {
        degraded.increment();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    private static String tagValue(Enum<?> value) {
        return value.name().toLowerCase(Locale.ROOT);
    }
}
