package com.alertwarden.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A lifecycle transition emitted by the alert state machine and consumed by
 * the notification dispatcher.
 *
 * <p>
 * The event carries the rule definition that was in force when the transition
 * happened, so routing is decided against that version even if the
 * configuration is reloaded while notifications are still in flight.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertEvent {

    private final AlertEventType type;
    private final AlertRule rule;
    private final AlertInstance instance;
    private final Instant occurredAt;

    public AlertEvent(AlertEventType type, AlertRule rule, AlertInstance instance, Instant occurredAt) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.rule = Objects.requireNonNull(rule, "rule must not be null");
        this.instance = Objects.requireNonNull(instance, "instance must not be null");
        this.occurredAt = Objects.requireNonNull(occurredAt, "occurredAt must not be null");
        Objects.requireNonNull(instance.getCorrelationId(),
                "Alert events require a correlation id (rule " + rule.getId() + ")");
    }

    public AlertEventType getType() {
        return type;
    }

    public AlertRule getRule() {
        return rule;
    }

    public AlertInstance getInstance() {
        return instance;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    public String getRuleId() {
        return rule.getId();
    }

    public String getCorrelationId() {
        return instance.getCorrelationId();
    }

    public int getSeverity() {
        return rule.getSeverity();
    }

    @Override
    public String toString() {
        return "AlertEvent{" +
                "type=" + type +
                ", ruleId='" + rule.getId() + '\'' +
                ", correlationId='" + instance.getCorrelationId() + '\'' +
                ", occurredAt=" + occurredAt +
                '}';
    }
}
