package com.alertwarden.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Normalized notification handed to the delivery collaborator.
 *
 * <p>
 * Serialized to JSON by the service layer. {@link #getIdempotencyKey()}
 * combines the correlation id with the event type and timestamp so a
 * collaborator can drop redeliveries of the same notification while still
 * accepting a later {@code STILL_FIRING} for the same episode.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code correlationId}, {@code ruleId},
 * {@code eventType} and {@code timestamp} are required; omitting any of them
 * throws a {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public class NotificationPayload {

    private String correlationId;
    private String ruleId;
    private String ruleName;
    private int severity;
    private String severityLabel;
    private AlertState state;
    private AlertEventType eventType;
    private Instant timestamp;
    private Double observedValue;
    private double threshold;

    /** No-arg constructor required by Jackson. */
    public NotificationPayload() {
    }

    private NotificationPayload(Builder builder) {
        this.correlationId = Objects.requireNonNull(builder.correlationId, "correlationId must not be null");
        this.ruleId = Objects.requireNonNull(builder.ruleId, "ruleId must not be null");
        this.ruleName = builder.ruleName;
        this.severity = builder.severity;
        this.severityLabel = builder.severityLabel;
        this.state = builder.state;
        this.eventType = Objects.requireNonNull(builder.eventType, "eventType must not be null");
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.observedValue = builder.observedValue;
        this.threshold = builder.threshold;
    }

    /**
     * Build the payload for a lifecycle event.
     *
     * @param event         the transition
     * @param severityLabel label configured for the rule's severity, may be
     *                      {@code null}
     * @return payload describing the event
     */
    public static NotificationPayload from(AlertEvent event, String severityLabel) {
        AlertRule rule = event.getRule();
        return builder()
                .correlationId(event.getCorrelationId())
                .ruleId(rule.getId())
                .ruleName(rule.getName())
                .severity(rule.getSeverity())
                .severityLabel(severityLabel)
                .state(event.getInstance().getState())
                .eventType(event.getType())
                .timestamp(event.getOccurredAt())
                .observedValue(event.getInstance().getLastValue())
                .threshold(rule.getThreshold())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Fluent builder for {@link NotificationPayload}. */
    public static class Builder {
        private String correlationId;
        private String ruleId;
        private String ruleName;
        private int severity;
        private String severityLabel;
        private AlertState state;
        private AlertEventType eventType;
        private Instant timestamp;
        private Double observedValue;
        private double threshold;

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder ruleName(String ruleName) {
            this.ruleName = ruleName;
            return this;
        }

        public Builder severity(int severity) {
            this.severity = severity;
            return this;
        }

        public Builder severityLabel(String severityLabel) {
            this.severityLabel = severityLabel;
            return this;
        }

        public Builder state(AlertState state) {
            this.state = state;
            return this;
        }

        public Builder eventType(AlertEventType eventType) {
            this.eventType = eventType;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder observedValue(Double observedValue) {
            this.observedValue = observedValue;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public NotificationPayload build() {
            return new NotificationPayload(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getCorrelationId() {
        return correlationId;
    }

    public void setCorrelationId(String correlationId) {
        this.correlationId = correlationId;
    }

    public String getRuleId() {
        return ruleId;
    }

    public void setRuleId(String ruleId) {
        this.ruleId = ruleId;
    }

    public String getRuleName() {
        return ruleName;
    }

    public void setRuleName(String ruleName) {
        this.ruleName = ruleName;
    }

    public int getSeverity() {
        return severity;
    }

    public void setSeverity(int severity) {
        this.severity = severity;
    }

    public String getSeverityLabel() {
        return severityLabel;
    }

    public void setSeverityLabel(String severityLabel) {
        this.severityLabel = severityLabel;
    }

    public AlertState getState() {
        return state;
    }

    public void setState(AlertState state) {
        this.state = state;
    }

    public AlertEventType getEventType() {
        return eventType;
    }

    public void setEventType(AlertEventType eventType) {
        this.eventType = eventType;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public Double getObservedValue() {
        return observedValue;
    }

    public void setObservedValue(Double observedValue) {
        this.observedValue = observedValue;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    /**
     * @return {@code correlationId:eventType:epochMillis}
     */
    public String getIdempotencyKey() {
        return correlationId + ":" + eventType + ":"
                + (timestamp != null ? timestamp.toEpochMilli() : 0L);
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NotificationPayload that))
            return false;
        return Objects.equals(correlationId, that.correlationId)
                && eventType == that.eventType
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(correlationId, eventType, timestamp);
    }

    @Override
    public String toString() {
        return "NotificationPayload{" +
                "correlationId='" + correlationId + '\'' +
                ", ruleId='" + ruleId + '\'' +
                ", severity=" + severity +
                ", state=" + state +
                ", eventType=" + eventType +
                ", timestamp=" + timestamp +
                '}';
    }
}
