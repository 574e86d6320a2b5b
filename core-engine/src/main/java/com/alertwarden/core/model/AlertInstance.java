package com.alertwarden.core.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Snapshot of one alert episode for a rule.
 *
 * <p>
 * Instances are immutable. The alert state machine is the only component that
 * produces new ones; every evaluation replaces the rule's current snapshot.
 * A Resolved instance is never reused: the next breach supersedes it with a new
 * instance and a new {@link #getCorrelationId() correlation id}.
 * </p>
 *
 * <p>
 * {@code correlationId} is {@code null} while the instance is Pending and is
 * minted on the transition to Firing. It stays stable until the episode
 * resolves and is the idempotency key of every notification for the episode.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertInstance {

    private final String ruleId;
    private final int episode;
    private final AlertState state;
    private final String correlationId;
    private final int consecutiveBreaches;
    private final int consecutiveClears;
    private final Instant createdAt;
    private final Instant firstBreachAt;
    private final Instant firedAt;
    private final Instant resolvedAt;
    private final Instant lastEvaluatedAt;
    private final Instant lastNotifiedAt;
    private final Double lastValue;

    private AlertInstance(Builder b) {
        this.ruleId = Objects.requireNonNull(b.ruleId, "ruleId must not be null");
        this.episode = b.episode;
        this.state = Objects.requireNonNull(b.state, "state must not be null");
        this.correlationId = b.correlationId;
        this.consecutiveBreaches = b.consecutiveBreaches;
        this.consecutiveClears = b.consecutiveClears;
        this.createdAt = Objects.requireNonNull(b.createdAt, "createdAt must not be null");
        this.firstBreachAt = b.firstBreachAt;
        this.firedAt = b.firedAt;
        this.resolvedAt = b.resolvedAt;
        this.lastEvaluatedAt = b.lastEvaluatedAt;
        this.lastNotifiedAt = b.lastNotifiedAt;
        this.lastValue = b.lastValue;
    }

    /**
     * Fresh Pending instance with zeroed counters.
     *
     * @param ruleId    owning rule
     * @param episode   1-based episode number for the rule
     * @param createdAt creation instant
     * @return new pending instance
     */
    public static AlertInstance pending(String ruleId, int episode, Instant createdAt) {
        return new Builder()
                .ruleId(ruleId)
                .episode(episode)
                .state(AlertState.PENDING)
                .createdAt(createdAt)
                .build();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.ruleId = ruleId;
        b.episode = episode;
        b.state = state;
        b.correlationId = correlationId;
        b.consecutiveBreaches = consecutiveBreaches;
        b.consecutiveClears = consecutiveClears;
        b.createdAt = createdAt;
        b.firstBreachAt = firstBreachAt;
        b.firedAt = firedAt;
        b.resolvedAt = resolvedAt;
        b.lastEvaluatedAt = lastEvaluatedAt;
        b.lastNotifiedAt = lastNotifiedAt;
        b.lastValue = lastValue;
        return b;
    }

    /** Fluent builder for {@link AlertInstance}. */
    public static class Builder {
        private String ruleId;
        private int episode = 1;
        private AlertState state = AlertState.PENDING;
        private String correlationId;
        private int consecutiveBreaches;
        private int consecutiveClears;
        private Instant createdAt;
        private Instant firstBreachAt;
        private Instant firedAt;
        private Instant resolvedAt;
        private Instant lastEvaluatedAt;
        private Instant lastNotifiedAt;
        private Double lastValue;

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder episode(int episode) {
            this.episode = episode;
            return this;
        }

        public Builder state(AlertState state) {
            this.state = state;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder consecutiveBreaches(int consecutiveBreaches) {
            this.consecutiveBreaches = consecutiveBreaches;
            return this;
        }

        public Builder consecutiveClears(int consecutiveClears) {
            this.consecutiveClears = consecutiveClears;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder firstBreachAt(Instant firstBreachAt) {
            this.firstBreachAt = firstBreachAt;
            return this;
        }

        public Builder firedAt(Instant firedAt) {
            this.firedAt = firedAt;
            return this;
        }

        public Builder resolvedAt(Instant resolvedAt) {
            this.resolvedAt = resolvedAt;
            return this;
        }

        public Builder lastEvaluatedAt(Instant lastEvaluatedAt) {
            this.lastEvaluatedAt = lastEvaluatedAt;
            return this;
        }

        public Builder lastNotifiedAt(Instant lastNotifiedAt) {
            this.lastNotifiedAt = lastNotifiedAt;
            return this;
        }

        public Builder lastValue(Double lastValue) {
            this.lastValue = lastValue;
            return this;
        }

        public AlertInstance build() {
            return new AlertInstance(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getRuleId() {
        return ruleId;
    }

    public int getEpisode() {
        return episode;
    }

    public AlertState getState() {
        return state;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public int getConsecutiveBreaches() {
        return consecutiveBreaches;
    }

    public int getConsecutiveClears() {
        return consecutiveClears;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getFirstBreachAt() {
        return firstBreachAt;
    }

    public Instant getFiredAt() {
        return firedAt;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public Instant getLastEvaluatedAt() {
        return lastEvaluatedAt;
    }

    public Instant getLastNotifiedAt() {
        return lastNotifiedAt;
    }

    public Double getLastValue() {
        return lastValue;
    }

    public boolean isFiring() {
        return state == AlertState.FIRING;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertInstance that))
            return false;
        return episode == that.episode
                && consecutiveBreaches == that.consecutiveBreaches
                && consecutiveClears == that.consecutiveClears
                && state == that.state
                && Objects.equals(ruleId, that.ruleId)
                && Objects.equals(correlationId, that.correlationId)
                && Objects.equals(lastEvaluatedAt, that.lastEvaluatedAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleId, episode, state, correlationId);
    }

    @Override
    public String toString() {
        return "AlertInstance{" +
                "ruleId='" + ruleId + '\'' +
                ", episode=" + episode +
                ", state=" + state +
                ", correlationId='" + correlationId + '\'' +
                ", breaches=" + consecutiveBreaches +
                ", clears=" + consecutiveClears +
                ", firedAt=" + firedAt +
                ", resolvedAt=" + resolvedAt +
                '}';
    }
}
