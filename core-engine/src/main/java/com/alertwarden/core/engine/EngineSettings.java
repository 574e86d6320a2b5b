package com.alertwarden.core.engine;

import com.alertwarden.core.dispatch.RetryPolicy;
import com.alertwarden.core.evaluation.MissingDataPolicy;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed, immutable runtime settings of the engine.
 *
 * <p>
 * Use {@link #defaults()} or the {@link Builder}; the builder validates
 * every value at {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class EngineSettings {

    // ---------------------------------------------------------------
    // Scheduling
    // ---------------------------------------------------------------
    private final int workerThreads;
    private final Duration tickInterval;
    private final double jitterRatio;

    // ---------------------------------------------------------------
    // Evaluation
    // ---------------------------------------------------------------
    private final Duration telemetryTimeout;
    private final MissingDataPolicy missingDataPolicy;
    private final int degradedThreshold;
    private final Duration reNotifyInterval;

    // ---------------------------------------------------------------
    // Dispatch
    // ---------------------------------------------------------------
    private final Duration dispatchTimeout;
    private final Duration retryBase;
    private final Duration maxBackoff;
    private final int maxDeliveryAttempts;
    private final Duration attemptRetention;

    private EngineSettings(Builder b) {
        this.workerThreads = b.workerThreads;
        this.tickInterval = b.tickInterval;
        this.jitterRatio = b.jitterRatio;
        this.telemetryTimeout = b.telemetryTimeout;
        this.missingDataPolicy = b.missingDataPolicy;
        this.degradedThreshold = b.degradedThreshold;
        this.reNotifyInterval = b.reNotifyInterval;
        this.dispatchTimeout = b.dispatchTimeout;
        this.retryBase = b.retryBase;
        this.maxBackoff = b.maxBackoff;
        this.maxDeliveryAttempts = b.maxDeliveryAttempts;
        this.attemptRetention = b.attemptRetention;
    }

    public static EngineSettings defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public RetryPolicy retryPolicy() {
        return new RetryPolicy(retryBase, maxBackoff, maxDeliveryAttempts);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public int getWorkerThreads() {
        return workerThreads;
    }

    public Duration getTickInterval() {
        return tickInterval;
    }

    public double getJitterRatio() {
        return jitterRatio;
    }

    public Duration getTelemetryTimeout() {
        return telemetryTimeout;
    }

    public MissingDataPolicy getMissingDataPolicy() {
        return missingDataPolicy;
    }

    /**
     * @return consecutive evaluation errors at which a rule is reported
     *         degraded; the count reaching the threshold is enough
     */
    public int getDegradedThreshold() {
        return degradedThreshold;
    }

    /**
     * @return the re-notify interval, empty when StillFiring is disabled
     */
    public Optional<Duration> getReNotifyInterval() {
        return Optional.ofNullable(reNotifyInterval);
    }

    public Duration getDispatchTimeout() {
        return dispatchTimeout;
    }

    public Duration getRetryBase() {
        return retryBase;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public int getMaxDeliveryAttempts() {
        return maxDeliveryAttempts;
    }

    public Duration getAttemptRetention() {
        return attemptRetention;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link EngineSettings}.
     */
    public static class Builder {
        private int workerThreads = 4;
        private Duration tickInterval = Duration.ofSeconds(1);
        private double jitterRatio = 0.10;
        private Duration telemetryTimeout = Duration.ofSeconds(10);
        private MissingDataPolicy missingDataPolicy = MissingDataPolicy.NEITHER;
        private int degradedThreshold = 3;
        private Duration reNotifyInterval;
        private Duration dispatchTimeout = Duration.ofSeconds(15);
        private Duration retryBase = Duration.ofSeconds(30);
        private Duration maxBackoff = Duration.ofHours(1);
        private int maxDeliveryAttempts = 10;
        private Duration attemptRetention = Duration.ofHours(24);

        private Builder() {
        }

        public Builder workerThreads(int v) {
            this.workerThreads = v;
            return this;
        }

        public Builder tickInterval(Duration v) {
            this.tickInterval = v;
            return this;
        }

        public Builder jitterRatio(double v) {
            this.jitterRatio = v;
            return this;
        }

        public Builder telemetryTimeout(Duration v) {
            this.telemetryTimeout = v;
            return this;
        }

        public Builder missingDataPolicy(MissingDataPolicy v) {
            this.missingDataPolicy = v;
            return this;
        }

        public Builder degradedThreshold(int v) {
            this.degradedThreshold = v;
            return this;
        }

        /**
         * @param v re-notify interval, or {@code null} to disable
         */
        public Builder reNotifyInterval(Duration v) {
            this.reNotifyInterval = v;
            return this;
        }

        public Builder dispatchTimeout(Duration v) {
            this.dispatchTimeout = v;
            return this;
        }

        public Builder retryBase(Duration v) {
            this.retryBase = v;
            return this;
        }

        public Builder maxBackoff(Duration v) {
            this.maxBackoff = v;
            return this;
        }

        public Builder maxDeliveryAttempts(int v) {
            this.maxDeliveryAttempts = v;
            return this;
        }

        public Builder attemptRetention(Duration v) {
            this.attemptRetention = v;
            return this;
        }

        /**
         * Build and validate the settings.
         *
         * @return validated settings
         * @throws IllegalArgumentException if any value is out of range
         */
        public EngineSettings build() {
            Objects.requireNonNull(missingDataPolicy, "missingDataPolicy required");
            if (workerThreads < 1) {
                throw new IllegalArgumentException("workerThreads must be >= 1, got: " + workerThreads);
            }
            if (jitterRatio < 0 || jitterRatio > 0.5) {
                throw new IllegalArgumentException("jitterRatio must be in [0, 0.5], got: " + jitterRatio);
            }
            if (degradedThreshold < 1) {
                throw new IllegalArgumentException("degradedThreshold must be >= 1, got: " + degradedThreshold);
            }
            if (maxDeliveryAttempts < 1) {
                throw new IllegalArgumentException(
                        "maxDeliveryAttempts must be >= 1, got: " + maxDeliveryAttempts);
            }
            requirePositive(tickInterval, "tickInterval");
            requirePositive(telemetryTimeout, "telemetryTimeout");
            requirePositive(dispatchTimeout, "dispatchTimeout");
            requirePositive(retryBase, "retryBase");
            requirePositive(maxBackoff, "maxBackoff");
            if (maxBackoff.compareTo(retryBase) < 0) {
                throw new IllegalArgumentException("maxBackoff must be >= retryBase, got: " + maxBackoff);
            }
            if (reNotifyInterval != null) {
                requirePositive(reNotifyInterval, "reNotifyInterval");
            }
            Objects.requireNonNull(attemptRetention, "attemptRetention required");
            if (attemptRetention.isNegative()) {
                throw new IllegalArgumentException("attemptRetention must be >= 0, got: " + attemptRetention);
            }
            return new EngineSettings(this);
        }

        private static void requirePositive(Duration value, String name) {
            Objects.requireNonNull(value, name + " required");
            if (value.isZero() || value.isNegative()) {
                throw new IllegalArgumentException(name + " must be > 0, got: " + value);
            }
        }
    }

    @Override
    public String toString() {
        return "EngineSettings{" +
                "workerThreads=" + workerThreads +
                ", tickInterval=" + tickInterval +
                ", jitterRatio=" + jitterRatio +
                ", telemetryTimeout=" + telemetryTimeout +
                ", missingDataPolicy=" + missingDataPolicy +
                ", degradedThreshold=" + degradedThreshold +
                ", reNotifyInterval=" + reNotifyInterval +
                ", dispatchTimeout=" + dispatchTimeout +
                ", retryBase=" + retryBase +
                ", maxBackoff=" + maxBackoff +
                ", maxDeliveryAttempts=" + maxDeliveryAttempts +
                ", attemptRetention=" + attemptRetention +
                '}';
    }
}
