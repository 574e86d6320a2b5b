package com.alertwarden.service;

import com.alertwarden.core.engine.EngineSettings;
import com.alertwarden.core.evaluation.MissingDataPolicy;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Typed, immutable configuration of the warden process.
 *
 * <p>
 * Values are resolved from environment variables with sensible defaults, so
 * the service is configured entirely through its deployment environment.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use {@link #fromEnvironment()} for production, or the {@link Builder}
 * for programmatic / test scenarios. The builder validates inputs at
 * {@link Builder#build()} time.
 * </p>
 *
 * @since 1.0.0
 */
public final class ServiceConfig {

    // ---------------------------------------------------------------
    // Sources
    // ---------------------------------------------------------------
    private final String alertingConfigPath;
    private final String telemetryBaseUrl;
    private final long configReloadIntervalMs;

    // ---------------------------------------------------------------
    // Engine
    // ---------------------------------------------------------------
    private final int workerThreads;
    private final long tickIntervalMs;
    private final long telemetryTimeoutMs;
    private final long dispatchTimeoutMs;
    private final long retryBaseMs;
    private final int maxDeliveryAttempts;
    private final long reNotifyIntervalMs;
    private final MissingDataPolicy missingDataPolicy;
    private final int degradedThreshold;

    // ---------------------------------------------------------------
    // Health
    // ---------------------------------------------------------------
    private final int healthPort;

    private ServiceConfig(Builder b) {
        this.alertingConfigPath = b.alertingConfigPath;
        this.telemetryBaseUrl = b.telemetryBaseUrl;
        this.configReloadIntervalMs = b.configReloadIntervalMs;
        this.workerThreads = b.workerThreads;
        this.tickIntervalMs = b.tickIntervalMs;
        this.telemetryTimeoutMs = b.telemetryTimeoutMs;
        this.dispatchTimeoutMs = b.dispatchTimeoutMs;
        this.retryBaseMs = b.retryBaseMs;
        this.maxDeliveryAttempts = b.maxDeliveryAttempts;
        this.reNotifyIntervalMs = b.reNotifyIntervalMs;
        this.missingDataPolicy = b.missingDataPolicy;
        this.degradedThreshold = b.degradedThreshold;
        this.healthPort = b.healthPort;
    }

    // ---------------------------------------------------------------
    // Factory - resolve from environment
    // ---------------------------------------------------------------

    /**
     * Build a {@link ServiceConfig} from environment variables.
     *
     * @return fully populated configuration
     * @throws IllegalStateException    if an env-var value cannot be parsed
     * @throws IllegalArgumentException if a validated field is out of range
     */
    public static ServiceConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /**
     * Build a {@link ServiceConfig} from the given variables.
     *
     * @param env variable name to value
     * @return fully populated configuration
     */
    public static ServiceConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env must not be null");
        try {
            return new Builder()
                    .alertingConfigPath(value(env, "ALERTING_CONFIG_PATH", ""))
                    .telemetryBaseUrl(value(env, "TELEMETRY_BASE_URL", "http://localhost:9090"))
                    .configReloadIntervalMs(Long.parseLong(value(env, "CONFIG_RELOAD_INTERVAL_MS", "0")))
                    .workerThreads(Integer.parseInt(value(env, "WORKER_THREADS", "4")))
                    .tickIntervalMs(Long.parseLong(value(env, "TICK_INTERVAL_MS", "1000")))
                    .telemetryTimeoutMs(Long.parseLong(value(env, "TELEMETRY_TIMEOUT_MS", "10000")))
                    .dispatchTimeoutMs(Long.parseLong(value(env, "DISPATCH_TIMEOUT_MS", "15000")))
                    .retryBaseMs(Long.parseLong(value(env, "RETRY_BASE_MS", "30000")))
                    .maxDeliveryAttempts(Integer.parseInt(value(env, "MAX_DELIVERY_ATTEMPTS", "10")))
                    .reNotifyIntervalMs(Long.parseLong(value(env, "RENOTIFY_INTERVAL_MS", "0")))
                    .missingDataPolicy(MissingDataPolicy.valueOf(
                            value(env, "MISSING_DATA_POLICY", "NEITHER").trim().toUpperCase(Locale.ROOT)))
                    .degradedThreshold(Integer.parseInt(value(env, "DEGRADED_THRESHOLD", "3")))
                    .healthPort(Integer.parseInt(value(env, "HEALTH_PORT", "8080")))
                    .build();
        } catch (NumberFormatException e) {
            throw new IllegalStateException(
                    "Failed to parse numeric environment variable: " + e.getMessage(), e);
        }
    }

    /**
     * Engine settings derived from this configuration. Values not exposed as
     * variables keep the engine defaults.
     */
    public EngineSettings toEngineSettings() {
        return EngineSettings.builder()
                .workerThreads(workerThreads)
                .tickInterval(Duration.ofMillis(tickIntervalMs))
                .telemetryTimeout(Duration.ofMillis(telemetryTimeoutMs))
                .dispatchTimeout(Duration.ofMillis(dispatchTimeoutMs))
                .retryBase(Duration.ofMillis(retryBaseMs))
                .maxBackoff(Duration.ofMillis(Math.max(retryBaseMs, Duration.ofHours(1).toMillis())))
                .maxDeliveryAttempts(maxDeliveryAttempts)
                .reNotifyInterval(reNotifyIntervalMs > 0 ? Duration.ofMillis(reNotifyIntervalMs) : null)
                .missingDataPolicy(missingDataPolicy)
                .degradedThreshold(degradedThreshold)
                .build();
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getAlertingConfigPath() {
        return alertingConfigPath;
    }

    public String getTelemetryBaseUrl() {
        return telemetryBaseUrl;
    }

    public long getConfigReloadIntervalMs() {
        return configReloadIntervalMs;
    }

    public int getWorkerThreads() {
        return workerThreads;
    }

    public long getTickIntervalMs() {
        return tickIntervalMs;
    }

    public long getTelemetryTimeoutMs() {
        return telemetryTimeoutMs;
    }

    public long getDispatchTimeoutMs() {
        return dispatchTimeoutMs;
    }

    public long getRetryBaseMs() {
        return retryBaseMs;
    }

    public int getMaxDeliveryAttempts() {
        return maxDeliveryAttempts;
    }

    public long getReNotifyIntervalMs() {
        return reNotifyIntervalMs;
    }

    public MissingDataPolicy getMissingDataPolicy() {
        return missingDataPolicy;
    }

    public int getDegradedThreshold() {
        return degradedThreshold;
    }

    public int getHealthPort() {
        return healthPort;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ServiceConfig}.
     *
     * <p>
     * The {@link #build()} method validates that all values are within legal
     * ranges (positive intervals and timeouts, port in [1, 65535], an absolute
     * http(s) telemetry URL).
     * </p>
     */
    public static class Builder {
        private String alertingConfigPath = "";
        private String telemetryBaseUrl = "http://localhost:9090";
        private long configReloadIntervalMs = 0;
        private int workerThreads = 4;
        private long tickIntervalMs = 1_000;
        private long telemetryTimeoutMs = 10_000;
        private long dispatchTimeoutMs = 15_000;
        private long retryBaseMs = 30_000;
        private int maxDeliveryAttempts = 10;
        private long reNotifyIntervalMs = 0;
        private MissingDataPolicy missingDataPolicy = MissingDataPolicy.NEITHER;
        private int degradedThreshold = 3;
        private int healthPort = 8080;

        public Builder alertingConfigPath(String v) {
            this.alertingConfigPath = v;
            return this;
        }

        public Builder telemetryBaseUrl(String v) {
            this.telemetryBaseUrl = v;
            return this;
        }

        public Builder configReloadIntervalMs(long v) {
            this.configReloadIntervalMs = v;
            return this;
        }

        public Builder workerThreads(int v) {
            this.workerThreads = v;
            return this;
        }

        public Builder tickIntervalMs(long v) {
            this.tickIntervalMs = v;
            return this;
        }

        public Builder telemetryTimeoutMs(long v) {
            this.telemetryTimeoutMs = v;
            return this;
        }

        public Builder dispatchTimeoutMs(long v) {
            this.dispatchTimeoutMs = v;
            return this;
        }

        public Builder retryBaseMs(long v) {
            this.retryBaseMs = v;
            return this;
        }

        public Builder maxDeliveryAttempts(int v) {
            this.maxDeliveryAttempts = v;
            return this;
        }

        public Builder reNotifyIntervalMs(long v) {
            this.reNotifyIntervalMs = v;
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

        public Builder healthPort(int v) {
            this.healthPort = v;
            return this;
        }

        /**
         * Build and validate the configuration.
         *
         * @return a validated {@link ServiceConfig}
         * @throws IllegalArgumentException if any value is invalid
         */
        public ServiceConfig build() {
            Objects.requireNonNull(alertingConfigPath, "alertingConfigPath required");
            Objects.requireNonNull(missingDataPolicy, "missingDataPolicy required");
            if (telemetryBaseUrl == null
                    || !(telemetryBaseUrl.startsWith("http://") || telemetryBaseUrl.startsWith("https://"))) {
                throw new IllegalArgumentException(
                        "telemetryBaseUrl must be an http(s) URL, got: " + telemetryBaseUrl);
            }
            requirePositive(tickIntervalMs, "tickIntervalMs");
            requirePositive(telemetryTimeoutMs, "telemetryTimeoutMs");
            requirePositive(dispatchTimeoutMs, "dispatchTimeoutMs");
            requirePositive(retryBaseMs, "retryBaseMs");
            if (workerThreads < 1) {
                throw new IllegalArgumentException("workerThreads must be >= 1, got: " + workerThreads);
            }
            if (maxDeliveryAttempts < 1) {
                throw new IllegalArgumentException(
                        "maxDeliveryAttempts must be >= 1, got: " + maxDeliveryAttempts);
            }
            if (degradedThreshold < 1) {
                throw new IllegalArgumentException(
                        "degradedThreshold must be >= 1, got: " + degradedThreshold);
            }
            if (reNotifyIntervalMs < 0 || configReloadIntervalMs < 0) {
                throw new IllegalArgumentException("Intervals must be >= 0 (0 disables)");
            }
            if (healthPort < 1 || healthPort > 65_535) {
                throw new IllegalArgumentException(
                        "healthPort must be in [1, 65535], got: " + healthPort);
            }
            return new ServiceConfig(this);
        }

        private static void requirePositive(long value, String name) {
            if (value < 1) {
                throw new IllegalArgumentException(name + " must be >= 1, got: " + value);
            }
        }
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private static String value(Map<String, String> env, String name, String defaultValue) {
        String value = env.get(name);
        return (value != null && !value.isBlank()) ? value : defaultValue;
    }

    @Override
    public String toString() {
        return "ServiceConfig{" +
                "alertingConfigPath='" + alertingConfigPath + '\'' +
                ", telemetryBaseUrl='" + telemetryBaseUrl + '\'' +
                ", configReloadIntervalMs=" + configReloadIntervalMs +
                ", workerThreads=" + workerThreads +
                ", tickIntervalMs=" + tickIntervalMs +
                ", telemetryTimeoutMs=" + telemetryTimeoutMs +
                ", dispatchTimeoutMs=" + dispatchTimeoutMs +
                ", retryBaseMs=" + retryBaseMs +
                ", maxDeliveryAttempts=" + maxDeliveryAttempts +
                ", reNotifyIntervalMs=" + reNotifyIntervalMs +
                ", missingDataPolicy=" + missingDataPolicy +
                ", degradedThreshold=" + degradedThreshold +
                ", healthPort=" + healthPort +
                '}';
    }
}
