package com.alertwarden.service;

import com.alertwarden.core.config.ConfigLoader;
import com.alertwarden.core.config.EngineConfig;
import com.alertwarden.core.engine.AlertingEngine;
import com.alertwarden.core.engine.EngineSettings;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;

/**
 * Main entry point of the Alert Warden service.
 *
 * <h3>Pipeline</h3>
 *
 * <pre>
 *   alerting.yml
 *     -&gt; ConfigLoader (validate, all-or-nothing)
 *     -&gt; AlertingEngine
 *          scheduler -&gt; HttpTelemetrySource -&gt; state machine
 *          -&gt; dispatcher -&gt; LoggingDeliveryChannel
 * </pre>
 *
 * <h3>Configuration</h3>
 * <p>
 * All configuration is resolved from environment variables via
 * {@link ServiceConfig}.
 * </p>
 *
 * @since 1.0.0
 */
public final class WardenService {

    private static final Logger LOG = LoggerFactory.getLogger(WardenService.class);

    private WardenService() {
        // entry-point class - not instantiable
    }

    public static void main(String[] args) throws InterruptedException {
        // 1. Load configuration
        ServiceConfig config = ServiceConfig.fromEnvironment();
        LOG.info("Starting Alert Warden with config: {}", config);

        // 2. Load alerting rules
        EngineConfig engineConfig = loadAlerting(config);
        if (engineConfig.getRules().isEmpty()) {
            throw new IllegalStateException(
                    "No alert rules defined. Provide rules via "
                            + ConfigLoader.ENV_CONFIG_PATH
                            + " or a classpath " + ConfigLoader.DEFAULT_RESOURCE + " file.");
        }

        // 3. Build and start the engine
        EngineSettings settings = config.toEngineSettings();
        PayloadSerializer serializer = new PayloadSerializer();
        AlertingEngine engine = AlertingEngine.builder()
                .telemetrySource(new HttpTelemetrySource(config.getTelemetryBaseUrl(),
                        Duration.ofMillis(config.getTelemetryTimeoutMs())))
                .deliveryChannel(new LoggingDeliveryChannel(serializer))
                .settings(settings)
                .meterRegistry(new SimpleMeterRegistry())
                .errorListener(attempt -> LOG.error("Notification given up: {}", attempt))
                .build();
        engine.loadConfig(engineConfig);
        LOG.info("Loaded {} alert rule(s)", engineConfig.getRules().size());
        engine.start();

        // 4. Health server and config watcher, stopped by the shutdown hook
        HealthServer healthServer = new HealthServer(engine, serializer);
        healthServer.start(config.getHealthPort());

        ConfigWatcher watcher = null;
        if (config.getConfigReloadIntervalMs() > 0 && !config.getAlertingConfigPath().isBlank()) {
            watcher = new ConfigWatcher(Path.of(config.getAlertingConfigPath()), engine);
            watcher.start(config.getConfigReloadIntervalMs());
        }

        CountDownLatch stopped = new CountDownLatch(1);
        ConfigWatcher registeredWatcher = watcher;
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            if (registeredWatcher != null) {
                registeredWatcher.stop();
            }
            engine.shutdown();
            healthServer.stop();
            stopped.countDown();
        }, "warden-shutdown"));

        stopped.await();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static EngineConfig loadAlerting(ServiceConfig config) {
        String path = config.getAlertingConfigPath();
        if (path != null && !path.isBlank()) {
            return ConfigLoader.fromFile(path);
        }
        return ConfigLoader.load();
    }
}
