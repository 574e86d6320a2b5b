package com.alertwarden.service;

import com.alertwarden.core.config.ConfigException;
import com.alertwarden.core.config.ConfigLoader;
import com.alertwarden.core.config.EngineConfig;
import com.alertwarden.core.engine.AlertingEngine;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Polls the alerting document for modification and hot-reloads the engine.
 *
 * <p>
 * A document that fails to parse or validate is logged with every error and
 * the engine keeps running on the previous configuration.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigWatcher {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigWatcher.class);

    private final Path path;
    private final AlertingEngine engine;

    private volatile FileTime lastModified;
    private ScheduledExecutorService poller;

    public ConfigWatcher(Path path, AlertingEngine engine) {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.engine = Objects.requireNonNull(engine, "AlertingEngine must not be null");
        this.lastModified = modifiedTime();
    }

    /**
     * Reload if the file changed since the last check.
     *
     * @return {@code true} if a new configuration was activated
     */
    public boolean checkOnce() {
        FileTime modified = modifiedTime();
        if (modified == null || modified.equals(lastModified)) {
            return false;
        }
        lastModified = modified;
        LOG.info("Alerting configuration {} changed; reloading", path);
        try {
            EngineConfig config = ConfigLoader.fromFile(path.toString());
            long version = engine.loadConfig(config);
            LOG.info("Reloaded alerting configuration as version {}", version);
            return true;
        } catch (ConfigException e) {
            LOG.error("Rejected reloaded configuration, keeping version {}: {}",
                    engine.configVersion(), String.join("; ", e.getErrors()));
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOG.error("Could not read alerting configuration {}: {}", path, e.getMessage());
        }
        return false;
    }

    public synchronized void start(long intervalMs) {
        if (intervalMs < 1) {
            throw new IllegalArgumentException("intervalMs must be >= 1, got: " + intervalMs);
        }
        if (poller != null) {
            return;
        }
        poller = Executors.newSingleThreadScheduledExecutor(new ThreadFactoryBuilder()
                .setNameFormat("config-watcher-%d")
                .setDaemon(true)
                .build());
        poller.scheduleWithFixedDelay(this::checkOnce, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
        LOG.info("Watching {} every {} ms", path, intervalMs);
    }

    public synchronized void stop() {
        if (poller != null) {
            poller.shutdownNow();
            poller = null;
        }
    }

    private FileTime modifiedTime() {
        try {
            return Files.getLastModifiedTime(path);
        } catch (IOException e) {
            LOG.warn("Cannot stat alerting configuration {}: {}", path, e.getMessage());
            return null;
        }
    }
}
