package com.alertwarden.service;

import com.alertwarden.core.config.ConfigLoader;
import com.alertwarden.core.engine.AlertingEngine;
import com.alertwarden.core.model.AlertState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigWatcher}.
 */
class ConfigWatcherTest {

    private static final String GROUPS = String.join("\n",
            "actionGroups:",
            "  - name: ops",
            "    shortName: ops",
            "    receivers:",
            "      emailReceivers:",
            "        - name: ops-mail",
            "          emailAddress: ops@example.com",
            "");

    private static final String ONE_RULE = GROUPS + String.join("\n",
            "alertConfiguration:",
            "  rules:",
            "    - id: api-latency",
            "      conditionQuery: requests | duration",
            "      aggregation: avg",
            "      operator: \">\"",
            "      threshold: 100",
            "      evaluationFrequency: PT1M",
            "      windowSize: PT5M",
            "      actionGroups: [ops]",
            "");

    private static final String TWO_RULES = ONE_RULE + String.join("\n",
            "    - id: api-errors",
            "      conditionQuery: requests | failed",
            "      aggregation: ratio",
            "      operator: \">=\"",
            "      threshold: 0.05",
            "      evaluationFrequency: PT5M",
            "      windowSize: PT15M",
            "      actionGroups: [ops]",
            "");

    @TempDir
    Path dir;

    private Path file;
    private AlertingEngine engine;
    private ConfigWatcher watcher;

    @BeforeEach
    void setUp() throws IOException {
        file = dir.resolve("alerting.yml");
        Files.writeString(file, ONE_RULE, StandardCharsets.UTF_8);
        engine = AlertingEngine.builder()
                .telemetrySource((query, aggregation, window) -> 0.0)
                .deliveryChannel(new LoggingDeliveryChannel(new PayloadSerializer()))
                .workerExecutor(Runnable::run)
                .deliveryExecutor(Runnable::run)
                .callExecutor(Runnable::run)
                .build();
        engine.loadConfig(ConfigLoader.fromFile(file.toString()));
        watcher = new ConfigWatcher(file, engine);
    }

    @AfterEach
    void tearDown() {
        watcher.stop();
        engine.close();
    }

    private void rewrite(String content) throws IOException {
        FileTime previous = Files.getLastModifiedTime(file);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        Files.setLastModifiedTime(file, FileTime.fromMillis(previous.toMillis() + 10_000));
    }

    @Test
    @DisplayName("Should do nothing while the file is unchanged")
    void unchangedFile() {
        assertThat(watcher.checkOnce()).isFalse();
        assertThat(engine.configVersion()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should reload a changed file as a new version and keep existing state")
    void reloadsChangedFile() throws IOException {
        rewrite(TWO_RULES);

        assertThat(watcher.checkOnce()).isTrue();
        assertThat(engine.configVersion()).isEqualTo(2);
        assertThat(engine.activeConfig().getRules()).hasSize(2);
        assertThat(engine.getAlertInstance("api-errors").getState()).isEqualTo(AlertState.PENDING);

        assertThat(watcher.checkOnce()).isFalse();
    }

    @Test
    @DisplayName("Should keep the previous configuration when the new file is invalid")
    void keepsPreviousOnInvalidFile() throws IOException {
        rewrite(ONE_RULE.replace("actionGroups: [ops]", "actionGroups: [missing]"));

        assertThat(watcher.checkOnce()).isFalse();
        assertThat(engine.configVersion()).isEqualTo(1);
        assertThat(engine.activeConfig().getRules()).hasSize(1);
    }

    @Test
    @DisplayName("Should keep the previous configuration when the file disappears")
    void keepsPreviousOnMissingFile() throws IOException {
        Files.delete(file);

        assertThat(watcher.checkOnce()).isFalse();
        assertThat(engine.configVersion()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should pick up a changed file on its own once started")
    void pollsInBackground() throws Exception {
        watcher.start(20);
        rewrite(TWO_RULES);

        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (engine.configVersion() < 2 && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }

        assertThat(engine.configVersion()).isEqualTo(2);
        assertThat(engine.activeConfig().getRules()).hasSize(2);
    }

    @Test
    @DisplayName("Should reject a non-positive polling interval")
    void rejectsInvalidInterval() {
        assertThatThrownBy(() -> watcher.start(0))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("intervalMs");
    }
}
