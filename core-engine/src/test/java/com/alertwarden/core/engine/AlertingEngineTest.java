package com.alertwarden.core.engine;

import com.alertwarden.core.config.ConfigDocument;
import com.alertwarden.core.config.ConfigException;
import com.alertwarden.core.config.ConfigLoader;
import com.alertwarden.core.evaluation.RuleHealth;
import com.alertwarden.core.model.AlertEvent;
import com.alertwarden.core.model.AlertEventType;
import com.alertwarden.core.model.AlertInstance;
import com.alertwarden.core.model.AlertState;
import com.alertwarden.core.model.AttemptStatus;
import com.alertwarden.core.testing.FakeTelemetrySource;
import com.alertwarden.core.testing.MutableClock;
import com.alertwarden.core.testing.RecordingDeliveryChannel;
import com.google.common.util.concurrent.MoreExecutors;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static com.alertwarden.core.testing.TestRules.ESCALATION_HOOK;
import static com.alertwarden.core.testing.TestRules.OPS_MAIL;
import static com.alertwarden.core.testing.TestRules.OPS_PAGER;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link AlertingEngine}, driven tick by tick on a manual clock.
 */
class AlertingEngineTest {

    private static final String LATENCY = "test-latency";
    private static final String ERRORS = "test-errors";
    private static final String LATENCY_QUERY = "requests | duration";
    private static final String ERRORS_QUERY = "requests | failed";

    private final MutableClock clock = MutableClock.startingAt("2026-01-01T00:00:00Z");
    private final FakeTelemetrySource telemetry = new FakeTelemetrySource();
    private final RecordingDeliveryChannel channel = new RecordingDeliveryChannel();
    private final SimpleMeterRegistry meters = new SimpleMeterRegistry();
    private final AtomicInteger ids = new AtomicInteger();
    private AlertingEngine engine;

    @AfterEach
    void tearDown() {
        if (engine != null) {
            engine.close();
        }
    }

    private AlertingEngine engine(EngineSettings settings) {
        engine = AlertingEngine.builder()
                .telemetrySource(telemetry)
                .deliveryChannel(channel)
                .settings(settings)
                .clock(clock)
                .workerExecutor(MoreExecutors.directExecutor())
                .deliveryExecutor(MoreExecutors.directExecutor())
                .callExecutor(MoreExecutors.directExecutor())
                .meterRegistry(meters)
                .correlationIds(() -> "corr-" + ids.incrementAndGet())
                .build();
        return engine;
    }

    private AlertingEngine loadedEngine() {
        AlertingEngine e = engine(EngineSettings.builder().jitterRatio(0).build());
        e.loadConfig(ConfigLoader.fromClasspath("test-alerting.yml"));
        return e;
    }

    private void tickAfter(Duration duration) {
        clock.advance(duration);
        engine.tick();
    }

    @Test
    @DisplayName("Every rule of a freshly loaded document starts Pending with zero breaches")
    void loadedRulesStartPending() {
        AlertingEngine e = loadedEngine();

        assertThat(e.configVersion()).isEqualTo(1);
        for (String ruleId : List.of(LATENCY, ERRORS)) {
            AlertInstance instance = e.getAlertInstance(ruleId);
            assertThat(instance.getState()).isEqualTo(AlertState.PENDING);
            assertThat(instance.getConsecutiveBreaches()).isZero();
        }
    }

    @Test
    @DisplayName("A rule referencing an unknown action group activates nothing")
    void unknownGroupActivatesNothing() {
        AlertingEngine e = engine(EngineSettings.defaults());
        ConfigDocument document = ConfigLoader.readClasspath("unknown-group.yml");

        assertThatThrownBy(() -> e.loadConfig(document))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("unknown action group 'missing-group'");

        assertThat(e.configVersion()).isZero();
        assertThat(e.activeConfig().getRules()).isEmpty();
        assertThatThrownBy(() -> e.getAlertInstance("good-rule"))
                .isInstanceOf(UnknownRuleException.class)
                .hasMessage("Unknown rule: 'good-rule'");
    }

    @Test
    @DisplayName("Breaches fire after the hysteresis count and clears resolve to the same receivers")
    void fireAndResolveEndToEnd() {
        loadedEngine();
        telemetry.value(LATENCY_QUERY, 2500).value(ERRORS_QUERY, 0.0);

        engine.tick();
        tickAfter(Duration.ofMinutes(1));
        assertThat(engine.getAlertInstance(LATENCY).getState()).isEqualTo(AlertState.PENDING);
        tickAfter(Duration.ofMinutes(1));

        AlertInstance firing = engine.getAlertInstance(LATENCY);
        assertThat(firing.getState()).isEqualTo(AlertState.FIRING);
        assertThat(firing.getCorrelationId()).isEqualTo("corr-1");
        assertThat(engine.listFiring()).containsExactly(firing);
        assertThat(channel.receiversFor("corr-1", "FIRED")).containsExactly(OPS_MAIL, OPS_PAGER);
        assertThat(engine.notificationAttempts("corr-1")).allMatch(a -> a.getStatus() == AttemptStatus.SENT);

        telemetry.value(LATENCY_QUERY, 100);
        tickAfter(Duration.ofMinutes(1));
        assertThat(engine.getAlertInstance(LATENCY).getState()).isEqualTo(AlertState.FIRING);
        tickAfter(Duration.ofMinutes(1));

        assertThat(engine.getAlertInstance(LATENCY).getState()).isEqualTo(AlertState.RESOLVED);
        assertThat(engine.listFiring()).isEmpty();
        assertThat(channel.receiversFor("corr-1", "RESOLVED")).containsExactly(OPS_MAIL, OPS_PAGER);
        assertThat(meters.counter("warden.alerts.transitions", "event", "fired").count()).isEqualTo(1.0);
        assertThat(meters.counter("warden.alerts.transitions", "event", "resolved").count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Severity escalation and manual resolution for a rule without auto-mitigation")
    void manualResolveWithoutAutoMitigate() {
        loadedEngine();
        telemetry.value(LATENCY_QUERY, 0).value(ERRORS_QUERY, 0.2);

        AlertEvent fired = engine.evaluateNow(ERRORS).orElseThrow();
        assertThat(fired.getType()).isEqualTo(AlertEventType.FIRED);
        assertThat(channel.receiversFor(fired.getCorrelationId(), "FIRED"))
                .containsExactly(OPS_MAIL, OPS_PAGER, ESCALATION_HOOK);

        telemetry.value(ERRORS_QUERY, 0.0);
        assertThat(engine.evaluateNow(ERRORS)).isEmpty();
        assertThat(engine.evaluateNow(ERRORS)).isEmpty();
        assertThat(engine.getAlertInstance(ERRORS).getState()).isEqualTo(AlertState.FIRING);

        AlertEvent resolved = engine.manualResolve(ERRORS).orElseThrow();

        assertThat(resolved.getCorrelationId()).isEqualTo(fired.getCorrelationId());
        assertThat(engine.getAlertInstance(ERRORS).getState()).isEqualTo(AlertState.RESOLVED);
        assertThat(channel.receiversFor(fired.getCorrelationId(), "RESOLVED"))
                .containsExactly(OPS_MAIL, OPS_PAGER, ESCALATION_HOOK);
        assertThat(engine.manualResolve(ERRORS)).isEmpty();
    }

    @Test
    @DisplayName("Reload keeps the state of surviving rules and retires removed ones")
    void reloadKeepsState() {
        loadedEngine();
        telemetry.value(ERRORS_QUERY, 0.2);
        String correlationId = engine.evaluateNow(ERRORS).orElseThrow().getCorrelationId();

        ConfigDocument next = ConfigLoader.readClasspath("test-alerting.yml");
        next.getAlertConfiguration().getRules().removeIf(r -> r.getId().equals(LATENCY));
        next.getAlertConfiguration().getRules().get(0).setThreshold(0.1);

        assertThat(engine.loadConfig(next)).isEqualTo(2);

        AlertInstance instance = engine.getAlertInstance(ERRORS);
        assertThat(instance.getState()).isEqualTo(AlertState.FIRING);
        assertThat(instance.getCorrelationId()).isEqualTo(correlationId);
        assertThat(engine.activeConfig().rule(ERRORS).orElseThrow().getThreshold()).isEqualTo(0.1);
        assertThatThrownBy(() -> engine.getAlertInstance(LATENCY)).isInstanceOf(UnknownRuleException.class);
    }

    @Test
    @DisplayName("A reload during evaluation does not reroute the notices of that evaluation")
    void reloadDuringEvaluationKeepsRouting() throws IOException {
        ConfigDocument renamed = ConfigLoader.readString(classpathText("test-alerting.yml")
                .replace("  - name: ops\n", "  - name: oncall\n")
                .replace("[ops]", "[oncall]")
                .replace("[ops, escalation]", "[oncall, escalation]"), ConfigLoader.Format.YAML);
        AtomicInteger reloads = new AtomicInteger();
        engine = AlertingEngine.builder()
                .telemetrySource((query, aggregation, window) -> {
                    if (reloads.getAndIncrement() == 0) {
                        engine.loadConfig(renamed);
                    }
                    return 0.2;
                })
                .deliveryChannel(channel)
                .clock(clock)
                .workerExecutor(MoreExecutors.directExecutor())
                .deliveryExecutor(MoreExecutors.directExecutor())
                .callExecutor(MoreExecutors.directExecutor())
                .correlationIds(() -> "corr-" + ids.incrementAndGet())
                .build();
        engine.loadConfig(ConfigLoader.fromClasspath("test-alerting.yml"));

        AlertEvent fired = engine.evaluateNow(ERRORS).orElseThrow();

        assertThat(engine.configVersion()).isEqualTo(2);
        assertThat(engine.activeConfig().rule(ERRORS).orElseThrow().getActionGroupRefs())
                .containsExactlyInAnyOrder("oncall", "escalation");
        assertThat(channel.receiversFor(fired.getCorrelationId(), "FIRED"))
                .containsExactly(OPS_MAIL, OPS_PAGER, ESCALATION_HOOK);
    }

    private static String classpathText(String resource) throws IOException {
        try (InputStream in = AlertingEngineTest.class.getClassLoader().getResourceAsStream(resource)) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    @DisplayName("Rejected reload leaves the previous configuration active")
    void rejectedReloadKeepsPrevious() {
        loadedEngine();

        assertThatThrownBy(() -> engine.loadConfig(ConfigLoader.readClasspath("unknown-group.yml")))
                .isInstanceOf(ConfigException.class);

        assertThat(engine.configVersion()).isEqualTo(1);
        assertThat(engine.activeConfig().ruleIds()).containsExactlyInAnyOrder(LATENCY, ERRORS);
    }

    @Test
    @DisplayName("Unknown rule ids are rejected by every per-rule operation")
    void unknownRule() {
        loadedEngine();

        assertThatThrownBy(() -> engine.getAlertInstance("nope")).isInstanceOf(UnknownRuleException.class);
        assertThatThrownBy(() -> engine.evaluateNow("nope")).isInstanceOf(UnknownRuleException.class);
        assertThatThrownBy(() -> engine.manualResolve("nope"))
                .isInstanceOf(UnknownRuleException.class)
                .satisfies(e -> assertThat(((UnknownRuleException) e).getRuleId()).isEqualTo("nope"));
    }

    @Test
    @DisplayName("Repeated telemetry failures mark the rule degraded without touching its state")
    void degradedMonitoring() {
        AlertingEngine e = engine(EngineSettings.builder().jitterRatio(0).degradedThreshold(2).build());
        e.loadConfig(ConfigLoader.fromClasspath("test-alerting.yml"));
        telemetry.value(LATENCY_QUERY, 0);

        e.tick();
        assertThat(e.listDegraded()).isEmpty();
        tickAfter(Duration.ofMinutes(5));

        assertThat(e.listDegraded()).extracting(RuleHealth::getRuleId).containsExactly(ERRORS);
        assertThat(e.ruleHealth(ERRORS).orElseThrow().getConsecutiveErrors()).isEqualTo(2);
        assertThat(e.getAlertInstance(ERRORS).getState()).isEqualTo(AlertState.PENDING);
        assertThat(meters.counter("warden.monitoring.degraded").count()).isEqualTo(1.0);
        assertThat(meters.counter("warden.evaluations", "outcome", "error").count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("Undeliverable notifications surface as given up without blocking the transition")
    void givenUpSurfaced() {
        AlertingEngine e = engine(EngineSettings.builder().jitterRatio(0).maxDeliveryAttempts(1).build());
        e.loadConfig(ConfigLoader.fromClasspath("test-alerting.yml"));
        channel.breakReceiver(OPS_PAGER);
        telemetry.value(ERRORS_QUERY, 0.5);

        e.evaluateNow(ERRORS);

        assertThat(e.getAlertInstance(ERRORS).getState()).isEqualTo(AlertState.FIRING);
        assertThat(e.givenUpNotifications()).singleElement()
                .satisfies(a -> assertThat(a.getReceiver()).isEqualTo(OPS_PAGER));
        assertThat(channel.receiversFor("corr-1", "FIRED")).containsExactly(OPS_MAIL, ESCALATION_HOOK);
    }

    @Test
    @DisplayName("Disabled rules are neither scheduled nor evaluated on demand")
    void disabledRuleNotEvaluated() {
        AlertingEngine e = engine(EngineSettings.builder().jitterRatio(0).build());
        e.loadConfig(ConfigLoader.fromClasspath("test-alerting.json"));

        e.tick();

        assertThat(e.evaluateNow("json-rule")).isEmpty();
        assertThat(telemetry.calls("requests | count")).isZero();
        assertThat(e.getAlertInstance("json-rule").getState()).isEqualTo(AlertState.PENDING);
    }

    @Test
    @DisplayName("Start and shutdown manage the owned executors")
    void startAndShutdown() {
        engine = AlertingEngine.builder()
                .telemetrySource(telemetry)
                .deliveryChannel(channel)
                .settings(EngineSettings.builder().tickInterval(Duration.ofMillis(50)).build())
                .build();

        engine.start();
        engine.start();
        assertThat(engine.isRunning()).isTrue();

        engine.shutdown();
        assertThat(engine.isRunning()).isFalse();
    }

    @Test
    @DisplayName("Builder requires the telemetry source and delivery channel")
    void builderRequiresCollaborators() {
        assertThatThrownBy(() -> AlertingEngine.builder().deliveryChannel(channel).build())
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("TelemetrySource");
    }
}
