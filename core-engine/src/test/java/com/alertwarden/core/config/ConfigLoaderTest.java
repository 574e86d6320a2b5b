package com.alertwarden.core.config;

import com.alertwarden.core.model.Aggregation;
import com.alertwarden.core.model.AlertRule;
import com.alertwarden.core.model.ComparisonOperator;
import com.alertwarden.core.model.SmsReceiver;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @Test
    @DisplayName("Should load rules and action groups from classpath YAML")
    void shouldLoadFromClasspath() {
        EngineConfig config = ConfigLoader.fromClasspath("test-alerting.yml");

        assertThat(config.getRules()).extracting(AlertRule::getId)
                .containsExactly("test-latency", "test-errors");
        assertThat(config.getActionGroups()).hasSize(2);

        AlertRule latency = config.rule("test-latency").orElseThrow();
        assertThat(latency.getAggregation()).isEqualTo(Aggregation.percentile(95));
        assertThat(latency.getComparator()).isEqualTo(ComparisonOperator.GREATER_THAN);
        assertThat(latency.getThreshold()).isEqualTo(2000.0);
        assertThat(latency.getEvaluationFrequency()).isEqualTo(Duration.ofMinutes(1));
        assertThat(latency.getConsecutiveBreachesToFire()).isEqualTo(3);
        assertThat(latency.isAutoMitigate()).isTrue();

        AlertRule errors = config.rule("test-errors").orElseThrow();
        assertThat(errors.getComparator()).isEqualTo(ComparisonOperator.GREATER_OR_EQUAL);
        assertThat(errors.isAutoMitigate()).isFalse();
        assertThat(errors.getActionGroupRefs()).containsExactly("ops", "escalation");
    }

    @Test
    @DisplayName("Should merge severity labels over the defaults")
    void shouldMergeSeverityLabels() {
        EngineConfig config = ConfigLoader.fromClasspath("test-alerting.yml");

        assertThat(config.severityLabel(0)).isEqualTo("Sev0");
        assertThat(config.severityLabel(2)).isEqualTo("Warning");
        assertThat(config.getSeverityEscalations()).containsEntry(0, List.of("escalation"));
    }

    @Test
    @DisplayName("Should normalise SMS country codes")
    void shouldNormaliseCountryCode() {
        EngineConfig config = ConfigLoader.fromClasspath("test-alerting.yml");

        SmsReceiver pager = config.getActionGroups().get(0).getReceivers().stream()
                .filter(SmsReceiver.class::isInstance)
                .map(SmsReceiver.class::cast)
                .findFirst().orElseThrow();
        assertThat(pager.target()).isEqualTo("+15550100");
    }

    @Test
    @DisplayName("Should load JSON documents and apply common settings")
    void shouldLoadJson() {
        EngineConfig config = ConfigLoader.fromClasspath("test-alerting.json");

        AlertRule rule = config.rule("json-rule").orElseThrow();
        assertThat(rule.isEnabled()).isFalse();
        assertThat(rule.getAggregation()).isEqualTo(Aggregation.COUNT);
        assertThat(rule.getSeverity()).isEqualTo(3);
    }

    @Test
    @DisplayName("Should load from a file path")
    void shouldLoadFromFile(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("alerting.yml");
        try (var in = getClass().getClassLoader().getResourceAsStream("test-alerting.yml")) {
            Files.copy(in, file);
        }

        EngineConfig config = ConfigLoader.fromFile(file.toString());

        assertThat(config.ruleIds()).containsExactlyInAnyOrder("test-latency", "test-errors");
    }

    @Test
    @DisplayName("Should throw for missing classpath resource")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw for missing file")
    void shouldThrowForMissingFile(@TempDir Path dir) {
        assertThatThrownBy(() -> ConfigLoader.fromFile(dir.resolve("nope.yml").toString()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should reject duplicate YAML keys")
    void shouldRejectDuplicateKeys() {
        assertThatThrownBy(() -> ConfigLoader.readClasspath("duplicate-keys.yml"))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("Malformed YAML");
    }

    @Test
    @DisplayName("Should reject malformed JSON")
    void shouldRejectMalformedJson() {
        assertThatThrownBy(() -> ConfigLoader.readString("{ \"actionGroups\": [", ConfigLoader.Format.JSON))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("Malformed JSON");
    }

    @Test
    @DisplayName("Should ignore unknown properties in exported JSON")
    void shouldIgnoreUnknownJsonProperties() {
        String json = String.join("\n",
                "{ \"actionGroups\": [ {",
                "    \"name\": \"ops\", \"shortName\": \"ops\", \"location\": \"Global\",",
                "    \"receivers\": { \"emailReceivers\": [",
                "      { \"name\": \"ops-mail\", \"emailAddress\": \"ops@example.com\", \"status\": \"Enabled\" } ] }",
                "} ] }");

        EngineConfig config = ConfigValidator.validate(ConfigLoader.readString(json, ConfigLoader.Format.JSON));

        assertThat(config.getActionGroups()).singleElement()
                .satisfies(group -> assertThat(group.getReceivers()).hasSize(1));
    }

    @Test
    @DisplayName("Empty document yields an empty configuration")
    void emptyDocument() {
        ConfigDocument document = ConfigLoader.readString("", ConfigLoader.Format.YAML);

        EngineConfig config = ConfigValidator.validate(document);

        assertThat(config.getRules()).isEmpty();
        assertThat(config.getActionGroups()).isEmpty();
    }

    @Test
    @DisplayName("Unknown action group reference fails the whole document")
    void unknownGroupFailsWholeDocument() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("unknown-group.yml"))
                .isInstanceOf(ConfigException.class)
                .satisfies(e -> assertThat(((ConfigException) e).getErrors())
                        .containsExactly("Rule 'orphan-rule' references unknown action group 'missing-group'"));
    }

    @Test
    @DisplayName("Format is derived from the file extension")
    void formatForName() {
        assertThat(ConfigLoader.Format.forName("rules.JSON")).isEqualTo(ConfigLoader.Format.JSON);
        assertThat(ConfigLoader.Format.forName("rules.yaml")).isEqualTo(ConfigLoader.Format.YAML);
        assertThat(ConfigLoader.Format.forName(null)).isEqualTo(ConfigLoader.Format.YAML);
    }
}
