package com.alertwarden.core.config;

import com.alertwarden.core.model.ActionGroup;
import com.alertwarden.core.model.AlertRule;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Validated, immutable alerting configuration.
 *
 * <p>
 * Produced only by {@link ConfigValidator}; every rule's action group
 * references resolve against {@link #getActionGroups()}, and every rule's
 * frequency and window are members of the enumerated options.
 * </p>
 *
 * @since 1.0.0
 */
public final class EngineConfig {

    private final List<AlertRule> rules;
    private final Map<String, AlertRule> rulesById;
    private final List<ActionGroup> actionGroups;
    private final Map<Integer, String> severityLevels;
    private final Map<Integer, List<String>> severityEscalations;
    private final Set<Duration> evaluationFrequencyOptions;
    private final Set<Duration> aggregationGranularityOptions;
    private final boolean skipMetricValidation;
    private final boolean checkWorkspaceAlertsStorageConfigured;

    EngineConfig(List<AlertRule> rules,
            List<ActionGroup> actionGroups,
            Map<Integer, String> severityLevels,
            Map<Integer, List<String>> severityEscalations,
            Set<Duration> evaluationFrequencyOptions,
            Set<Duration> aggregationGranularityOptions,
            boolean skipMetricValidation,
            boolean checkWorkspaceAlertsStorageConfigured) {
        this.rules = List.copyOf(rules);
        Map<String, AlertRule> byId = new LinkedHashMap<>();
        rules.forEach(rule -> byId.put(rule.getId(), rule));
        this.rulesById = Collections.unmodifiableMap(byId);
        this.actionGroups = List.copyOf(actionGroups);
        this.severityLevels = Collections.unmodifiableMap(new LinkedHashMap<>(severityLevels));
        Map<Integer, List<String>> escalations = new LinkedHashMap<>();
        severityEscalations.forEach((severity, ids) -> escalations.put(severity, List.copyOf(ids)));
        this.severityEscalations = Collections.unmodifiableMap(escalations);
        this.evaluationFrequencyOptions = Collections.unmodifiableSet(new LinkedHashSet<>(evaluationFrequencyOptions));
        this.aggregationGranularityOptions = Collections.unmodifiableSet(
                new LinkedHashSet<>(aggregationGranularityOptions));
        this.skipMetricValidation = skipMetricValidation;
        this.checkWorkspaceAlertsStorageConfigured = checkWorkspaceAlertsStorageConfigured;
    }

    /**
     * @return rules in document order
     */
    public List<AlertRule> getRules() {
        return rules;
    }

    public Optional<AlertRule> rule(String ruleId) {
        return Optional.ofNullable(rulesById.get(ruleId));
    }

    public Set<String> ruleIds() {
        return rulesById.keySet();
    }

    public List<ActionGroup> getActionGroups() {
        return actionGroups;
    }

    public Map<Integer, String> getSeverityLevels() {
        return severityLevels;
    }

    /**
     * @param severity rule severity
     * @return configured label, or {@code Sev<n>} when none is configured
     */
    public String severityLabel(int severity) {
        return severityLevels.getOrDefault(severity, "Sev" + severity);
    }

    /**
     * @return severity to additional action group ids
     */
    public Map<Integer, List<String>> getSeverityEscalations() {
        return severityEscalations;
    }

    public Set<Duration> getEvaluationFrequencyOptions() {
        return evaluationFrequencyOptions;
    }

    public Set<Duration> getAggregationGranularityOptions() {
        return aggregationGranularityOptions;
    }

    /**
     * Provisioning flag carried through from {@code commonSettings}; no engine
     * behavior depends on it.
     */
    public boolean isSkipMetricValidation() {
        return skipMetricValidation;
    }

    /**
     * Provisioning flag carried through from {@code commonSettings}; no engine
     * behavior depends on it.
     */
    public boolean isCheckWorkspaceAlertsStorageConfigured() {
        return checkWorkspaceAlertsStorageConfigured;
    }

    /**
     * Empty configuration: no rules, no action groups, default options.
     *
     * @return configuration that activates nothing
     */
    public static EngineConfig empty() {
        return new EngineConfig(new ArrayList<>(), new ArrayList<>(),
                ConfigValidator.DEFAULT_SEVERITY_LEVELS, Map.of(),
                ConfigValidator.DEFAULT_FREQUENCY_OPTIONS, ConfigValidator.DEFAULT_GRANULARITY_OPTIONS,
                false, false);
    }

    @Override
    public String toString() {
        return "EngineConfig{" +
                "rules=" + rulesById.keySet() +
                ", actionGroups=" + actionGroups.size() +
                ", severityEscalations=" + severityEscalations +
                '}';
    }
}
