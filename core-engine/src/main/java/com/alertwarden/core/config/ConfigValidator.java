package com.alertwarden.core.config;

import com.alertwarden.core.config.ConfigDocument.ActionGroupDefinition;
import com.alertwarden.core.config.ConfigDocument.AlertConfiguration;
import com.alertwarden.core.config.ConfigDocument.CommonSettings;
import com.alertwarden.core.config.ConfigDocument.RuleDefinition;
import com.alertwarden.core.model.ActionGroup;
import com.alertwarden.core.model.Aggregation;
import com.alertwarden.core.model.AlertRule;
import com.alertwarden.core.model.ComparisonOperator;
import com.alertwarden.core.model.EmailReceiver;
import com.alertwarden.core.model.RoleReceiver;
import com.alertwarden.core.model.SmsReceiver;
import com.alertwarden.core.model.WebhookReceiver;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeMap;

/**
 * Turns a raw {@link ConfigDocument} into a validated {@link EngineConfig}.
 *
 * <p>
 * Validation is all-or-nothing: every problem in the document is collected
 * and reported in a single {@link ConfigException}; nothing is returned unless
 * the whole document is valid.
 * </p>
 *
 * <h3>Checks</h3>
 * <ul>
 * <li>action group ids and short names are unique, short names are at most 12
 * characters, every receiver is well-formed</li>
 * <li>severity levels and escalation keys are in [0, 4]; escalation targets
 * exist</li>
 * <li>rules are individually valid ({@link AlertRule.Builder#build()}), have
 * unique ids, use an enumerated frequency and window, and reference only
 * existing action groups</li>
 * </ul>
 *
 * @since 1.0.0
 */
public final class ConfigValidator {

    static final Map<Integer, String> DEFAULT_SEVERITY_LEVELS = Map.of(
            0, "Critical",
            1, "Error",
            2, "Warning",
            3, "Informational",
            4, "Verbose");

    static final Set<Duration> DEFAULT_FREQUENCY_OPTIONS = orderedSet(
            Duration.ofMinutes(1), Duration.ofMinutes(5), Duration.ofMinutes(10),
            Duration.ofMinutes(15), Duration.ofMinutes(30), Duration.ofHours(1));

    static final Set<Duration> DEFAULT_GRANULARITY_OPTIONS = orderedSet(
            Duration.ofMinutes(1), Duration.ofMinutes(5), Duration.ofMinutes(10),
            Duration.ofMinutes(15), Duration.ofMinutes(30), Duration.ofHours(1),
            Duration.ofHours(6), Duration.ofHours(12), Duration.ofHours(24));

    private ConfigValidator() {
        // utility class - not instantiable
    }

    /**
     * Validate the document.
     *
     * @param document raw document; must not be {@code null}
     * @return validated configuration
     * @throws ConfigException listing every problem when the document is invalid
     */
    public static EngineConfig validate(ConfigDocument document) {
        Objects.requireNonNull(document, "Config document must not be null");
        List<String> errors = new ArrayList<>();

        Map<String, ActionGroup> groups = toActionGroups(document.getActionGroups(), errors);

        AlertConfiguration block = document.getAlertConfiguration() != null
                ? document.getAlertConfiguration()
                : new AlertConfiguration();
        CommonSettings common = block.getCommonSettings();

        Map<Integer, String> severityLevels = toSeverityLevels(block.getSeverityLevels(), errors);
        Set<Duration> frequencies = toDurations(block.getEvaluationFrequencyOptions(),
                "evaluationFrequencyOptions", DEFAULT_FREQUENCY_OPTIONS, errors);
        Set<Duration> granularities = toDurations(block.getAggregationGranularityOptions(),
                "aggregationGranularityOptions", DEFAULT_GRANULARITY_OPTIONS, errors);
        Map<Integer, List<String>> escalations = toEscalations(block.getSeverityEscalations(), groups, errors);

        List<AlertRule> rules = new ArrayList<>();
        Set<String> ruleIds = new HashSet<>();
        List<RuleDefinition> definitions = block.getRules();
        for (int i = 0; i < definitions.size(); i++) {
            RuleDefinition definition = definitions.get(i);
            if (definition == null) {
                errors.add("Rule at index " + i + " is null");
                continue;
            }
            AlertRule rule = toRule(definition, common, errors);
            if (rule == null) {
                continue;
            }
            if (!ruleIds.add(rule.getId())) {
                errors.add("Duplicate rule id '" + rule.getId() + "'");
                continue;
            }
            if (!frequencies.contains(rule.getEvaluationFrequency())) {
                errors.add("Rule '" + rule.getId() + "' evaluationFrequency " + rule.getEvaluationFrequency()
                        + " is not one of the evaluationFrequencyOptions " + frequencies);
            }
            if (!granularities.contains(rule.getWindowSize())) {
                errors.add("Rule '" + rule.getId() + "' windowSize " + rule.getWindowSize()
                        + " is not one of the aggregationGranularityOptions " + granularities);
            }
            for (String ref : rule.getActionGroupRefs()) {
                if (!groups.containsKey(ref)) {
                    errors.add("Rule '" + rule.getId() + "' references unknown action group '" + ref + "'");
                }
            }
            rules.add(rule);
        }

        if (!errors.isEmpty()) {
            throw new ConfigException(errors);
        }

        return new EngineConfig(rules, new ArrayList<>(groups.values()), severityLevels, escalations,
                frequencies, granularities, common.isSkipMetricValidation(),
                common.isCheckWorkspaceAlertsStorageConfigured());
    }

    // ---------------------------------------------------------------
    // Action groups
    // ---------------------------------------------------------------

    private static Map<String, ActionGroup> toActionGroups(List<ActionGroupDefinition> definitions,
            List<String> errors) {
        Map<String, ActionGroup> groups = new LinkedHashMap<>();
        Map<String, String> shortNames = new LinkedHashMap<>();

        for (int i = 0; i < definitions.size(); i++) {
            ActionGroupDefinition definition = definitions.get(i);
            String id = definition == null ? null
                    : definition.getId() != null ? definition.getId() : definition.getName();
            if (id == null || id.isBlank()) {
                errors.add("Action group at index " + i + " requires an 'id' or 'name'");
                continue;
            }
            if (groups.containsKey(id)) {
                errors.add("Duplicate action group id '" + id + "'");
                continue;
            }

            ActionGroup.Builder builder = ActionGroup.builder(id)
                    .name(definition.getName())
                    .shortName(definition.getShortName());
            ConfigDocument.ReceiversDefinition receivers = definition.getReceivers();
            receivers.getEmailReceivers().forEach(r -> builder.receiver(
                    new EmailReceiver(r.getName(), r.getEmailAddress())));
            receivers.getSmsReceivers().forEach(r -> builder.receiver(
                    new SmsReceiver(r.getName(), r.getCountryCode(), r.getPhoneNumber())));
            receivers.getWebhookReceivers().forEach(r -> builder.receiver(
                    new WebhookReceiver(r.getName(), r.getServiceUri(), r.isUseCommonAlertSchema())));
            receivers.getArmRoleReceivers().forEach(r -> builder.receiver(
                    new RoleReceiver(r.getName(), r.getRoleId())));
            ActionGroup group = builder.build();

            errors.addAll(group.problems());
            if (group.getShortName() != null) {
                String key = group.getShortName().toLowerCase(Locale.ROOT);
                String owner = shortNames.putIfAbsent(key, id);
                if (owner != null) {
                    errors.add("Action group '" + id + "' shortName '" + group.getShortName()
                            + "' collides with action group '" + owner + "'");
                }
            }
            groups.put(id, group);
        }
        return groups;
    }

    // ---------------------------------------------------------------
    // Enumerations
    // ---------------------------------------------------------------

    private static Map<Integer, String> toSeverityLevels(Map<?, ?> raw, List<String> errors) {
        Map<Integer, String> levels = new TreeMap<>(DEFAULT_SEVERITY_LEVELS);
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            Integer severity = toSeverity(entry.getKey(), "severityLevels", errors);
            if (severity == null) {
                continue;
            }
            Object label = entry.getValue();
            if (label == null || label.toString().isBlank()) {
                errors.add("severityLevels entry " + severity + " requires a label");
                continue;
            }
            levels.put(severity, label.toString());
        }
        return levels;
    }

    private static Map<Integer, List<String>> toEscalations(Map<?, ?> raw, Map<String, ActionGroup> groups,
            List<String> errors) {
        Map<Integer, List<String>> escalations = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : raw.entrySet()) {
            Integer severity = toSeverity(entry.getKey(), "severityEscalations", errors);
            if (severity == null) {
                continue;
            }
            if (!(entry.getValue() instanceof List<?> ids)) {
                errors.add("severityEscalations entry " + severity + " must be a list of action group ids");
                continue;
            }
            List<String> targets = new ArrayList<>();
            for (Object id : ids) {
                String groupId = String.valueOf(id);
                if (!groups.containsKey(groupId)) {
                    errors.add("severityEscalations entry " + severity
                            + " references unknown action group '" + groupId + "'");
                } else {
                    targets.add(groupId);
                }
            }
            escalations.put(severity, targets);
        }
        return escalations;
    }

    private static Integer toSeverity(Object key, String field, List<String> errors) {
        try {
            int severity = Integer.parseInt(String.valueOf(key).trim());
            if (severity < AlertRule.MIN_SEVERITY || severity > AlertRule.MAX_SEVERITY) {
                errors.add(field + " key " + severity + " is outside [" + AlertRule.MIN_SEVERITY + ", "
                        + AlertRule.MAX_SEVERITY + "]");
                return null;
            }
            return severity;
        } catch (NumberFormatException e) {
            errors.add(field + " key '" + key + "' is not a severity number");
            return null;
        }
    }

    private static Set<Duration> toDurations(List<?> raw, String field, Set<Duration> defaults,
            List<String> errors) {
        if (raw.isEmpty()) {
            return defaults;
        }
        Set<Duration> options = new LinkedHashSet<>();
        for (Object value : raw) {
            Duration duration = parseDuration(String.valueOf(value), field, errors);
            if (duration != null) {
                options.add(duration);
            }
        }
        return options;
    }

    // ---------------------------------------------------------------
    // Rules
    // ---------------------------------------------------------------

    private static AlertRule toRule(RuleDefinition definition, CommonSettings common, List<String> errors) {
        String label = definition.getId() != null ? definition.getId() : definition.getName();
        int before = errors.size();

        AlertRule.Builder builder = AlertRule.builder(definition.getId() != null
                        ? definition.getId()
                        : definition.getName())
                .name(definition.getName())
                .description(definition.getDescription())
                .conditionQuery(definition.getConditionQuery())
                .enabled(definition.getEnabled() != null ? definition.getEnabled() : common.isEnabled())
                .autoMitigate(definition.getAutoMitigate() != null
                        ? definition.getAutoMitigate()
                        : common.isAutoMitigate())
                .actionGroupRefs(definition.getActionGroups());

        if (definition.getAggregation() != null) {
            try {
                builder.aggregation(Aggregation.parse(definition.getAggregation()));
            } catch (IllegalArgumentException e) {
                errors.add("Rule '" + label + "': " + e.getMessage());
            }
        }
        if (definition.getOperator() != null) {
            try {
                builder.comparator(ComparisonOperator.parse(definition.getOperator()));
            } catch (IllegalArgumentException e) {
                errors.add("Rule '" + label + "': " + e.getMessage());
            }
        }
        if (definition.getThreshold() != null) {
            builder.threshold(definition.getThreshold());
        } else {
            errors.add("Rule '" + label + "' requires a 'threshold'");
        }
        if (definition.getEvaluationFrequency() != null) {
            builder.evaluationFrequency(parseDuration(definition.getEvaluationFrequency(),
                    "Rule '" + label + "' evaluationFrequency", errors));
        }
        if (definition.getWindowSize() != null) {
            builder.windowSize(parseDuration(definition.getWindowSize(), "Rule '" + label + "' windowSize", errors));
        }
        if (definition.getSeverity() != null) {
            builder.severity(definition.getSeverity());
        }
        if (definition.getConsecutiveBreachesToFire() != null) {
            builder.consecutiveBreachesToFire(definition.getConsecutiveBreachesToFire());
        }
        if (definition.getConsecutiveClearsToResolve() != null) {
            builder.consecutiveClearsToResolve(definition.getConsecutiveClearsToResolve());
        }

        if (errors.size() > before) {
            return null;
        }
        try {
            return builder.build();
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
            return null;
        }
    }

    private static Duration parseDuration(String text, String field, List<String> errors) {
        try {
            return Duration.parse(text.trim());
        } catch (DateTimeParseException e) {
            errors.add(field + " '" + text + "' is not an ISO-8601 duration (e.g. PT5M)");
            return null;
        }
    }

    private static Set<Duration> orderedSet(Duration... durations) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(List.of(durations)));
    }
}
