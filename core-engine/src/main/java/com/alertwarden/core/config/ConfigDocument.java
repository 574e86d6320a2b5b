package com.alertwarden.core.config;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw binding of the alerting configuration document (YAML or JSON).
 *
 * <p>
 * Expected structure:
 * </p>
 *
 * <pre>
 * actionGroups:
 *   - name: ops-team
 *     shortName: ops
 *     receivers:
 *       emailReceivers:   [{name: oncall, emailAddress: oncall@example.com}]
 *       smsReceivers:     [{name: pager, countryCode: "1", phoneNumber: "5551234567"}]
 *       webhookReceivers: [{name: chat, serviceUri: https://hooks.example.com/a, useCommonAlertSchema: true}]
 *       armRoleReceivers: [{name: owners, roleId: 8e3af657-a8ff-443c-a75c-2fe8c4bcb635}]
 * alertConfiguration:
 *   commonSettings: {enabled: true, autoMitigate: true, skipMetricValidation: false}
 *   severityLevels: {0: Critical, 1: Error, 2: Warning, 3: Informational, 4: Verbose}
 *   evaluationFrequencyOptions: [PT1M, PT5M]
 *   aggregationGranularityOptions: [PT5M, PT15M]
 *   severityEscalations: {0: [escalation]}
 *   rules:
 *     - id: high-latency
 *       conditionQuery: requests/duration
 *       aggregation: p95
 *       operator: "&gt;"
 *       threshold: 2000
 *       evaluationFrequency: PT1M
 *       windowSize: PT5M
 *       severity: 1
 *       actionGroups: [ops-team]
 * </pre>
 *
 * <p>
 * The classes here hold the document as written; nothing is validated until
 * {@link ConfigValidator#validate(ConfigDocument)} turns it into an
 * {@link EngineConfig}.
 * </p>
 *
 * @since 1.0.0
 */
public class ConfigDocument {

    private List<ActionGroupDefinition> actionGroups = new ArrayList<>();
    private AlertConfiguration alertConfiguration;

    public List<ActionGroupDefinition> getActionGroups() {
        return actionGroups;
    }

    public void setActionGroups(List<ActionGroupDefinition> actionGroups) {
        this.actionGroups = actionGroups != null ? new ArrayList<>(actionGroups) : new ArrayList<>();
    }

    public AlertConfiguration getAlertConfiguration() {
        return alertConfiguration;
    }

    public void setAlertConfiguration(AlertConfiguration alertConfiguration) {
        this.alertConfiguration = alertConfiguration;
    }

    // ---------------------------------------------------------------
    // Action groups
    // ---------------------------------------------------------------

    /** One entry of {@code actionGroups}. {@code id} defaults to {@code name}. */
    public static class ActionGroupDefinition {
        private String id;
        private String name;
        private String shortName;
        private ReceiversDefinition receivers = new ReceiversDefinition();

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getShortName() {
            return shortName;
        }

        public void setShortName(String shortName) {
            this.shortName = shortName;
        }

        public ReceiversDefinition getReceivers() {
            return receivers;
        }

        public void setReceivers(ReceiversDefinition receivers) {
            this.receivers = receivers != null ? receivers : new ReceiversDefinition();
        }
    }

    /** The {@code receivers} object of an action group, one array per variant. */
    public static class ReceiversDefinition {
        private List<EmailReceiverDefinition> emailReceivers = new ArrayList<>();
        private List<SmsReceiverDefinition> smsReceivers = new ArrayList<>();
        private List<WebhookReceiverDefinition> webhookReceivers = new ArrayList<>();
        private List<RoleReceiverDefinition> armRoleReceivers = new ArrayList<>();

        public List<EmailReceiverDefinition> getEmailReceivers() {
            return emailReceivers;
        }

        public void setEmailReceivers(List<EmailReceiverDefinition> emailReceivers) {
            this.emailReceivers = emailReceivers != null ? emailReceivers : new ArrayList<>();
        }

        public List<SmsReceiverDefinition> getSmsReceivers() {
            return smsReceivers;
        }

        public void setSmsReceivers(List<SmsReceiverDefinition> smsReceivers) {
            this.smsReceivers = smsReceivers != null ? smsReceivers : new ArrayList<>();
        }

        public List<WebhookReceiverDefinition> getWebhookReceivers() {
            return webhookReceivers;
        }

        public void setWebhookReceivers(List<WebhookReceiverDefinition> webhookReceivers) {
            this.webhookReceivers = webhookReceivers != null ? webhookReceivers : new ArrayList<>();
        }

        public List<RoleReceiverDefinition> getArmRoleReceivers() {
            return armRoleReceivers;
        }

        public void setArmRoleReceivers(List<RoleReceiverDefinition> armRoleReceivers) {
            this.armRoleReceivers = armRoleReceivers != null ? armRoleReceivers : new ArrayList<>();
        }
    }

    public static class EmailReceiverDefinition {
        private String name;
        private String emailAddress;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getEmailAddress() {
            return emailAddress;
        }

        public void setEmailAddress(String emailAddress) {
            this.emailAddress = emailAddress;
        }
    }

    public static class SmsReceiverDefinition {
        private String name;
        private String countryCode;
        private String phoneNumber;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getCountryCode() {
            return countryCode;
        }

        public void setCountryCode(String countryCode) {
            this.countryCode = countryCode;
        }

        public String getPhoneNumber() {
            return phoneNumber;
        }

        public void setPhoneNumber(String phoneNumber) {
            this.phoneNumber = phoneNumber;
        }
    }

    public static class WebhookReceiverDefinition {
        private String name;
        private String serviceUri;
        private boolean useCommonAlertSchema;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getServiceUri() {
            return serviceUri;
        }

        public void setServiceUri(String serviceUri) {
            this.serviceUri = serviceUri;
        }

        public boolean isUseCommonAlertSchema() {
            return useCommonAlertSchema;
        }

        public void setUseCommonAlertSchema(boolean useCommonAlertSchema) {
            this.useCommonAlertSchema = useCommonAlertSchema;
        }
    }

    public static class RoleReceiverDefinition {
        private String name;
        private String roleId;

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getRoleId() {
            return roleId;
        }

        public void setRoleId(String roleId) {
            this.roleId = roleId;
        }
    }

    // ---------------------------------------------------------------
    // Rule configuration block
    // ---------------------------------------------------------------

    /** The {@code alertConfiguration} block. */
    public static class AlertConfiguration {
        private CommonSettings commonSettings = new CommonSettings();
        private Map<Integer, String> severityLevels = new LinkedHashMap<>();
        private List<String> evaluationFrequencyOptions = new ArrayList<>();
        private List<String> aggregationGranularityOptions = new ArrayList<>();
        private Map<Integer, List<String>> severityEscalations = new LinkedHashMap<>();
        private List<RuleDefinition> rules = new ArrayList<>();

        public CommonSettings getCommonSettings() {
            return commonSettings;
        }

        public void setCommonSettings(CommonSettings commonSettings) {
            this.commonSettings = commonSettings != null ? commonSettings : new CommonSettings();
        }

        public Map<Integer, String> getSeverityLevels() {
            return severityLevels;
        }

        public void setSeverityLevels(Map<Integer, String> severityLevels) {
            this.severityLevels = severityLevels != null ? severityLevels : new LinkedHashMap<>();
        }

        public List<String> getEvaluationFrequencyOptions() {
            return evaluationFrequencyOptions;
        }

        public void setEvaluationFrequencyOptions(List<String> evaluationFrequencyOptions) {
            this.evaluationFrequencyOptions = evaluationFrequencyOptions != null
                    ? evaluationFrequencyOptions
                    : new ArrayList<>();
        }

        public List<String> getAggregationGranularityOptions() {
            return aggregationGranularityOptions;
        }

        public void setAggregationGranularityOptions(List<String> aggregationGranularityOptions) {
            this.aggregationGranularityOptions = aggregationGranularityOptions != null
                    ? aggregationGranularityOptions
                    : new ArrayList<>();
        }

        public Map<Integer, List<String>> getSeverityEscalations() {
            return severityEscalations;
        }

        public void setSeverityEscalations(Map<Integer, List<String>> severityEscalations) {
            this.severityEscalations = severityEscalations != null ? severityEscalations : new LinkedHashMap<>();
        }

        public List<RuleDefinition> getRules() {
            return rules;
        }

        public void setRules(List<RuleDefinition> rules) {
            this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
        }
    }

    /**
     * Defaults applied to every rule that does not set the value itself.
     * {@code skipMetricValidation} and {@code checkWorkspaceAlertsStorageConfigured}
     * are carried through untouched.
     */
    public static class CommonSettings {
        private boolean enabled = true;
        private boolean autoMitigate = true;
        private boolean skipMetricValidation;
        private boolean checkWorkspaceAlertsStorageConfigured;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public boolean isAutoMitigate() {
            return autoMitigate;
        }

        public void setAutoMitigate(boolean autoMitigate) {
            this.autoMitigate = autoMitigate;
        }

        public boolean isSkipMetricValidation() {
            return skipMetricValidation;
        }

        public void setSkipMetricValidation(boolean skipMetricValidation) {
            this.skipMetricValidation = skipMetricValidation;
        }

        public boolean isCheckWorkspaceAlertsStorageConfigured() {
            return checkWorkspaceAlertsStorageConfigured;
        }

        public void setCheckWorkspaceAlertsStorageConfigured(boolean checkWorkspaceAlertsStorageConfigured) {
            this.checkWorkspaceAlertsStorageConfigured = checkWorkspaceAlertsStorageConfigured;
        }
    }

    /** One entry of {@code alertConfiguration.rules}. Durations are ISO-8601. */
    public static class RuleDefinition {
        private String id;
        private String name;
        private String description;
        private String conditionQuery;
        private String aggregation;
        private String operator;
        private Double threshold;
        private String evaluationFrequency;
        private String windowSize;
        private Integer severity;
        private Boolean enabled;
        private Boolean autoMitigate;
        private Integer consecutiveBreachesToFire;
        private Integer consecutiveClearsToResolve;
        private List<String> actionGroups = new ArrayList<>();

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getDescription() {
            return description;
        }

        public void setDescription(String description) {
            this.description = description;
        }

        public String getConditionQuery() {
            return conditionQuery;
        }

        public void setConditionQuery(String conditionQuery) {
            this.conditionQuery = conditionQuery;
        }

        public String getAggregation() {
            return aggregation;
        }

        public void setAggregation(String aggregation) {
            this.aggregation = aggregation;
        }

        public String getOperator() {
            return operator;
        }

        public void setOperator(String operator) {
            this.operator = operator;
        }

        public Double getThreshold() {
            return threshold;
        }

        public void setThreshold(Double threshold) {
            this.threshold = threshold;
        }

        public String getEvaluationFrequency() {
            return evaluationFrequency;
        }

        public void setEvaluationFrequency(String evaluationFrequency) {
            this.evaluationFrequency = evaluationFrequency;
        }

        public String getWindowSize() {
            return windowSize;
        }

        public void setWindowSize(String windowSize) {
            this.windowSize = windowSize;
        }

        public Integer getSeverity() {
            return severity;
        }

        public void setSeverity(Integer severity) {
            this.severity = severity;
        }

        public Boolean getEnabled() {
            return enabled;
        }

        public void setEnabled(Boolean enabled) {
            this.enabled = enabled;
        }

        public Boolean getAutoMitigate() {
            return autoMitigate;
        }

        public void setAutoMitigate(Boolean autoMitigate) {
            this.autoMitigate = autoMitigate;
        }

        public Integer getConsecutiveBreachesToFire() {
            return consecutiveBreachesToFire;
        }

        public void setConsecutiveBreachesToFire(Integer consecutiveBreachesToFire) {
            this.consecutiveBreachesToFire = consecutiveBreachesToFire;
        }

        public Integer getConsecutiveClearsToResolve() {
            return consecutiveClearsToResolve;
        }

        public void setConsecutiveClearsToResolve(Integer consecutiveClearsToResolve) {
            this.consecutiveClearsToResolve = consecutiveClearsToResolve;
        }

        public List<String> getActionGroups() {
            return actionGroups;
        }

        public void setActionGroups(List<String> actionGroups) {
            this.actionGroups = actionGroups != null ? actionGroups : new ArrayList<>();
        }
    }
}
