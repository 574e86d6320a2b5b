package com.alertwarden.core.model;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A named alert condition: {@code aggregation(conditionQuery, windowSize)
 * <comparator> threshold}, evaluated every {@code evaluationFrequency}.
 *
 * <p>
 * Instances are immutable and validated on {@link Builder#build()}. A new
 * configuration version produces new instances; the state machine keys its
 * lifecycle on {@link #getId()} only, so a rule keeps its alert state across
 * reloads as long as its id is unchanged.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertRule {

    /** Most critical severity. */
    public static final int MIN_SEVERITY = 0;

    /** Least critical severity. */
    public static final int MAX_SEVERITY = 4;

    private final String id;
    private final String name;
    private final String description;
    private final String conditionQuery;
    private final Aggregation aggregation;
    private final ComparisonOperator comparator;
    private final double threshold;
    private final Duration evaluationFrequency;
    private final Duration windowSize;
    private final int severity;
    private final boolean enabled;
    private final boolean autoMitigate;
    private final int consecutiveBreachesToFire;
    private final int consecutiveClearsToResolve;
    private final Set<String> actionGroupRefs;

    private AlertRule(Builder b) {
        this.id = b.id;
        this.name = b.name != null && !b.name.isBlank() ? b.name : b.id;
        this.description = b.description;
        this.conditionQuery = b.conditionQuery;
        this.aggregation = b.aggregation;
        this.comparator = b.comparator;
        this.threshold = b.threshold;
        this.evaluationFrequency = b.evaluationFrequency;
        this.windowSize = b.windowSize;
        this.severity = b.severity;
        this.enabled = b.enabled;
        this.autoMitigate = b.autoMitigate;
        this.consecutiveBreachesToFire = b.consecutiveBreachesToFire;
        this.consecutiveClearsToResolve = b.consecutiveClearsToResolve;
        this.actionGroupRefs = Collections.unmodifiableSet(new LinkedHashSet<>(b.actionGroupRefs));
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder(String id) {
        return new Builder().id(id);
    }

    /**
     * @return a builder pre-populated with this rule's values
     */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .description(description)
                .conditionQuery(conditionQuery)
                .aggregation(aggregation)
                .comparator(comparator)
                .threshold(threshold)
                .evaluationFrequency(evaluationFrequency)
                .windowSize(windowSize)
                .severity(severity)
                .enabled(enabled)
                .autoMitigate(autoMitigate)
                .consecutiveBreachesToFire(consecutiveBreachesToFire)
                .consecutiveClearsToResolve(consecutiveClearsToResolve)
                .actionGroupRefs(actionGroupRefs);
    }

    /**
     * Fluent builder for {@link AlertRule}.
     *
     * <p>
     * {@link #build()} checks every field and reports all problems at once in
     * the exception message.
     * </p>
     */
    public static class Builder {
        private String id;
        private String name;
        private String description;
        private String conditionQuery;
        private Aggregation aggregation;
        private ComparisonOperator comparator;
        private double threshold;
        private Duration evaluationFrequency;
        private Duration windowSize;
        private int severity = 3;
        private boolean enabled = true;
        private boolean autoMitigate = true;
        private int consecutiveBreachesToFire = 1;
        private int consecutiveClearsToResolve = 1;
        private final Set<String> actionGroupRefs = new LinkedHashSet<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder conditionQuery(String conditionQuery) {
            this.conditionQuery = conditionQuery;
            return this;
        }

        public Builder aggregation(Aggregation aggregation) {
            this.aggregation = aggregation;
            return this;
        }

        public Builder comparator(ComparisonOperator comparator) {
            this.comparator = comparator;
            return this;
        }

        public Builder threshold(double threshold) {
            this.threshold = threshold;
            return this;
        }

        public Builder evaluationFrequency(Duration evaluationFrequency) {
            this.evaluationFrequency = evaluationFrequency;
            return this;
        }

        public Builder windowSize(Duration windowSize) {
            this.windowSize = windowSize;
            return this;
        }

        public Builder severity(int severity) {
            this.severity = severity;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder autoMitigate(boolean autoMitigate) {
            this.autoMitigate = autoMitigate;
            return this;
        }

        public Builder consecutiveBreachesToFire(int consecutiveBreachesToFire) {
            this.consecutiveBreachesToFire = consecutiveBreachesToFire;
            return this;
        }

        public Builder consecutiveClearsToResolve(int consecutiveClearsToResolve) {
            this.consecutiveClearsToResolve = consecutiveClearsToResolve;
            return this;
        }

        public Builder actionGroupRef(String actionGroupId) {
            this.actionGroupRefs.add(actionGroupId);
            return this;
        }

        public Builder actionGroupRefs(Collection<String> actionGroupIds) {
            this.actionGroupRefs.clear();
            this.actionGroupRefs.addAll(actionGroupIds);
            return this;
        }

        /**
         * Validate and build the rule.
         *
         * @return a new {@link AlertRule}
         * @throws IllegalArgumentException listing every invalid field
         */
        public AlertRule build() {
            List<String> errors = new ArrayList<>();
            String label = id != null ? id : "<no id>";

            if (id == null || id.isBlank()) {
                errors.add("Rule 'id' is required");
            }
            if (conditionQuery == null || conditionQuery.isBlank()) {
                errors.add("Rule '" + label + "' requires a 'conditionQuery'");
            }
            if (aggregation == null) {
                errors.add("Rule '" + label + "' requires an 'aggregation'");
            }
            if (comparator == null) {
                errors.add("Rule '" + label + "' requires an 'operator'");
            }
            if (!Double.isFinite(threshold)) {
                errors.add("Rule '" + label + "' requires a finite 'threshold'");
            }
            if (evaluationFrequency == null || evaluationFrequency.isZero() || evaluationFrequency.isNegative()) {
                errors.add("Rule '" + label + "' requires a positive 'evaluationFrequency'");
            }
            if (windowSize == null || windowSize.isZero() || windowSize.isNegative()) {
                errors.add("Rule '" + label + "' requires a positive 'windowSize'");
            } else if (evaluationFrequency != null && windowSize.compareTo(evaluationFrequency) < 0) {
                errors.add("Rule '" + label + "' windowSize " + windowSize
                        + " must not be shorter than evaluationFrequency " + evaluationFrequency);
            }
            if (severity < MIN_SEVERITY || severity > MAX_SEVERITY) {
                errors.add("Rule '" + label + "' severity must be in [" + MIN_SEVERITY + ", "
                        + MAX_SEVERITY + "], got: " + severity);
            }
            if (consecutiveBreachesToFire < 1) {
                errors.add("Rule '" + label + "' requires 'consecutiveBreachesToFire' >= 1");
            }
            if (consecutiveClearsToResolve < 1) {
                errors.add("Rule '" + label + "' requires 'consecutiveClearsToResolve' >= 1");
            }
            if (actionGroupRefs.isEmpty()) {
                errors.add("Rule '" + label + "' must reference at least one action group");
            } else if (actionGroupRefs.stream().anyMatch(ref -> ref == null || ref.isBlank())) {
                errors.add("Rule '" + label + "' has a blank action group reference");
            }

            if (!errors.isEmpty()) {
                throw new IllegalArgumentException(
                        "Invalid AlertRule: " + String.join("; ", errors));
            }
            return new AlertRule(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public String getConditionQuery() {
        return conditionQuery;
    }

    public Aggregation getAggregation() {
        return aggregation;
    }

    public ComparisonOperator getComparator() {
        return comparator;
    }

    public double getThreshold() {
        return threshold;
    }

    public Duration getEvaluationFrequency() {
        return evaluationFrequency;
    }

    public Duration getWindowSize() {
        return windowSize;
    }

    public int getSeverity() {
        return severity;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public boolean isAutoMitigate() {
        return autoMitigate;
    }

    public int getConsecutiveBreachesToFire() {
        return consecutiveBreachesToFire;
    }

    public int getConsecutiveClearsToResolve() {
        return consecutiveClearsToResolve;
    }

    /**
     * @return unmodifiable, insertion-ordered set of action group ids
     */
    public Set<String> getActionGroupRefs() {
        return actionGroupRefs;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertRule that))
            return false;
        return Double.compare(threshold, that.threshold) == 0
                && severity == that.severity
                && enabled == that.enabled
                && autoMitigate == that.autoMitigate
                && consecutiveBreachesToFire == that.consecutiveBreachesToFire
                && consecutiveClearsToResolve == that.consecutiveClearsToResolve
                && Objects.equals(id, that.id)
                && Objects.equals(name, that.name)
                && Objects.equals(conditionQuery, that.conditionQuery)
                && Objects.equals(aggregation, that.aggregation)
                && comparator == that.comparator
                && Objects.equals(evaluationFrequency, that.evaluationFrequency)
                && Objects.equals(windowSize, that.windowSize)
                && Objects.equals(actionGroupRefs, that.actionGroupRefs);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, conditionQuery, aggregation, comparator, threshold, evaluationFrequency);
    }

    @Override
    public String toString() {
        return "AlertRule{" +
                "id='" + id + '\'' +
                ", condition=" + aggregation + "(" + conditionQuery + ", " + windowSize + ") "
                + comparator + " " + threshold +
                ", every=" + evaluationFrequency +
                ", severity=" + severity +
                ", enabled=" + enabled +
                ", autoMitigate=" + autoMitigate +
                ", actionGroups=" + actionGroupRefs +
                '}';
    }
}
