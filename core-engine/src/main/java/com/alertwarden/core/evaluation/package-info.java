/**
 * Condition evaluation against the telemetry backend.
 *
 * <p>
 * {@link com.alertwarden.core.evaluation.ConditionEvaluator} is comparator-only:
 * aggregation happens in the
 * {@link com.alertwarden.core.evaluation.TelemetrySource}. Failed pulls are
 * reported as errors, never as clears, and are tracked per rule by
 * {@link com.alertwarden.core.evaluation.RuleHealthTracker}.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertwarden.core.evaluation;
