package com.alertwarden.core.evaluation;

import com.alertwarden.core.model.AlertRule;
import com.alertwarden.core.model.ComparisonOperator;
import com.alertwarden.core.support.BoundedCall;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Condition evaluator.
 *
 * <p>
 * Pulls the rule's aggregate from the {@link TelemetrySource} and compares it
 * with the threshold. This is a <strong>stateless</strong> component: every
 * call is independent, and hysteresis lives in the alert state machine.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * A failed pull (backend error, timeout, non-finite result) produces an
 * {@link EvaluationOutcome#ERROR} evaluation rather than a clear. Whether that
 * counts for anything is decided downstream by the {@link MissingDataPolicy}.
 * </p>
 *
 * @since 1.0.0
 */
public class ConditionEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(ConditionEvaluator.class);

    private final TelemetrySource telemetrySource;
    private final Duration timeout;
    private final Executor callExecutor;
    private final Clock clock;

    /**
     * @param telemetrySource backend to pull from
     * @param timeout         per-call timeout
     * @param callExecutor    executor the blocking pull runs on
     * @param clock           source of evaluation timestamps
     */
    public ConditionEvaluator(TelemetrySource telemetrySource, Duration timeout, Executor callExecutor, Clock clock) {
        this.telemetrySource = Objects.requireNonNull(telemetrySource, "TelemetrySource must not be null");
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.callExecutor = Objects.requireNonNull(callExecutor, "callExecutor must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * Evaluate a rule once.
     *
     * @param rule rule to evaluate; must not be {@code null}
     * @return breach, clear or error
     */
    public Evaluation evaluate(AlertRule rule) {
        Objects.requireNonNull(rule, "AlertRule must not be null");
        Instant evaluatedAt = clock.instant();

        double value;
        try {
            value = pull(rule);
        } catch (EvaluationException e) {
            LOG.warn("Rule [{}]: telemetry pull failed ({}): {}", rule.getId(), e.getReason(), e.getMessage());
            return Evaluation.error(rule.getId(), e, evaluatedAt);
        }

        boolean breached = compare(value, rule.getComparator(), rule.getThreshold());
        LOG.debug("Rule [{}]: {}({}) = {} {} {} -> {}", rule.getId(), rule.getAggregation(),
                rule.getConditionQuery(), value, rule.getComparator(), rule.getThreshold(),
                breached ? "breach" : "clear");
        return breached
                ? Evaluation.breach(rule.getId(), value, evaluatedAt)
                : Evaluation.clear(rule.getId(), value, evaluatedAt);
    }

    /**
     * Exact numeric comparison.
     *
     * @param value      observed value
     * @param comparator comparator
     * @param threshold  threshold
     * @return {@code true} on breach
     */
    public static boolean compare(double value, ComparisonOperator comparator, double threshold) {
        return comparator.test(value, threshold);
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private double pull(AlertRule rule) throws EvaluationException {
        Double value;
        try {
            value = BoundedCall.call(
                    () -> telemetrySource.queryAggregate(rule.getConditionQuery(), rule.getAggregation(),
                            rule.getWindowSize()),
                    timeout, callExecutor);
        } catch (TimeoutException e) {
            throw new EvaluationException(EvaluationException.Reason.TIMEOUT,
                    "Telemetry query timed out after " + timeout.toMillis() + " ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof EvaluationException evaluationException) {
                throw evaluationException;
            }
            throw new EvaluationException(EvaluationException.Reason.UNAVAILABLE,
                    "Telemetry query failed: " + cause, cause);
        } catch (RejectedExecutionException e) {
            throw new EvaluationException(EvaluationException.Reason.UNAVAILABLE,
                    "Telemetry executor rejected the query", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new EvaluationException(EvaluationException.Reason.UNAVAILABLE,
                    "Interrupted while waiting for telemetry", e);
        }

        if (value == null || !Double.isFinite(value)) {
            throw new EvaluationException(EvaluationException.Reason.MALFORMED_RESULT,
                    "Telemetry returned a non-finite aggregate: " + value);
        }
        return value;
    }
}
