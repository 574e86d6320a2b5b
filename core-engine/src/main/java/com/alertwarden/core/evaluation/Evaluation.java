package com.alertwarden.core.evaluation;

import java.time.Instant;
import java.util.Objects;

/**
 * Result of evaluating one rule once.
 *
 * <p>
 * {@code value} is present for {@link EvaluationOutcome#BREACH} and
 * {@link EvaluationOutcome#CLEAR}; {@code error} is present for
 * {@link EvaluationOutcome#ERROR}.
 * </p>
 *
 * @since 1.0.0
 */
public final class Evaluation {

    private final String ruleId;
    private final EvaluationOutcome outcome;
    private final Double value;
    private final EvaluationException error;
    private final Instant evaluatedAt;

    private Evaluation(String ruleId, EvaluationOutcome outcome, Double value, EvaluationException error,
            Instant evaluatedAt) {
        this.ruleId = Objects.requireNonNull(ruleId, "ruleId must not be null");
        this.outcome = outcome;
        this.value = value;
        this.error = error;
        this.evaluatedAt = Objects.requireNonNull(evaluatedAt, "evaluatedAt must not be null");
    }

    public static Evaluation breach(String ruleId, double value, Instant evaluatedAt) {
        return new Evaluation(ruleId, EvaluationOutcome.BREACH, value, null, evaluatedAt);
    }

    public static Evaluation clear(String ruleId, double value, Instant evaluatedAt) {
        return new Evaluation(ruleId, EvaluationOutcome.CLEAR, value, null, evaluatedAt);
    }

    public static Evaluation error(String ruleId, EvaluationException error, Instant evaluatedAt) {
        return new Evaluation(ruleId, EvaluationOutcome.ERROR, null,
                Objects.requireNonNull(error, "error must not be null"), evaluatedAt);
    }

    public String getRuleId() {
        return ruleId;
    }

    public EvaluationOutcome getOutcome() {
        return outcome;
    }

    public Double getValue() {
        return value;
    }

    public EvaluationException getError() {
        return error;
    }

    public Instant getEvaluatedAt() {
        return evaluatedAt;
    }

    public boolean isError() {
        return outcome == EvaluationOutcome.ERROR;
    }

    @Override
    public String toString() {
        return "Evaluation{" +
                "ruleId='" + ruleId + '\'' +
                ", outcome=" + outcome +
                (value != null ? ", value=" + value : "") +
                (error != null ? ", error=" + error.getReason() + ": " + error.getMessage() : "") +
                ", evaluatedAt=" + evaluatedAt +
                '}';
    }
}
