package com.alertwarden.core.evaluation;

import com.alertwarden.core.model.Aggregation;

import java.time.Duration;

/**
 * Telemetry backend the engine pulls aggregate values from.
 *
 * <p>
 * The engine never computes aggregates itself: percentiles, ratios, counts and
 * averages over the window are the backend's job. Implementations may block;
 * the engine bounds every call with the telemetry timeout.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface TelemetrySource {

    /**
     * Aggregate the series identified by {@code conditionQuery} over the
     * trailing {@code window}.
     *
     * @param conditionQuery opaque query handle from the rule
     * @param aggregation    aggregate to compute
     * @param window         trailing window size
     * @return the aggregate value
     * @throws EvaluationException if the backend is unavailable, has no data or
     *                             returns a malformed result
     */
    double queryAggregate(String conditionQuery, Aggregation aggregation, Duration window)
            throws EvaluationException;
}
