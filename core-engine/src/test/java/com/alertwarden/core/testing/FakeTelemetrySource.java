package com.alertwarden.core.testing;

import com.alertwarden.core.evaluation.EvaluationException;
import com.alertwarden.core.evaluation.TelemetrySource;
import com.alertwarden.core.model.Aggregation;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Scripted telemetry backend. Queued answers are consumed first; after that
 * the sticky answer for the query is returned.
 */
public class FakeTelemetrySource implements TelemetrySource {

    private final Map<String, Deque<Object>> queued = new ConcurrentHashMap<>();
    private final Map<String, Object> sticky = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();

    /** Always answer {@code value} for the query. */
    public FakeTelemetrySource value(String query, double value) {
        sticky.put(query, value);
        return this;
    }

    /** Always fail the query. */
    public FakeTelemetrySource failing(String query, EvaluationException.Reason reason) {
        sticky.put(query, new EvaluationException(reason, "scripted " + reason));
        return this;
    }

    /** Answer these values, in order, before falling back to the sticky answer. */
    public FakeTelemetrySource then(String query, double... values) {
        Deque<Object> deque = queued.computeIfAbsent(query, q -> new ArrayDeque<>());
        synchronized (deque) {
            for (double value : values) {
                deque.addLast(value);
            }
        }
        return this;
    }

    public int calls(String query) {
        AtomicInteger count = calls.get(query);
        return count == null ? 0 : count.get();
    }

    @Override
    public double queryAggregate(String conditionQuery, Aggregation aggregation, Duration window)
            throws EvaluationException {
        calls.computeIfAbsent(conditionQuery, q -> new AtomicInteger()).incrementAndGet();
        Object answer = null;
        Deque<Object> deque = queued.get(conditionQuery);
        if (deque != null) {
            synchronized (deque) {
                answer = deque.pollFirst();
            }
        }
        if (answer == null) {
            answer = sticky.get(conditionQuery);
        }
        if (answer == null) {
            throw new EvaluationException(EvaluationException.Reason.NO_DATA, "no data for " + conditionQuery);
        }
        if (answer instanceof EvaluationException e) {
            throw e;
        }
        return (Double) answer;
    }
}
