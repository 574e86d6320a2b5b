package com.alertwarden.core.scheduling;

import com.alertwarden.core.metrics.EngineMetrics;
import com.alertwarden.core.model.AlertRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Periodic rule scheduler.
 *
 * <p>
 * Keeps a next-due timestamp per rule. Every {@link #tick()} submits the
 * enabled rules that are due to the worker pool.
 * </p>
 *
 * <h3>Single flight</h3>
 * <p>
 * A rule still being evaluated when it comes due again is not queued a second
 * time: that tick is skipped and its next-due timestamp moves one frequency
 * interval forward. A slow telemetry backend therefore slows evaluation down
 * instead of growing the queue.
 * </p>
 *
 * <h3>Jitter</h3>
 * <p>
 * When a run finishes the next due time is {@code start + frequency * (1 + j)}
 * with {@code j} uniform in {@code [-jitterRatio, +jitterRatio]}, so rules
 * sharing a frequency drift apart.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleScheduler {

    private static final Logger LOG = LoggerFactory.getLogger(RuleScheduler.class);

    private final Executor workers;
    private final Clock clock;
    private final double jitterRatio;
    private final Random random;
    private final RuleTask task;
    private final EngineMetrics metrics;

    private final Map<String, Entry> entries = new ConcurrentHashMap<>();
    private volatile boolean stopped;

    public RuleScheduler(Executor workers, Clock clock, double jitterRatio, Random random, RuleTask task,
            EngineMetrics metrics) {
        this.workers = Objects.requireNonNull(workers, "workers must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (jitterRatio < 0 || jitterRatio >= 1) {
            throw new IllegalArgumentException("jitterRatio must be in [0, 1), got: " + jitterRatio);
        }
        this.jitterRatio = jitterRatio;
        this.random = Objects.requireNonNull(random, "random must not be null");
        this.task = Objects.requireNonNull(task, "task must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
    }

    /**
     * Add a rule or replace the version of a scheduled one.
     *
     * <p>
     * A rule not seen before is due immediately. For a known rule whose
     * frequency changed, the next due time is recomputed from the start of its
     * last run; otherwise it is kept.
     * </p>
     *
     * @param rule rule to schedule
     */
    public void schedule(AlertRule rule) {
        Objects.requireNonNull(rule, "AlertRule must not be null");
        Instant now = clock.instant();
        entries.compute(rule.getId(), (id, existing) -> {
            if (existing == null) {
                LOG.debug("Scheduling rule [{}] every {} (due now)", id, rule.getEvaluationFrequency());
                return new Entry(rule, now);
            }
            Duration previous = existing.rule.getEvaluationFrequency();
            existing.rule = rule;
            if (!previous.equals(rule.getEvaluationFrequency()) && existing.lastStartedAt != null) {
                existing.nextDue = existing.lastStartedAt.plus(rule.getEvaluationFrequency());
                LOG.info("Rule [{}] frequency changed {} -> {}; next due {}", id, previous,
                        rule.getEvaluationFrequency(), existing.nextDue);
            }
            return existing;
        });
    }

    /**
     * Stop scheduling a rule. A run already in flight finishes normally.
     */
    public void unschedule(String ruleId) {
        if (entries.remove(ruleId) != null) {
            LOG.debug("Unscheduled rule [{}]", ruleId);
        }
    }

    /**
     * Submit every due, enabled rule.
     *
     * @return number of rules submitted
     */
    public int tick() {
        if (stopped) {
            return 0;
        }
        Instant now = clock.instant();
        int submitted = 0;
        for (Entry entry : entries.values()) {
            AlertRule rule = entry.rule;
            if (!rule.isEnabled() || now.isBefore(entry.nextDue)) {
                continue;
            }
            if (!entry.inFlight.compareAndSet(false, true)) {
                entry.nextDue = entry.nextDue.plus(rule.getEvaluationFrequency());
                metrics.recordSkip();
                LOG.debug("Rule [{}] still in flight; skipping until {}", rule.getId(), entry.nextDue);
                continue;
            }
            if (submit(entry, rule, now)) {
                submitted++;
            }
        }
        return submitted;
    }

    /**
     * Stop submitting work. In-flight evaluations finish their current
     * attempt.
     */
    public void stop() {
        stopped = true;
    }

    public boolean isStopped() {
        return stopped;
    }

    public Optional<Instant> nextDueAt(String ruleId) {
        Entry entry = entries.get(ruleId);
        return entry == null ? Optional.empty() : Optional.of(entry.nextDue);
    }

    public boolean isInFlight(String ruleId) {
        Entry entry = entries.get(ruleId);
        return entry != null && entry.inFlight.get();
    }

    public int size() {
        return entries.size();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private boolean submit(Entry entry, AlertRule rule, Instant now) {
        entry.lastStartedAt = now;
        try {
            workers.execute(() -> run(entry, rule, now));
            return true;
        } catch (RejectedExecutionException e) {
            entry.inFlight.set(false);
            LOG.warn("Worker pool rejected evaluation of rule [{}]: {}", rule.getId(), e.getMessage());
            return false;
        }
    }

    private void run(Entry entry, AlertRule rule, Instant startedAt) {
        try {
            task.run(rule);
        } catch (RuntimeException e) {
            LOG.error("Unexpected error evaluating rule [{}]", rule.getId(), e);
        } finally {
            entry.nextDue = startedAt.plus(jittered(entry.rule.getEvaluationFrequency()));
            entry.inFlight.set(false);
        }
    }

    Duration jittered(Duration frequency) {
        if (jitterRatio == 0) {
            return frequency;
        }
        double factor = 1 + jitterRatio * (2 * random.nextDouble() - 1);
        return Duration.ofMillis(Math.round(frequency.toMillis() * factor));
    }

    /** Scheduling state of one rule. */
    private static final class Entry {

        private volatile AlertRule rule;
        private volatile Instant nextDue;
        private volatile Instant lastStartedAt;
        private final AtomicBoolean inFlight = new AtomicBoolean();

        Entry(AlertRule rule, Instant nextDue) {
            this.rule = rule;
            this.nextDue = nextDue;
        }
    }
}
