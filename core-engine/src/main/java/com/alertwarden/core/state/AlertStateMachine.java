package com.alertwarden.core.state;

import com.alertwarden.core.evaluation.Evaluation;
import com.alertwarden.core.evaluation.EvaluationOutcome;
import com.alertwarden.core.evaluation.MissingDataPolicy;
import com.alertwarden.core.model.AlertEvent;
import com.alertwarden.core.model.AlertEventType;
import com.alertwarden.core.model.AlertInstance;
import com.alertwarden.core.model.AlertRule;
import com.alertwarden.core.model.AlertState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Alert state machine.
 *
 * <p>
 * Turns a stream of per-rule evaluations into alert lifecycles:
 * </p>
 * <pre>
 *   PENDING --(N consecutive breaches)--&gt; FIRING --(M consecutive clears,
 *   autoMitigate)--&gt; RESOLVED --(next breach)--&gt; new PENDING episode
 * </pre>
 *
 * <h3>Dedup</h3>
 * <p>
 * A correlation id is minted once, on the transition to Firing, and is carried
 * by every event of the episode. Breaches while Firing emit nothing unless a
 * re-notify interval is configured and has elapsed since the last
 * notification, in which case a {@link AlertEventType#STILL_FIRING} is
 * emitted with the same correlation id.
 * </p>
 *
 * <h3>Concurrency</h3>
 * <p>
 * State is partitioned by rule id. Each rule has its own lock, so evaluating
 * rule A never blocks rule B, and the transitions of one rule are serialized.
 * Readers see the last published snapshot without locking.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertStateMachine {

    private static final Logger LOG = LoggerFactory.getLogger(AlertStateMachine.class);

    private final Clock clock;
    private final Supplier<String> correlationIds;
    private final Duration reNotifyInterval;
    private final MissingDataPolicy missingDataPolicy;

    private final Map<String, Slot> slots = new ConcurrentHashMap<>();

    /**
     * @param clock             source of transition timestamps
     * @param correlationIds    mints correlation ids; must never repeat
     * @param reNotifyInterval  re-notification interval while Firing, or
     *                          {@code null} to disable StillFiring
     * @param missingDataPolicy how evaluation errors count
     */
    public AlertStateMachine(Clock clock, Supplier<String> correlationIds, Duration reNotifyInterval,
            MissingDataPolicy missingDataPolicy) {
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.correlationIds = Objects.requireNonNull(correlationIds, "correlationIds must not be null");
        if (reNotifyInterval != null && (reNotifyInterval.isZero() || reNotifyInterval.isNegative())) {
            throw new IllegalArgumentException("reNotifyInterval must be positive, got: " + reNotifyInterval);
        }
        this.reNotifyInterval = reNotifyInterval;
        this.missingDataPolicy = Objects.requireNonNull(missingDataPolicy, "missingDataPolicy must not be null");
    }

    /**
     * Ensure a rule has a current instance. A rule seen for the first time
     * starts Pending with zeroed counters; a known rule keeps its instance.
     *
     * @param ruleId rule id
     * @return the rule's current instance
     */
    public AlertInstance register(String ruleId) {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Slot slot = slots.computeIfAbsent(ruleId, Slot::new);
        slot.lock.lock();
        try {
            if (slot.current == null) {
                slot.current = AlertInstance.pending(ruleId, slot.nextEpisode(), clock.instant());
            } else if (slot.retired) {
                LOG.info("Rule [{}] re-registered; resuming from {}", ruleId, slot.current.getState());
            }
            slot.retired = false;
            return slot.current;
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Retire a rule that was removed from the configuration. Its instance is
     * kept as is but no longer reported as firing; registering the rule again
     * resumes from it.
     *
     * @param ruleId rule id
     */
    public void retire(String ruleId) {
        Slot slot = slots.get(ruleId);
        if (slot == null) {
            return;
        }
        slot.lock.lock();
        try {
            if (slot.current != null && !slot.retired) {
                LOG.info("Rule [{}] retired in state {}", ruleId, slot.current.getState());
            }
            slot.retired = true;
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Apply one evaluation to the rule's lifecycle.
     *
     * @param rule       rule in force for this evaluation
     * @param evaluation evaluation result for the rule
     * @return the emitted event, if the evaluation caused a notifiable transition
     * @throws DedupViolationException if a second concurrent Firing instance
     *                                 would be minted
     */
    public Optional<AlertEvent> apply(AlertRule rule, Evaluation evaluation) {
        Objects.requireNonNull(rule, "AlertRule must not be null");
        Objects.requireNonNull(evaluation, "Evaluation must not be null");
        if (!rule.getId().equals(evaluation.getRuleId())) {
            throw new IllegalArgumentException("Evaluation of rule '" + evaluation.getRuleId()
                    + "' applied to rule '" + rule.getId() + "'");
        }

        Slot slot = slots.computeIfAbsent(rule.getId(), Slot::new);
        slot.lock.lock();
        try {
            if (slot.current == null) {
                slot.current = AlertInstance.pending(rule.getId(), slot.nextEpisode(), clock.instant());
            }
            if (!rule.isEnabled()) {
                LOG.trace("Rule [{}] is disabled; instance frozen in {}", rule.getId(), slot.current.getState());
                return Optional.empty();
            }
            return transition(slot, rule, evaluation);
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * Resolve a Firing instance on external acknowledgment. Does nothing
     * unless the rule is currently Firing; works whether or not the rule is
     * enabled or auto-mitigating.
     *
     * @param rule rule to resolve
     * @return the {@link AlertEventType#RESOLVED} event, if a transition happened
     */
    public Optional<AlertEvent> manualResolve(AlertRule rule) {
        Objects.requireNonNull(rule, "AlertRule must not be null");
        Slot slot = slots.get(rule.getId());
        if (slot == null) {
            return Optional.empty();
        }
        slot.lock.lock();
        try {
            AlertInstance current = slot.current;
            if (current == null || current.getState() != AlertState.FIRING) {
                LOG.debug("Manual resolve of rule [{}] ignored: not firing", rule.getId());
                return Optional.empty();
            }
            Instant now = clock.instant();
            AlertInstance resolved = current.toBuilder()
                    .state(AlertState.RESOLVED)
                    .resolvedAt(now)
                    .build();
            slot.current = resolved;
            LOG.info("Rule [{}] manually resolved (correlationId={})", rule.getId(), resolved.getCorrelationId());
            return Optional.of(new AlertEvent(AlertEventType.RESOLVED, rule, resolved, now));
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * @return the rule's current instance, or empty if the rule is unknown
     */
    public Optional<AlertInstance> current(String ruleId) {
        Slot slot = slots.get(ruleId);
        return slot == null ? Optional.empty() : Optional.ofNullable(slot.current);
    }

    /**
     * @return superseded instances of the rule, oldest first
     */
    public List<AlertInstance> history(String ruleId) {
        Slot slot = slots.get(ruleId);
        if (slot == null) {
            return List.of();
        }
        slot.lock.lock();
        try {
            return List.copyOf(slot.history);
        } finally {
            slot.lock.unlock();
        }
    }

    /**
     * @return every current instance in state Firing, ordered by fire time
     */
    public List<AlertInstance> firing() {
        return slots.values().stream()
                .filter(slot -> !slot.retired)
                .map(slot -> slot.current)
                .filter(instance -> instance != null && instance.isFiring())
                .sorted(Comparator.comparing(AlertInstance::getFiredAt))
                .toList();
    }

    // ---------------------------------------------------------------
    // Transitions
    // ---------------------------------------------------------------

    private Optional<AlertEvent> transition(Slot slot, AlertRule rule, Evaluation evaluation) {
        Instant now = evaluation.getEvaluatedAt();
        EvaluationOutcome outcome = effectiveOutcome(evaluation);
        AlertInstance current = slot.current;

        if (outcome == EvaluationOutcome.ERROR) {
            // counters untouched, the pending window is extended
            slot.current = current.toBuilder().lastEvaluatedAt(now).build();
            return Optional.empty();
        }
        boolean breach = outcome == EvaluationOutcome.BREACH;

        return switch (current.getState()) {
            case PENDING -> onPending(slot, rule, current, breach, evaluation);
            case FIRING -> onFiring(slot, rule, current, breach, evaluation);
            case RESOLVED -> {
                if (!breach) {
                    slot.current = touched(current, evaluation).build();
                    yield Optional.empty();
                }
                // a resolved episode is never reused
                slot.history.add(current);
                AlertInstance next = AlertInstance.pending(rule.getId(), slot.nextEpisode(), now);
                LOG.debug("Rule [{}]: breach after resolution opens episode {}", rule.getId(), next.getEpisode());
                yield onPending(slot, rule, next, true, evaluation);
            }
        };
    }

    private Optional<AlertEvent> onPending(Slot slot, AlertRule rule, AlertInstance current, boolean breach,
            Evaluation evaluation) {
        Instant now = evaluation.getEvaluatedAt();
        AlertInstance.Builder next = touched(current, evaluation);
        if (!breach) {
            slot.current = next
                    .consecutiveBreaches(0)
                    .consecutiveClears(current.getConsecutiveClears() + 1)
                    .firstBreachAt(null)
                    .build();
            return Optional.empty();
        }

        int breaches = current.getConsecutiveBreaches() + 1;
        next.consecutiveBreaches(breaches)
                .consecutiveClears(0)
                .firstBreachAt(current.getConsecutiveBreaches() == 0 ? now : current.getFirstBreachAt());

        if (breaches < rule.getConsecutiveBreachesToFire()) {
            slot.current = next.build();
            LOG.debug("Rule [{}]: breach {}/{} while pending", rule.getId(), breaches,
                    rule.getConsecutiveBreachesToFire());
            return Optional.empty();
        }

        ensureNoActiveFiring(slot, rule.getId());
        AlertInstance fired = next
                .state(AlertState.FIRING)
                .correlationId(correlationIds.get())
                .firedAt(now)
                .lastNotifiedAt(now)
                .build();
        slot.current = fired;
        LOG.info("Rule [{}] FIRED after {} consecutive breach(es): value={} {} {} (correlationId={})",
                rule.getId(), breaches, evaluation.getValue(), rule.getComparator(), rule.getThreshold(),
                fired.getCorrelationId());
        return Optional.of(new AlertEvent(AlertEventType.FIRED, rule, fired, now));
    }

    private Optional<AlertEvent> onFiring(Slot slot, AlertRule rule, AlertInstance current, boolean breach,
            Evaluation evaluation) {
        Instant now = evaluation.getEvaluatedAt();
        AlertInstance.Builder next = touched(current, evaluation);

        if (breach) {
            next.consecutiveBreaches(current.getConsecutiveBreaches() + 1).consecutiveClears(0);
            if (reNotifyDue(current, now)) {
                AlertInstance stillFiring = next.lastNotifiedAt(now).build();
                slot.current = stillFiring;
                LOG.info("Rule [{}] still firing (correlationId={})", rule.getId(), stillFiring.getCorrelationId());
                return Optional.of(new AlertEvent(AlertEventType.STILL_FIRING, rule, stillFiring, now));
            }
            slot.current = next.build();
            return Optional.empty();
        }

        int clears = current.getConsecutiveClears() + 1;
        next.consecutiveClears(clears).consecutiveBreaches(0);
        if (clears < rule.getConsecutiveClearsToResolve() || !rule.isAutoMitigate()) {
            slot.current = next.build();
            if (clears >= rule.getConsecutiveClearsToResolve()) {
                LOG.debug("Rule [{}] is clear but not auto-mitigated; awaiting manual resolve", rule.getId());
            }
            return Optional.empty();
        }

        AlertInstance resolved = next
                .state(AlertState.RESOLVED)
                .resolvedAt(now)
                .build();
        slot.current = resolved;
        LOG.info("Rule [{}] RESOLVED after {} consecutive clear(s) (correlationId={})",
                rule.getId(), clears, resolved.getCorrelationId());
        return Optional.of(new AlertEvent(AlertEventType.RESOLVED, rule, resolved, now));
    }

    private EvaluationOutcome effectiveOutcome(Evaluation evaluation) {
        if (!evaluation.isError()) {
            return evaluation.getOutcome();
        }
        return switch (missingDataPolicy) {
            case BREACH -> EvaluationOutcome.BREACH;
            case CLEAR -> EvaluationOutcome.CLEAR;
            case NEITHER -> EvaluationOutcome.ERROR;
        };
    }

    private boolean reNotifyDue(AlertInstance current, Instant now) {
        if (reNotifyInterval == null) {
            return false;
        }
        Instant last = current.getLastNotifiedAt() != null ? current.getLastNotifiedAt() : current.getFiredAt();
        return !now.isBefore(last.plus(reNotifyInterval));
    }

    private static AlertInstance.Builder touched(AlertInstance current, Evaluation evaluation) {
        AlertInstance.Builder builder = current.toBuilder().lastEvaluatedAt(evaluation.getEvaluatedAt());
        if (evaluation.getValue() != null) {
            builder.lastValue(evaluation.getValue());
        }
        return builder;
    }

    private static void ensureNoActiveFiring(Slot slot, String ruleId) {
        if (slot.current != null && slot.current.getState() == AlertState.FIRING) {
            throw new DedupViolationException(ruleId,
                    "instance " + slot.current.getCorrelationId() + " is already firing");
        }
        for (AlertInstance archived : slot.history) {
            if (archived.getState() != AlertState.RESOLVED) {
                throw new DedupViolationException(ruleId,
                        "superseded instance " + archived.getCorrelationId() + " was never resolved");
            }
        }
    }

    /** Per-rule lifecycle slot. */
    private static final class Slot {

        private final ReentrantLock lock = new ReentrantLock();
        private final List<AlertInstance> history = new ArrayList<>();
        private volatile AlertInstance current;
        private volatile boolean retired;
        private int episodes;

        Slot(String ruleId) {
            LOG.trace("Creating lifecycle slot for rule [{}]", ruleId);
        }

        int nextEpisode() {
            return ++episodes;
        }
    }
}
