package com.alertwarden.core.evaluation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Tracks consecutive evaluation errors per rule and raises
 * {@code MonitoringDegraded} once a rule reaches the threshold.
 *
 * <p>
 * Thread-safe. Each rule's record is replaced atomically with
 * {@link ConcurrentHashMap#compute}.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleHealthTracker {

    private static final Logger LOG = LoggerFactory.getLogger(RuleHealthTracker.class);

    private final int degradedThreshold;
    private final Map<String, RuleHealth> health = new ConcurrentHashMap<>();

    /**
     * @param degradedThreshold consecutive errors at which a rule is degraded
     *                          (inclusive); must be &gt;= 1
     */
    public RuleHealthTracker(int degradedThreshold) {
        if (degradedThreshold < 1) {
            throw new IllegalArgumentException("degradedThreshold must be >= 1, got: " + degradedThreshold);
        }
        this.degradedThreshold = degradedThreshold;
    }

    /**
     * Record an evaluation.
     *
     * @param evaluation the result
     * @return {@code true} if this evaluation made the rule degraded
     */
    public boolean record(Evaluation evaluation) {
        boolean[] becameDegraded = new boolean[1];
        boolean[] recovered = new boolean[1];
        health.compute(evaluation.getRuleId(), (ruleId, previous) -> {
            RuleHealth current = previous != null ? previous : RuleHealth.initial(ruleId);
            if (!evaluation.isError()) {
                recovered[0] = current.isDegraded();
                return new RuleHealth(ruleId, 0, current.getTotalErrors(), current.getTotalEvaluations() + 1,
                        current.getLastError(), evaluation.getEvaluatedAt(), null);
            }
            int errors = current.getConsecutiveErrors() + 1;
            boolean degraded = errors >= degradedThreshold;
            becameDegraded[0] = degraded && !current.isDegraded();
            return new RuleHealth(ruleId, errors, current.getTotalErrors() + 1, current.getTotalEvaluations() + 1,
                    evaluation.getError().getReason() + ": " + evaluation.getError().getMessage(),
                    evaluation.getEvaluatedAt(),
                    degraded ? (current.isDegraded() ? current.getDegradedSince() : evaluation.getEvaluatedAt())
                            : null);
        });

        if (becameDegraded[0]) {
            LOG.warn("MonitoringDegraded: rule [{}] failed {} consecutive evaluation(s)",
                    evaluation.getRuleId(), degradedThreshold);
        } else if (recovered[0]) {
            LOG.info("Rule [{}] recovered from degraded monitoring", evaluation.getRuleId());
        }
        return becameDegraded[0];
    }

    public Optional<RuleHealth> health(String ruleId) {
        return Optional.ofNullable(health.get(ruleId));
    }

    public boolean isDegraded(String ruleId) {
        return health(ruleId).map(RuleHealth::isDegraded).orElse(false);
    }

    /**
     * @param ruleIds rules to consider
     * @return health of the given rules that are currently degraded
     */
    public List<RuleHealth> degraded(Collection<String> ruleIds) {
        return ruleIds.stream()
                .map(health::get)
                .filter(h -> h != null && h.isDegraded())
                .toList();
    }

    /**
     * Drop the record of a rule that is no longer configured.
     */
    public void forget(String ruleId) {
        health.remove(ruleId);
    }
}
