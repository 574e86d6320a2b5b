package com.alertwarden.core.evaluation;

import java.time.Instant;

/**
 * Evaluation health of one rule. {@code degraded} is the
 * {@code MonitoringDegraded} signal: the rule has failed to evaluate at least
 * the configured number of times in a row. It is diagnostics only and has no
 * effect on the rule's alert state.
 *
 * @since 1.0.0
 */
public final class RuleHealth {

    private final String ruleId;
    private final int consecutiveErrors;
    private final long totalErrors;
    private final long totalEvaluations;
    private final String lastError;
    private final Instant lastEvaluatedAt;
    private final Instant degradedSince;

    RuleHealth(String ruleId, int consecutiveErrors, long totalErrors, long totalEvaluations, String lastError,
            Instant lastEvaluatedAt, Instant degradedSince) {
        this.ruleId = ruleId;
        this.consecutiveErrors = consecutiveErrors;
        this.totalErrors = totalErrors;
        this.totalEvaluations = totalEvaluations;
        this.lastError = lastError;
        this.lastEvaluatedAt = lastEvaluatedAt;
        this.degradedSince = degradedSince;
    }

    static RuleHealth initial(String ruleId) {
        return new RuleHealth(ruleId, 0, 0, 0, null, null, null);
    }

    public String getRuleId() {
        return ruleId;
    }

    public int getConsecutiveErrors() {
        return consecutiveErrors;
    }

    public long getTotalErrors() {
        return totalErrors;
    }

    public long getTotalEvaluations() {
        return totalEvaluations;
    }

    public String getLastError() {
        return lastError;
    }

    public Instant getLastEvaluatedAt() {
        return lastEvaluatedAt;
    }

    public Instant getDegradedSince() {
        return degradedSince;
    }

    public boolean isDegraded() {
        return degradedSince != null;
    }

    @Override
    public String toString() {
        return "RuleHealth{" +
                "ruleId='" + ruleId + '\'' +
                ", consecutiveErrors=" + consecutiveErrors +
                ", totalErrors=" + totalErrors +
                ", degraded=" + isDegraded() +
                ", lastError='" + lastError + '\'' +
                '}';
    }
}
