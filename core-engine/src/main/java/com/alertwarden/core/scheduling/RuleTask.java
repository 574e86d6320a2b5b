package com.alertwarden.core.scheduling;

import com.alertwarden.core.model.AlertRule;

/**
 * Work the scheduler runs for a due rule.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface RuleTask {

    /**
     * Evaluate the rule once and apply the result. Called on a worker thread;
     * never concurrently for the same rule.
     *
     * @param rule the rule version that was scheduled
     */
    void run(AlertRule rule);
}
