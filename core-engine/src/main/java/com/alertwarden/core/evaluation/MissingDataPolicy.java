package com.alertwarden.core.evaluation;

/**
 * How the state machine treats an evaluation that produced no value.
 */
public enum MissingDataPolicy {
    /** Neither breach nor clear: counters are left as they are. */
    NEITHER,
    /** Count the failed evaluation as a breach. */
    BREACH,
    /** Count the failed evaluation as a clear. */
    CLEAR
}
