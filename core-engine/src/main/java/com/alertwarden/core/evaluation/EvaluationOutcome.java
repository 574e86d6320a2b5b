package com.alertwarden.core.evaluation;

/**
 * Result kind of one rule evaluation.
 */
public enum EvaluationOutcome {
    BREACH,
    CLEAR,
    ERROR
}
