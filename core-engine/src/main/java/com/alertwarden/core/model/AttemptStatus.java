package com.alertwarden.core.model;

/**
 * Delivery status of a {@link NotificationAttempt}.
 */
public enum AttemptStatus {
    PENDING,
    SENT,
    FAILED,
    GIVEN_UP;

    /**
     * @return {@code true} for statuses that never change again
     */
    public boolean isTerminal() {
        return this == SENT || this == GIVEN_UP;
    }
}
