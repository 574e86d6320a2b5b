package com.alertwarden.core.model;

/**
 * Lifecycle transitions that produce notifications.
 */
public enum AlertEventType {
    /** Pending to Firing. */
    FIRED,
    /** Re-notification of an ongoing episode after the re-notify interval. */
    STILL_FIRING,
    /** Firing to Resolved, automatically or manually. */
    RESOLVED
}
