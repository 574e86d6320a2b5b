package com.alertwarden.core.model;

/**
 * Lifecycle state of an {@link AlertInstance}.
 *
 * <pre>
 *   PENDING --(N consecutive breaches)--&gt; FIRING --(M consecutive clears,
 *   auto-mitigate or manual resolve)--&gt; RESOLVED
 * </pre>
 *
 * {@code RESOLVED} is terminal for an episode: the next breach starts a new
 * instance in {@code PENDING}.
 */
public enum AlertState {
    PENDING,
    FIRING,
    RESOLVED
}
