package com.alertwarden.core.dispatch;

import com.alertwarden.core.model.NotificationAttempt;

/**
 * Receives dispatcher-level errors. Called on a delivery thread; must not
 * block.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface DispatchErrorListener {

    /** Listener that ignores every error. */
    DispatchErrorListener NONE = attempt -> { };

    /**
     * An attempt exhausted its retries.
     *
     * @param attempt the attempt in status {@code GIVEN_UP}
     */
    void onGivenUp(NotificationAttempt attempt);
}
