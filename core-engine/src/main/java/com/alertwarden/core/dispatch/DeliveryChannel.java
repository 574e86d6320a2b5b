package com.alertwarden.core.dispatch;

import com.alertwarden.core.model.NotificationPayload;
import com.alertwarden.core.model.Receiver;

/**
 * Transport-level delivery collaborator.
 *
 * <p>
 * Implementations may block; the dispatcher bounds every call with the
 * dispatch timeout. The payload's
 * {@link NotificationPayload#getIdempotencyKey() idempotency key} lets an
 * implementation drop duplicates, since delivery is at-least-once.
 * </p>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface DeliveryChannel {

    /**
     * @param receiver target receiver
     * @param payload  normalized notification
     * @throws DeliveryException if the notification was not accepted
     */
    void deliver(Receiver receiver, NotificationPayload payload) throws DeliveryException;
}
