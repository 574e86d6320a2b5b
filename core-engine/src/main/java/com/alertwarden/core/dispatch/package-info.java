/**
 * Notification routing and at-least-once delivery with retry.
 *
 * <p>
 * The engine owns only the client side of delivery: it builds a
 * {@link com.alertwarden.core.model.NotificationPayload} and hands it to a
 * {@link com.alertwarden.core.dispatch.DeliveryChannel}, observing success or
 * failure.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertwarden.core.dispatch;
