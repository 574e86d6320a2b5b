/**
 * Domain model of the alerting engine.
 *
 * <ul>
 * <li>{@link com.alertwarden.core.model.AlertRule} and
 * {@link com.alertwarden.core.model.ActionGroup} are configuration: immutable,
 * validated on construction</li>
 * <li>{@link com.alertwarden.core.model.Receiver} is a closed set of
 * notification channel variants</li>
 * <li>{@link com.alertwarden.core.model.AlertInstance},
 * {@link com.alertwarden.core.model.AlertEvent} and
 * {@link com.alertwarden.core.model.NotificationAttempt} are runtime
 * state</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.alertwarden.core.model;
