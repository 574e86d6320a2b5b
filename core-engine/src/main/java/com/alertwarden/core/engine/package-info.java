/**
 * Engine facade: configuration activation and reload, queries over alert
 * state, and the scheduling lifecycle.
 *
 * <p>
 * Entry point is {@link com.alertwarden.core.engine.AlertingEngine}; its two
 * collaborators are a
 * {@link com.alertwarden.core.evaluation.TelemetrySource} and a
 * {@link com.alertwarden.core.dispatch.DeliveryChannel}.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertwarden.core.engine;
