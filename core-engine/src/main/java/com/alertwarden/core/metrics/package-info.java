/**
 * Micrometer meters for evaluations, transitions, notifications and the
 * scheduler.
 *
 * @since 1.0.0
 */
package com.alertwarden.core.metrics;
