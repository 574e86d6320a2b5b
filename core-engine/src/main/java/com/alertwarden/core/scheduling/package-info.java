/**
 * Periodic, single-flight scheduling of rule evaluations on a bounded worker
 * pool.
 *
 * @since 1.0.0
 */
package com.alertwarden.core.scheduling;
