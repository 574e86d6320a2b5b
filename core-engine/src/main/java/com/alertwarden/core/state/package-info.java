/**
 * Alert lifecycle: Pending, Firing and Resolved, with hysteresis and
 * correlation-id based dedup.
 *
 * @since 1.0.0
 */
package com.alertwarden.core.state;
