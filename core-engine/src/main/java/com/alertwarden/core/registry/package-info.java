/**
 * Action group registry: named routing targets and receiver resolution with
 * snapshot-read semantics.
 *
 * @since 1.0.0
 */
package com.alertwarden.core.registry;
