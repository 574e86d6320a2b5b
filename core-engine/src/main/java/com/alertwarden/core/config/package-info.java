/**
 * Loading and validation of the alerting configuration document.
 *
 * <p>
 * {@link com.alertwarden.core.config.ConfigLoader} parses YAML or JSON into a
 * {@link com.alertwarden.core.config.ConfigDocument};
 * {@link com.alertwarden.core.config.ConfigValidator} turns it into an
 * immutable {@link com.alertwarden.core.config.EngineConfig} or rejects the
 * whole document with a {@link com.alertwarden.core.config.ConfigException}.
 * </p>
 *
 * @since 1.0.0
 */
package com.alertwarden.core.config;
