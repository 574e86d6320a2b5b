/**
 * Alert Warden service process.
 *
 * <p>
 * This package wires the core alerting engine to an HTTP telemetry backend
 * and a logging delivery channel, and exposes health and diagnostics over
 * HTTP.
 * </p>
 *
 * <h3>Key Classes</h3>
 * <ul>
 * <li>{@link com.alertwarden.service.WardenService} - main entry point</li>
 * <li>{@link com.alertwarden.service.ServiceConfig} - environment-driven
 * configuration</li>
 * <li>{@link com.alertwarden.service.HttpTelemetrySource} - aggregate query
 * client</li>
 * <li>{@link com.alertwarden.service.HealthServer} - HTTP health, readiness and
 * diagnostics endpoints</li>
 * <li>{@link com.alertwarden.service.ConfigWatcher} - hot reload of the
 * alerting document</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.alertwarden.service;
