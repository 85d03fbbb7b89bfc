/**
 * OpenTelemetry-backed metrics adapter.
 */
package ca.gc.cra.lumen.infrastructure.metrics;
