/**
 * OpenTelemetry implementation of the metrics port.
 */
package ca.gc.cra.docrelay.infrastructure.metrics;
