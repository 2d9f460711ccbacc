/**
 * OpenTelemetry implementation of the metrics port.
 * <p><strong>Metrics:</strong> Publishes the {@code config.resolve.*} family.</p>
 */
package ca.gc.cra.beacon.infrastructure.metrics;
