/**
 * OpenTelemetry-backed metrics for the analyze pipeline.
 * <p><strong>Concurrency:</strong> Instruments are cached and safe for concurrent updates from worker threads.</p>
 * <p><strong>Metrics:</strong> Publishes {@code analyze.*} counters and the {@code analyze.duration.ms} histogram.</p>
 * <p><strong>Security:</strong> Only counts are exported; message content never becomes an attribute.</p>
 */
package ca.gc.cra.lens.infrastructure.metrics;
