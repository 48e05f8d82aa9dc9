/**
 * File sinks: {@code records.ndjson} (one analysis row per line) and {@code summary.json}.
 * <p><strong>Concurrency:</strong> The record sink serializes writes; close failures are aggregated and
 * rethrown.</p>
 */
package ca.gc.cra.lens.infrastructure.persistence;
