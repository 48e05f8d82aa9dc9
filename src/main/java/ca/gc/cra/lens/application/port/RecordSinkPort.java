package ca.gc.cra.lens.application.port;

import ca.gc.cra.lens.domain.analysis.AnalysisRecord;

/**
 * <strong>What:</strong> Port for writing assembled per-message records.
 * <p><strong>Role:</strong> Output port on the sink side of the analyze pipeline.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Persist records in the order received.</li>
 *   <li>Flush buffered rows before the run reports success.</li>
 *   <li>Release file handles on close.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The pipeline calls sinks from a single thread.</p>
 *
 * @since 0.1.0
 */
public interface RecordSinkPort extends AutoCloseable {
  /**
   * Persists one record.
   *
   * @param record assembled row; never {@code null}
   * @throws Exception when the sink rejects the write
   */
  void persist(AnalysisRecord record) throws Exception;

  /**
   * Flushes buffered state.
   *
   * @throws Exception when flushing fails
   */
  default void flush() throws Exception {}

  @Override
  default void close() throws Exception {}
}
