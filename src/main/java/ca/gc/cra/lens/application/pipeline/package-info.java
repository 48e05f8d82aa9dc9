/**
 * Use cases that orchestrate the analyze pipeline.
 * <p><strong>Role:</strong> Application layer; loads, redacts, classifies, aggregates, assembles, and persists.</p>
 * <p><strong>Concurrency:</strong> Per-message work runs on a bounded pool; quality joins per conversation and
 * the temporal profile waits for every conversation.</p>
 * <p><strong>Observability:</strong> Emits {@code analyze.*} metrics and sets {@code pipeline} and
 * {@code conversationId} in the MDC.</p>
 */
package ca.gc.cra.lens.application.pipeline;
