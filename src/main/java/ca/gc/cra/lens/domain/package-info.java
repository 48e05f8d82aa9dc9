/**
 * Immutable value types for conversations, labels, quality, and temporal aggregates.
 *
 * @since 0.1.0
 */
package ca.gc.cra.lens.domain;
