/**
 * PII redaction and consistent pseudonymization. Runs before any other stage reads message text.
 * <p><strong>Concurrency:</strong> The pseudonym table is the only shared mutable state of a run and relies on
 * {@code computeIfAbsent}.</p>
 */
package ca.gc.cra.lens.application.privacy;
