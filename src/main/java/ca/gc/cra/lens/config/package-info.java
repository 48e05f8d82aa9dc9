/**
 * Configuration records, YAML loading, and merge rules (CLI over YAML over defaults).
 * <p><strong>Role:</strong> Translates operator input into validated {@code AnalyzeConfig} instances and wires
 * adapters in {@code CompositionRoot}.</p>
 */
package ca.gc.cra.lens.config;
