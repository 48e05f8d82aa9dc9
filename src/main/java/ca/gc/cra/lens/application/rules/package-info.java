/**
 * Ordered pattern tables: YAML loading, registration through {@code TaxonomyBuilder}, and the sealed
 * {@code CompiledTaxonomy} shared read-only by every worker.
 */
package ca.gc.cra.lens.application.rules;
