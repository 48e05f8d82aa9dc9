/**
 * Argument validation helpers shared by the CLI and configuration records.
 */
package ca.gc.cra.lens.validation;
