/**
 * Logging helpers: runtime verbosity control and bounded log values.
 *
 * @since 0.1.0
 */
package ca.gc.cra.lens.logging;
