/**
 * Ports between the analyze use case and its adapters: export reading, record sinks, summary writing, metrics.
 */
package ca.gc.cra.lens.application.port;
