/**
 * Command-line entry points for the {@code analyze} and {@code classify} subcommands.
 * <p><strong>Role:</strong> Driving adapters; parse {@code key=value} arguments, merge YAML settings, and map
 * failures to {@link ca.gc.cra.lens.api.ExitCode}.</p>
 * <p><strong>Security:</strong> Argument values are truncated before logging; message text never reaches logs.</p>
 */
package ca.gc.cra.lens.api;
