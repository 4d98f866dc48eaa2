/**
 * <strong>Purpose:</strong> Command-line adapters for TRAIL.
 * <p><strong>Pipeline role:</strong> Outermost layer; parses {@code key=value} arguments and flags, resolves the
 * effective configuration, and hands off to use cases built by {@link ca.gc.cra.trail.config.CompositionRoot}.</p>
 * <p><strong>Output:</strong> Results go to stdout via {@link ca.gc.cra.trail.api.CliPrinter}; diagnostics go to
 * the log (stderr).</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.api;
