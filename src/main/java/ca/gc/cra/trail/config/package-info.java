/**
 * <strong>Purpose:</strong> Configuration loading (defaults, YAML, CLI), typed configuration records and the
 * composition root.
 * <p><strong>Precedence:</strong> CLI {@code key=value} over YAML over {@link ca.gc.cra.trail.config.DefaultsForMode}.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.config;
