/**
 * Secure scoped temporary files.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.infrastructure.temp;
