/**
 * Local file log sink for offline deployments and tests.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.infrastructure.sink;
