/**
 * Port to the external AI assistant invoked by the {@code exec} command.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.application.port.assistant;
