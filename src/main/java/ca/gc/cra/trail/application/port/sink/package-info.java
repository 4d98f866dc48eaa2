/**
 * Log sink port and its failure taxonomy.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.application.port.sink;
