/**
 * <strong>Purpose:</strong> Local infrastructure adapters: file persistence, keys, temp files, subprocesses,
 * metrics and the file sink.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.infrastructure;
