/**
 * File-system helpers shared by the record store, key store and temporary workspace.
 */
package ca.gc.cra.trail.infrastructure.fs;
