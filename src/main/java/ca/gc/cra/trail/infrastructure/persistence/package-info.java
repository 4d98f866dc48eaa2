/**
 * <strong>Purpose:</strong> File-system persistence of audit records, chain state and delivery bookkeeping.
 * <p><strong>Pipeline role:</strong> Implements the store ports used by record creation and delivery.
 * <p><strong>Layout:</strong> {@code <store>/*.json} pending, {@code <store>/processed/*.json} delivered,
 * {@code <store>/.chain/} lock files, state, journal and halt marker.
 *
 * @since 0.1.0
 */
package ca.gc.cra.trail.infrastructure.persistence;
