/**
 * <strong>Purpose:</strong> Value types describing a single call into an overridable callable.
 * <p><strong>Concurrency:</strong> Immutable records; safe to share.
 * <p><strong>Performance:</strong> Containers copied once at construction.
 *
 * @since 0.1.0
 */
package ca.gc.cra.imagine.domain.call;
