/**
 * <strong>Purpose:</strong> The override engine: wrapped callables, point builders, and the activations that install
 * and restore override chains.
 * <p><strong>Concurrency:</strong> Single-threaded by contract. Cursors are unsynchronized; concurrent activation on
 * one callable loses or reorders restores.
 * <p><strong>Observability:</strong> SLF4J at DEBUG (scope changes) and TRACE (lookups); counters through
 * {@link ca.gc.cra.imagine.application.port.MetricsPort}, plus a chain-length histogram per entry.
 *
 * @since 0.1.0
 */
package ca.gc.cra.imagine.application.engine;
