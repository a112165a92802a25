/**
 * <strong>Purpose:</strong> Logging utilities that keep rendered arguments and values to a bounded size.
 * <p><strong>Concurrency:</strong> Stateless helpers.
 * <p><strong>Observability:</strong> Coordinates with SLF4J/Logback; no custom metrics.
 *
 * @since 0.1.0
 */
package ca.gc.cra.imagine.logging;
